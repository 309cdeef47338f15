package com.paperharvest.backend.translation;

import com.paperharvest.backend.article.ArticleStore;
import com.paperharvest.backend.model.entity.Article;
import com.paperharvest.backend.model.enums.ArticleStatus;
import com.paperharvest.backend.resilience.RateLimiter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TranslationPoolTest {

    private static final String BILINGUAL = "diffusion model（扩散模型）";

    @Mock
    private ArticleStore articleStore;

    private Glossary glossary;
    private final Map<String, String> stored = new ConcurrentHashMap<>();
    private final List<GlossaryTerm> rendered = new CopyOnWriteArrayList<>();

    /**
     * Stands in for the model: translates every occurrence of "diffusion model" bilingually,
     * whatever the context says, and records peak concurrency
     */
    static class FakeModel implements TranslationClient {
        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger peak = new AtomicInteger();
        final List<TranslationContext> contexts = new CopyOnWriteArrayList<>();
        final long delayMillis;

        FakeModel(long delayMillis) {
            this.delayMillis = delayMillis;
        }

        @Override
        public String translate(String text, TranslationContext context) {
            calls.incrementAndGet();
            contexts.add(context);
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            if (text.contains("fail")) {
                throw TranslationException.permanent("model rejected input", null);
            }
            return "译文：" + text.replaceAll("(?i)diffusion model", BILINGUAL);
        }
    }

    @BeforeEach
    void setUp() {
        glossary = new Glossary();
        lenient().when(articleStore.updateTranslation(anyString(), anyString())).thenAnswer(inv -> {
            stored.put(inv.getArgument(0), inv.getArgument(1));
            return Article.builder()
                    .articleUrl(inv.getArgument(0))
                    .abstractZh(inv.getArgument(1))
                    .status(ArticleStatus.TRANSLATED)
                    .build();
        });
        lenient().when(articleStore.findCachedTranslation(anyString())).thenReturn(Optional.empty());
    }

    private TranslationPool pool(TranslationClient client) {
        return TranslationPool.builder()
                .translationClient(client)
                .termSegmenter(new KeywordTermSegmenter(List.of("diffusion model"), false))
                .glossary(glossary)
                .renderer(new TerminologyRenderer())
                .articleStore(articleStore)
                .retryPolicy(TranslationPool.retryPolicy(3, 1, 0.0))
                .rateLimiter(RateLimiter.unlimited())
                .model("test-model")
                .targetLanguage("简体中文")
                .onTermRendered(rendered::add)
                .build();
    }

    private static Article article(String url, String abstractEn) {
        return Article.builder()
                .articleUrl(url)
                .abstractEn(abstractEn)
                .status(ArticleStatus.FETCHED)
                .build();
    }

    private static int count(String text, String needle) {
        Matcher m = Pattern.compile(Pattern.quote(needle)).matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    @Nested
    @DisplayName("glossary consistency")
    class GlossaryConsistency {

        @Test
        @DisplayName("Should introduce a shared term bilingually in exactly one abstract")
        void shouldRenderFirstOccurrenceOnce() {
            List<Article> articles = List.of(
                    article("https://x.org/a", "A diffusion model for images. The diffusion model is fast."),
                    article("https://x.org/b", "We improve the diffusion model sampler."));

            List<TranslationOutcome> outcomes = pool(new FakeModel(20)).translateAll(articles, 2);

            assertThat(outcomes).allMatch(TranslationOutcome::isSuccess);
            int bilingual = stored.values().stream().mapToInt(t -> count(t, BILINGUAL)).sum();
            assertThat(bilingual).isEqualTo(1);
            assertThat(stored.values()).allSatisfy(t -> assertThat(t).contains("diffusion model"));
            assertThat(rendered).singleElement().satisfies(term -> {
                assertThat(term.getNormalizedTerm()).isEqualTo("diffusion model");
                assertThat(term.getRendering()).isEqualTo("扩散模型");
            });
        }

        @Test
        @DisplayName("Should hold across many concurrent abstracts")
        void shouldRenderOnceAcrossMany() {
            List<Article> articles = IntStream.range(0, 12)
                    .mapToObj(i -> article("https://x.org/" + i, "Paper " + i + " uses a diffusion model."))
                    .collect(Collectors.toList());

            pool(new FakeModel(5)).translateAll(articles, 4);

            assertThat(stored).hasSize(12);
            assertThat(stored.values().stream().filter(t -> t.contains(BILINGUAL))).hasSize(1);
        }

        @Test
        @DisplayName("Should tell the model which terms were introduced elsewhere")
        void shouldPassMonolingualTerms() {
            glossary.reload(List.of(Glossary.restored("diffusion model", "https://x.org/old", "扩散模型")));
            FakeModel model = new FakeModel(0);

            pool(model).translateAll(List.of(article("https://x.org/a", "A diffusion model.")), 1);

            assertThat(model.contexts).singleElement().satisfies(ctx -> {
                assertThat(ctx.getBilingualTerms()).isEmpty();
                assertThat(ctx.getMonolingualTerms()).containsExactly("diffusion model");
            });
            assertThat(stored.get("https://x.org/a")).doesNotContain("（");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("Should record a failure and keep translating the rest")
        void shouldContinueAfterFailure() {
            List<Article> articles = List.of(
                    article("https://x.org/a", "First abstract."),
                    article("https://x.org/b", "This one will fail."),
                    article("https://x.org/c", "Third abstract."));

            List<TranslationOutcome> outcomes = pool(new FakeModel(1)).translateAll(articles, 2);

            assertThat(outcomes).hasSize(3);
            assertThat(outcomes.stream().filter(o -> !o.isSuccess()).map(TranslationOutcome::getUrl))
                    .containsExactly("https://x.org/b");
            verify(articleStore).markTranslateFailed(eq("https://x.org/b"), anyString());
            verify(articleStore, never()).markTranslateFailed(eq("https://x.org/a"), anyString());
        }

        @Test
        @DisplayName("Should count an error without a message as a failure")
        void shouldCountMessagelessErrorAsFailure() {
            TranslationClient broken = (text, ctx) -> {
                throw new IllegalStateException();
            };

            List<TranslationOutcome> outcomes = pool(broken).translateAll(List.of(article("https://x.org/a", "Text.")), 1);

            assertThat(outcomes).singleElement().satisfies(o -> {
                assertThat(o.isSuccess()).isFalse();
                assertThat(o.getFailureReason()).isEqualTo("IllegalStateException");
            });
            verify(articleStore).markTranslateFailed("https://x.org/a", "IllegalStateException");
            assertThat(stored).isEmpty();
        }

        @Test
        @DisplayName("Should release the term when its introducing abstract fails")
        void shouldReleaseTermOnFailure() {
            pool(new FakeModel(0)).translateAll(List.of(article("https://x.org/b", "A diffusion model that will fail.")), 1);

            assertThat(glossary.lookup("diffusion model")).isEmpty();
        }

        @Test
        @DisplayName("Should retry transient model failures")
        void shouldRetryTransientFailures() {
            AtomicInteger attempts = new AtomicInteger();
            TranslationClient flaky = (text, ctx) -> {
                if (attempts.incrementAndGet() < 3) {
                    throw TranslationException.transientFailure("429 Too Many Requests", null);
                }
                return "译文";
            };

            List<TranslationOutcome> outcomes = pool(flaky).translateAll(List.of(article("https://x.org/a", "Text.")), 1);

            assertThat(outcomes).singleElement().matches(TranslationOutcome::isSuccess);
            assertThat(attempts.get()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should not retry permanent model failures")
        void shouldNotRetryPermanentFailures() {
            FakeModel model = new FakeModel(0);

            pool(model).translateAll(List.of(article("https://x.org/a", "This will fail.")), 1);

            assertThat(model.calls.get()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should never run more model calls at once than the worker count")
    void shouldBoundConcurrency() {
        FakeModel model = new FakeModel(30);
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            articles.add(article("https://x.org/" + i, "Abstract " + i + "."));
        }

        List<TranslationOutcome> outcomes = pool(model).translateAll(articles, 3);

        assertThat(outcomes).hasSize(10);
        assertThat(model.peak.get()).isLessThanOrEqualTo(3);
    }

    @Test
    @DisplayName("Should reuse a stored translation of an identical abstract")
    void shouldUseCachedTranslation() {
        lenient().when(articleStore.findCachedTranslation(anyString())).thenReturn(Optional.of("已有译文"));
        FakeModel model = new FakeModel(0);

        List<TranslationOutcome> outcomes = pool(model).translateAll(List.of(article("https://x.org/a", "Same text.")), 1);

        assertThat(outcomes).singleElement().matches(TranslationOutcome::isFromCache);
        assertThat(model.calls.get()).isZero();
        assertThat(stored).containsEntry("https://x.org/a", "已有译文");
    }
}
