package com.paperharvest.backend.translation;

import com.paperharvest.backend.article.ArticleStore;
import com.paperharvest.backend.article.StorageException;
import com.paperharvest.backend.config.AsyncConfig;
import com.paperharvest.backend.model.entity.Article;
import com.paperharvest.backend.resilience.RateLimiter;
import com.paperharvest.backend.resilience.RetryPolicy;
import com.paperharvest.backend.util.TextUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Translates stored abstracts on a fixed number of workers while keeping term annotations
 * consistent through the shared {@link Glossary}
 */
@Slf4j
@Builder
public class TranslationPool {

    private final TranslationClient translationClient;
    private final TermSegmenter termSegmenter;
    private final Glossary glossary;
    private final TerminologyRenderer renderer;
    private final ArticleStore articleStore;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final String model;
    private final String targetLanguage;
    // Called once per term whose rendering was fixed during the run
    private final Consumer<GlossaryTerm> onTermRendered;

    public static RetryPolicy retryPolicy(int maxAttempts, long baseDelayMillis, double jitter) {
        return new RetryPolicy("translate", maxAttempts, Duration.ofMillis(baseDelayMillis), jitter,
                e -> e instanceof TranslationException && ((TranslationException) e).isRetryable());
    }

    public List<TranslationOutcome> translateAll(List<Article> articles, int concurrency) {
        List<TranslationOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
        translateAll(articles, concurrency, new AtomicBoolean(false), outcomes::add);
        return new ArrayList<>(outcomes);
    }

    /**
     * Translate {@code articles} with at most {@code concurrency} calls in flight. Articles not yet
     * started when {@code cancelled} is set are left pending. {@code sink} is called from worker threads.
     */
    public void translateAll(List<Article> articles, int concurrency, AtomicBoolean cancelled,
                             Consumer<TranslationOutcome> sink) {
        ThreadPoolTaskExecutor executor = AsyncConfig.workerPool("Translate-", concurrency);
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        try {
            for (Article article : articles) {
                futures.add(CompletableFuture.runAsync(() -> {
                    if (cancelled.get()) return;
                    sink.accept(translateOne(article));
                }, executor));
            }
        } finally {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            executor.shutdown();
        }
    }

    TranslationOutcome translateOne(Article article) {
        String url = article.getArticleUrl();
        String abstractEn = TextUtils.cleanText(article.getAbstractEn());
        if (abstractEn == null) {
            return fail(url, "No English abstract");
        }

        try {
            List<TermClaim> claims = termSegmenter.segment(abstractEn).stream()
                    .map(term -> glossary.claim(term, url))
                    .collect(Collectors.toList());

            String hash = article.getAbstractEnHash() != null ? article.getAbstractEnHash() : TextUtils.sha256(abstractEn);
            Optional<String> cached = articleStore.findCachedTranslation(hash);
            String raw;
            if (cached.isPresent()) {
                raw = cached.get();
            } else {
                TranslationContext context = new TranslationContext(model, targetLanguage,
                        terms(claims, true), terms(claims, false));
                raw = retryPolicy.execute(() -> {
                    rateLimiter.acquire();
                    return translationClient.translate(abstractEn, context);
                });
            }

            TerminologyRenderer.RenderedText rendered = renderer.render(raw, claims);
            if (rendered.getText().isEmpty()) {
                throw TranslationException.permanent("Empty translation", null);
            }

            Article saved = articleStore.updateTranslation(url, rendered.getText());
            rendered.getRenderings().forEach((term, zh) ->
                    glossary.assignRendering(term, url, zh).ifPresent(this::termRendered));
            log.info("{}: {}", cached.isPresent() ? "Reused cached translation" : "Translated",
                    article.getTitle() != null ? article.getTitle() : url);
            return TranslationOutcome.translated(saved, cached.isPresent());
        } catch (TranslationException | StorageException e) {
            return fail(url, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error translating {}: {}", url, TextUtils.describe(e), e);
            return fail(url, TextUtils.describe(e));
        } finally {
            glossary.releaseUnrendered(url);
        }
    }

    private void termRendered(GlossaryTerm term) {
        if (onTermRendered == null) return;
        try {
            onTermRendered.accept(term);
        } catch (Exception e) {
            log.error("Could not persist glossary term {}: {}", term.getSourceTerm(), e.getMessage());
        }
    }

    private TranslationOutcome fail(String url, String reason) {
        log.warn("Translation failed for {}: {}", url, reason);
        try {
            articleStore.markTranslateFailed(url, reason);
        } catch (StorageException e) {
            log.error("Could not record translation failure for {}: {}", url, e.getMessage());
        }
        return TranslationOutcome.failed(url, reason);
    }

    private static List<String> terms(List<TermClaim> claims, boolean firstOccurrence) {
        return claims.stream()
                .filter(c -> c.isFirstOccurrence() == firstOccurrence)
                .map(TermClaim::getTerm)
                .collect(Collectors.toList());
    }
}
