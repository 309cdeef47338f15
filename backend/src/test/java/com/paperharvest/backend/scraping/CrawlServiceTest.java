package com.paperharvest.backend.scraping;

import com.paperharvest.backend.article.ArticleStore;
import com.paperharvest.backend.article.StorageException;
import com.paperharvest.backend.config.CrawlConfig;
import com.paperharvest.backend.model.dto.CrawlRequestDTO;
import com.paperharvest.backend.model.dto.CrawlSummaryDTO;
import com.paperharvest.backend.model.entity.Article;
import com.paperharvest.backend.scraping.site.SiteAdapterFactory;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlServiceTest {

    private static final String START = "https://www.nature.com/search?q=x&page=1";

    @Mock
    private ArticleStore articleStore;

    private final Map<String, String> pages = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private long latencyMillis;
    private CrawlService crawlService;

    @BeforeEach
    void setUp() {
        CrawlConfig config = new CrawlConfig();
        config.setRate(0);
        config.setMaxAttempts(1);
        config.setBaseDelayMillis(1);
        PageClient client = (url, timeout) -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                if (latencyMillis > 0) {
                    Thread.sleep(latencyMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            String body = pages.get(url);
            return body == null ? new PageResponse(404, "") : new PageResponse(200, body);
        };
        crawlService = new CrawlService(client, new ArticleExtractorService(), articleStore,
                new SiteAdapterFactory(), config);
    }

    private void givenListing() {
        pages.put(START, "<html><head><link rel=\"next\" href=\"https://www.nature.com/search?q=x&page=2\"></head><body>"
                + "<a href=\"/articles/1\">1</a><a href=\"/articles/2\">2</a></body></html>");
        pages.put("https://www.nature.com/search?q=x&page=2",
                "<html><body><a href=\"/articles/3\">3</a><a href=\"/articles/4\">4</a></body></html>");
        for (String id : List.of("1", "2", "4")) {
            pages.put("https://www.nature.com/articles/" + id, "<html><head><title>Paper " + id + "</title>"
                    + "<meta name=\"citation_abstract\" content=\"Abstract " + id + ".\"></head></html>");
        }
    }

    @Nested
    @DisplayName("fatal errors")
    class Fatal {

        @Test
        @DisplayName("Should reject a start URL no adapter handles")
        void shouldRejectUnknownSite() {
            assertThatThrownBy(() -> crawlService.crawl(CrawlRequestDTO.builder().startUrl("https://example.org/list").build()))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(articleStore, never()).checkAvailable();
        }

        @Test
        @DisplayName("Should abort before crawling when the store is unreachable")
        void shouldAbortWhenStoreUnavailable() {
            when(articleStore.checkAvailable()).thenThrow(new StorageException("down", null));

            assertThatThrownBy(() -> crawlService.crawl(CrawlRequestDTO.builder().startUrl(START).build()))
                    .isInstanceOf(StorageException.class);
            verify(articleStore, never()).upsert(any());
        }
    }

    @Nested
    @DisplayName("runs")
    class Runs {

        @BeforeEach
        void stubStore() {
            lenient().when(articleStore.upsert(any(Article.class))).thenAnswer(inv -> inv.getArgument(0));
            lenient().when(articleStore.markDiscovered(anyString(), anyString()))
                    .thenAnswer(inv -> Article.builder().articleUrl(inv.getArgument(0)).build());
        }

        @Test
        @DisplayName("Should report pages, fetched and failed articles")
        void shouldSummarizeRun() {
            givenListing();

            CrawlSummaryDTO summary = crawlService.crawl(CrawlRequestDTO.builder()
                    .startUrl(START)
                    .concurrency(2)
                    .resume(false)
                    .build());

            assertThat(summary.getSiteKind()).isEqualTo("SEARCH_LISTING");
            assertThat(summary.getPagesVisited()).isEqualTo(2);
            assertThat(summary.getDiscovered()).isEqualTo(4);
            assertThat(summary.getFetched()).isEqualTo(3);
            assertThat(summary.getFailed()).isEqualTo(1);
            assertThat(summary.getTraversalError()).isNull();
            verify(articleStore).markDiscovered("https://www.nature.com/articles/3", START);
        }

        @Test
        @DisplayName("Should skip articles that already have an abstract when resuming")
        void shouldSkipWhenResuming() {
            givenListing();
            when(articleStore.hasAbstract(anyString())).thenReturn(false);
            when(articleStore.hasAbstract("https://www.nature.com/articles/1")).thenReturn(true);

            CrawlSummaryDTO summary = crawlService.crawl(CrawlRequestDTO.builder()
                    .startUrl(START)
                    .resume(true)
                    .build());

            assertThat(summary.getSkipped()).isEqualTo(1);
            assertThat(summary.getFetched()).isEqualTo(2);
            verify(articleStore, never()).markDiscovered(eq("https://www.nature.com/articles/1"), anyString());
        }

        @Test
        @DisplayName("Should stop dispatching at the article limit")
        void shouldHonourLimit() {
            givenListing();

            CrawlSummaryDTO summary = crawlService.crawl(CrawlRequestDTO.builder()
                    .startUrl(START)
                    .limitArticles(2)
                    .resume(false)
                    .build());

            assertThat(summary.getFetched()).isEqualTo(2);
            assertThat(summary.getPagesVisited()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should count listing requests against the concurrency bound")
        void shouldBoundListingAndArticleRequestsTogether() {
            for (int page = 1; page <= 4; page++) {
                String next = page < 4 ? "<link rel=\"next\" href=\"https://www.nature.com/search?q=x&page=" + (page + 1) + "\">" : "";
                StringBuilder html = new StringBuilder("<html><head>" + next + "</head><body>");
                for (int i = 1; i <= 3; i++) {
                    String id = page + "-" + i;
                    html.append("<a href=\"/articles/").append(id).append("\">").append(id).append("</a>");
                    pages.put("https://www.nature.com/articles/" + id, "<html><head><title>Paper " + id + "</title>"
                            + "<meta name=\"citation_abstract\" content=\"Abstract " + id + ".\"></head></html>");
                }
                pages.put("https://www.nature.com/search?q=x&page=" + page, html.append("</body></html>").toString());
            }
            latencyMillis = 50;

            CrawlSummaryDTO summary = crawlService.crawl(CrawlRequestDTO.builder()
                    .startUrl(START)
                    .concurrency(3)
                    .resume(false)
                    .build());

            assertThat(summary.getPagesVisited()).isEqualTo(4);
            assertThat(summary.getFetched()).isEqualTo(12);
            assertThat(peak.get()).isLessThanOrEqualTo(3);
        }

        @Test
        @DisplayName("Should return a summary when a listing page throws unexpectedly")
        void shouldSummarizeAfterUnexpectedListingError() {
            givenListing();
            crawlService = new CrawlService((url, timeout) -> {
                if (url.endsWith("page=2")) {
                    throw new IllegalArgumentException("Malformed URL: " + url);
                }
                String body = pages.get(url);
                return body == null ? new PageResponse(404, "") : new PageResponse(200, body);
            }, new ArticleExtractorService(), articleStore, new SiteAdapterFactory(), new CrawlConfig());

            CrawlSummaryDTO summary = crawlService.crawl(CrawlRequestDTO.builder()
                    .startUrl(START)
                    .rate(0.0)
                    .resume(false)
                    .build());

            assertThat(summary.getPagesVisited()).isEqualTo(1);
            assertThat(summary.getFetched()).isEqualTo(2);
            assertThat(summary.getTraversalError()).contains("Malformed URL");
        }

        @Test
        @DisplayName("Should report a traversal error but keep what was found")
        void shouldReportTraversalError() {
            givenListing();
            pages.remove("https://www.nature.com/search?q=x&page=2");

            CrawlSummaryDTO summary = crawlService.crawl(CrawlRequestDTO.builder()
                    .startUrl(START)
                    .resume(false)
                    .build());

            assertThat(summary.getFetched()).isEqualTo(2);
            assertThat(summary.getTraversalError()).contains("404");
        }
    }
}
