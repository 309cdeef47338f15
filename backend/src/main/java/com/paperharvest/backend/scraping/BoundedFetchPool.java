package com.paperharvest.backend.scraping;

import com.paperharvest.backend.article.ArticleStore;
import com.paperharvest.backend.article.StorageException;
import com.paperharvest.backend.config.AsyncConfig;
import com.paperharvest.backend.model.dto.ArticleDTO;
import com.paperharvest.backend.model.entity.Article;
import com.paperharvest.backend.model.enums.ArticleStatus;
import com.paperharvest.backend.util.TextUtils;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Fetches, extracts and stores articles on a fixed number of workers. A failing article is
 * recorded as FETCH_FAILED and never stops the others.
 */
@Slf4j
@RequiredArgsConstructor
public class BoundedFetchPool {

    private final RetryingFetcher fetcher;
    private final ArticleExtractorService extractor;
    private final ArticleStore articleStore;

    public List<FetchOutcome> run(Iterable<String> articleUrls, String searchUrl, int concurrency) {
        List<FetchOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
        run(articleUrls.iterator(), searchUrl, concurrency, new AtomicBoolean(false), outcomes::add);
        return new ArrayList<>(outcomes);
    }

    /**
     * Process URLs as the iterator yields them, with at most {@code concurrency} in flight.
     * Duplicate URLs are dropped before dispatch. Once {@code cancelled} is set no further URL
     * is dispatched and in-flight work finishes normally. {@code sink} is called from worker threads.
     */
    public void run(Iterator<String> articleUrls, String searchUrl, int concurrency,
                    AtomicBoolean cancelled, Consumer<FetchOutcome> sink) {
        int workers = Math.max(1, concurrency);
        ThreadPoolTaskExecutor executor = AsyncConfig.workerPool("Fetch-", workers);
        // Keeps the traversal from running far ahead of the workers
        Semaphore window = new Semaphore(workers * 2);
        Set<String> dispatched = new HashSet<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        try {
            while (articleUrls.hasNext()) {
                if (cancelled.get()) {
                    log.info("Fetch run cancelled after dispatching {} articles", dispatched.size());
                    break;
                }
                String url = articleUrls.next();
                if (!dispatched.add(url)) {
                    continue;
                }
                window.acquire();
                futures.add(CompletableFuture.runAsync(() -> {
                    try {
                        sink.accept(process(url, searchUrl));
                    } finally {
                        window.release();
                    }
                }, executor));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            log.warn("Fetch dispatch interrupted, waiting for {} in-flight articles", futures.size());
        } finally {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            executor.shutdown();
        }
    }

    FetchOutcome process(String url, String searchUrl) {
        try {
            String html = fetcher.fetch(url);
            ArticleDTO dto = extractor.extract(url, html);
            Article saved = articleStore.upsert(Article.builder()
                    .articleUrl(url)
                    .searchUrl(searchUrl)
                    .title(dto.getTitle())
                    .journal(dto.getJournal())
                    .publishedDate(dto.getPublishedDate())
                    .abstractEn(dto.getAbstractEn())
                    .status(ArticleStatus.FETCHED)
                    .crawledAt(LocalDateTime.now())
                    .build());
            log.info("Fetched: {}", dto.getTitle() != null ? dto.getTitle() : url);
            return FetchOutcome.fetched(url, saved);
        } catch (FetchException | ExtractionException e) {
            log.warn("Fetch failed for {}: {}", url, e.getMessage());
            return recordFailure(url, searchUrl, e.getMessage());
        } catch (StorageException e) {
            log.error("Storage error for {}: {}", url, e.getMessage());
            return FetchOutcome.failed(url, "Storage error: " + e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error processing {}: {}", url, TextUtils.describe(e), e);
            return recordFailure(url, searchUrl, TextUtils.describe(e));
        }
    }

    private FetchOutcome recordFailure(String url, String searchUrl, String reason) {
        try {
            articleStore.upsert(Article.builder()
                    .articleUrl(url)
                    .searchUrl(searchUrl)
                    .status(ArticleStatus.FETCH_FAILED)
                    .failureReason(reason)
                    .build());
        } catch (StorageException e) {
            log.error("Could not record fetch failure for {}: {}", url, e.getMessage());
        }
        return FetchOutcome.failed(url, reason);
    }
}
