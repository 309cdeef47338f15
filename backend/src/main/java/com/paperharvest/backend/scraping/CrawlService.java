package com.paperharvest.backend.scraping;

import com.paperharvest.backend.article.ArticleStore;
import com.paperharvest.backend.article.StorageException;
import com.paperharvest.backend.config.CrawlConfig;
import com.paperharvest.backend.model.dto.CrawlRequestDTO;
import com.paperharvest.backend.model.dto.CrawlSummaryDTO;
import com.paperharvest.backend.model.dto.TaskStatusDTO;
import com.paperharvest.backend.resilience.RateLimiter;
import com.paperharvest.backend.scraping.site.SiteAdapter;
import com.paperharvest.backend.scraping.site.SiteAdapterFactory;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs a crawl: walks the listing pages of one start URL and fetches every article found
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrawlService {

    private final PageClient pageClient;
    private final ArticleExtractorService articleExtractorService;
    private final ArticleStore articleStore;
    private final SiteAdapterFactory siteAdapterFactory;
    private final CrawlConfig crawlConfig;

    private final Map<String, TaskStatusDTO> taskStatuses = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> cancellations = new ConcurrentHashMap<>();

    public CrawlSummaryDTO crawl(CrawlRequestDTO request) {
        return crawl(request, new AtomicBoolean(false));
    }

    /**
     * @throws IllegalArgumentException when the start URL is malformed or no adapter matches it
     * @throws StorageException         when the article store cannot be reached
     */
    public CrawlSummaryDTO crawl(CrawlRequestDTO request, AtomicBoolean cancelled) {
        String startUrl = request.getStartUrl() != null ? request.getStartUrl().trim() : null;
        SiteAdapter adapter = siteAdapterFactory.createAdapter(request.getSiteKind(), startUrl);
        articleStore.checkAvailable();

        int concurrency = request.getConcurrency() != null ? request.getConcurrency() : crawlConfig.getConcurrency();
        double rate = request.getRate() != null ? request.getRate() : crawlConfig.getRate();
        int maxPages = request.getMaxPages() != null ? request.getMaxPages() : crawlConfig.getMaxPages();
        int limitArticles = request.getLimitArticles() != null ? request.getLimitArticles() : crawlConfig.getLimitArticles();
        boolean resume = request.getResume() != null ? request.getResume() : crawlConfig.isResume();

        log.info("Starting crawl of {} as {} (concurrency={}, rate={}/s, maxPages={}, limitArticles={}, resume={})",
                startUrl, adapter.getKind(), concurrency, rate, maxPages, limitArticles, resume);
        long startTime = System.currentTimeMillis();
        String startedAt = now();

        RetryingFetcher fetcher = new RetryingFetcher(pageClient,
                new RateLimiter(rate, crawlConfig.getBurst()),
                RetryingFetcher.retryPolicy(crawlConfig),
                Duration.ofSeconds(crawlConfig.getTimeout()),
                Math.max(1, concurrency));
        PaginationTraversal.Traversal traversal = new PaginationTraversal(fetcher).traverse(startUrl, adapter, maxPages);

        AtomicInteger fetched = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();

        Stream<String> toFetch = traversal.stream()
                .filter(url -> admit(url, startUrl, resume, skipped, failed));
        if (limitArticles > 0) {
            toFetch = toFetch.limit(limitArticles);
        }

        BoundedFetchPool pool = new BoundedFetchPool(fetcher, articleExtractorService, articleStore);
        pool.run(toFetch.iterator(), startUrl, concurrency, cancelled, outcome -> {
            if (outcome.isSuccess()) {
                fetched.incrementAndGet();
            } else {
                failed.incrementAndGet();
            }
        });

        double durationSeconds = (System.currentTimeMillis() - startTime) / 1000.0;
        CrawlSummaryDTO summary = new CrawlSummaryDTO();
        summary.setStartUrl(startUrl);
        summary.setSiteKind(adapter.getKind().name());
        summary.setPagesVisited(traversal.getPagesVisited());
        summary.setDiscovered(traversal.getDiscovered());
        summary.setFetched(fetched.get());
        summary.setFailed(failed.get());
        summary.setSkipped(skipped.get());
        summary.setTraversalError(traversal.getFailure().orElse(null));
        summary.setCancelled(cancelled.get());
        summary.setStartedAt(startedAt);
        summary.setCompletedAt(now());
        summary.setDurationSeconds(durationSeconds);

        log.info("Completed crawl of {}: {} pages, {} discovered, {} fetched, {} failed, {} skipped in {}s",
                startUrl, summary.getPagesVisited(), summary.getDiscovered(), summary.getFetched(),
                summary.getFailed(), summary.getSkipped(), String.format("%.2f", durationSeconds));
        return summary;
    }

    /**
     * Run a crawl in the background, trackable through {@link #getTaskStatus(String)}
     */
    @Async("crawlTaskExecutor")
    public CompletableFuture<CrawlSummaryDTO> crawlAsync(String taskId, CrawlRequestDTO request) {
        AtomicBoolean cancelled = cancellations.computeIfAbsent(taskId, id -> new AtomicBoolean(false));
        TaskStatusDTO status = taskStatuses.computeIfAbsent(taskId, id -> newStatus(id));
        try {
            CrawlSummaryDTO summary = crawl(request, cancelled);
            status.setStatus("COMPLETED");
            status.setSummary(summary);
            status.setCompletedAt(now());
            return CompletableFuture.completedFuture(summary);
        } catch (Exception e) {
            log.error("Error in async crawl task {}: {}", taskId, e.getMessage());
            status.setStatus("FAILED");
            status.setError(e.getMessage());
            status.setCompletedAt(now());
            return CompletableFuture.failedFuture(e);
        } finally {
            cancellations.remove(taskId);
        }
    }

    public String registerTask() {
        String taskId = "crawl-" + System.currentTimeMillis();
        taskStatuses.put(taskId, newStatus(taskId));
        cancellations.put(taskId, new AtomicBoolean(false));
        return taskId;
    }

    /**
     * Stop dispatching new articles for a running task; in-flight articles still complete
     */
    public boolean cancel(String taskId) {
        AtomicBoolean flag = cancellations.get(taskId);
        if (flag == null) return false;
        flag.set(true);
        TaskStatusDTO status = taskStatuses.get(taskId);
        if (status != null && "RUNNING".equals(status.getStatus())) {
            status.setStatus("CANCELLING");
        }
        return true;
    }

    public TaskStatusDTO getTaskStatus(String taskId) {
        return taskStatuses.get(taskId);
    }

    public Map<String, TaskStatusDTO> getAllTaskStatuses() {
        return new ConcurrentHashMap<>(taskStatuses);
    }

    private boolean admit(String url, String searchUrl, boolean resume, AtomicInteger skipped, AtomicInteger failed) {
        try {
            if (resume && articleStore.hasAbstract(url)) {
                log.debug("Already fetched, skipping {}", url);
                skipped.incrementAndGet();
                return false;
            }
            articleStore.markDiscovered(url, searchUrl);
            return true;
        } catch (StorageException e) {
            log.error("Storage error recording {}: {}", url, e.getMessage());
            failed.incrementAndGet();
            return false;
        }
    }

    private TaskStatusDTO newStatus(String taskId) {
        TaskStatusDTO status = new TaskStatusDTO();
        status.setTaskId(taskId);
        status.setStatus("RUNNING");
        status.setPhase("crawl");
        status.setStartedAt(now());
        return status;
    }

    private static String now() {
        return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
