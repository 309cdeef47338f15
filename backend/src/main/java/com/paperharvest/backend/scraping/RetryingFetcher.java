package com.paperharvest.backend.scraping;

import com.paperharvest.backend.config.CrawlConfig;
import com.paperharvest.backend.resilience.RateLimiter;
import com.paperharvest.backend.resilience.RetryPolicy;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches a page through the shared rate limiter, retrying transient failures.
 * Every attempt, retries included, waits for its own token. Listing and article fetches of one
 * crawl share a fetcher, so its in-flight bound covers both.
 */
@Slf4j
public class RetryingFetcher {

    private final PageClient pageClient;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    // Null when unbounded
    private final Semaphore inFlight;

    public RetryingFetcher(PageClient pageClient, RateLimiter rateLimiter, RetryPolicy retryPolicy, Duration timeout) {
        this(pageClient, rateLimiter, retryPolicy, timeout, 0);
    }

    /**
     * @param maxInFlight most requests open at once across all callers, 0 or less for no bound
     */
    public RetryingFetcher(PageClient pageClient, RateLimiter rateLimiter, RetryPolicy retryPolicy,
                           Duration timeout, int maxInFlight) {
        this.pageClient = pageClient;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.timeout = timeout;
        this.inFlight = maxInFlight > 0 ? new Semaphore(maxInFlight, true) : null;
    }

    public static RetryPolicy retryPolicy(CrawlConfig config) {
        return new RetryPolicy("page-fetch", config.getMaxAttempts(),
                Duration.ofMillis(config.getBaseDelayMillis()), config.getJitter(),
                e -> e instanceof FetchException && ((FetchException) e).isRetryable());
    }

    /**
     * @return the page body
     * @throws FetchException once retries are exhausted or on a non-retryable status
     */
    public String fetch(String url) {
        return retryPolicy.execute(() -> attempt(url));
    }

    private String attempt(String url) {
        rateLimiter.acquire();
        PageResponse response;
        acquireSlot(url);
        try {
            response = pageClient.get(url, timeout);
        } catch (SocketTimeoutException | HttpTimeoutException e) {
            throw FetchException.timeout(url, e);
        } catch (IOException e) {
            throw FetchException.network(url, e);
        } finally {
            if (inFlight != null) {
                inFlight.release();
            }
        }
        if (!response.isSuccess()) {
            throw FetchException.httpError(url, response.getStatus());
        }
        return response.getBody() != null ? response.getBody() : "";
    }

    private void acquireSlot(String url) {
        if (inFlight == null) return;
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting to fetch " + url, e);
        }
    }
}
