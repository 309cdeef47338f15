package com.paperharvest.backend.resilience;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import java.time.Duration;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Token bucket shared by every worker of one phase. Blocked callers are served in
 * reservation order, so a waiting worker is never overtaken indefinitely.
 */
@Slf4j
public class RateLimiter {

    @Getter
    private final double permitsPerSecond;
    private final Bucket bucket;

    /**
     * @param permitsPerSecond refill rate, 0 or less disables throttling
     * @param burst            tokens that may be taken back to back after an idle period
     */
    public RateLimiter(double permitsPerSecond, int burst) {
        this.permitsPerSecond = permitsPerSecond;
        if (permitsPerSecond <= 0) {
            this.bucket = null;
            return;
        }
        long nanosPerToken = Math.max(1L, Math.round(1_000_000_000d / permitsPerSecond));
        Bandwidth limit = Bandwidth.builder()
                .capacity(Math.max(1, burst))
                .refillGreedy(1, Duration.ofNanos(nanosPerToken))
                .build();
        this.bucket = Bucket.builder().addLimit(limit).build();
    }

    public static RateLimiter unlimited() {
        return new RateLimiter(0, 1);
    }

    public void acquire() {
        if (bucket == null) return;
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limiter", e);
        }
    }

    public boolean isUnlimited() {
        return bucket == null;
    }
}
