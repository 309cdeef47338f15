package com.paperharvest.backend.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Exponential backoff with jitter around any call, retrying only failures the predicate accepts.
 * The same instance is safe to share between workers.
 */
@Slf4j
public class RetryPolicy {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    @Getter
    private final int maxAttempts;
    private final Retry retry;

    public RetryPolicy(String name, int maxAttempts, Duration baseDelay, double jitter,
                       Predicate<Throwable> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        Duration delay = baseDelay == null || baseDelay.toMillis() < 1 ? Duration.ofMillis(1) : baseDelay;
        // randomization factor must stay below 1
        double randomization = Math.max(0.0, Math.min(jitter, 0.99));
        IntervalFunction interval = randomization > 0
                ? IntervalFunction.ofExponentialRandomBackoff(delay, BACKOFF_MULTIPLIER, randomization)
                : IntervalFunction.ofExponentialBackoff(delay, BACKOFF_MULTIPLIER);

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(this.maxAttempts)
                .intervalFunction(interval)
                .retryOnException(retryable)
                .build();
        this.retry = Retry.of(name, config);
        this.retry.getEventPublisher()
                .onRetry(event -> log.warn("{}: attempt {} failed, retrying in {} ms: {}",
                        name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * Run {@code call}, retrying retryable failures. The last failure is rethrown once attempts run out,
     * a non-retryable failure is rethrown immediately.
     */
    public <T> T execute(Supplier<T> call) {
        return retry.executeSupplier(call);
    }
}
