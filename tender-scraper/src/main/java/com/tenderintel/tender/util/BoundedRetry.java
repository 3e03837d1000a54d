package com.tenderintel.tender.util;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff, shared by the login flow and the detail enricher.
 *
 * Delay before retry n is {@code baseDelay * 2^(n-1)}. Exceptions rejected by
 * {@code retryOn} are rethrown immediately without consuming further attempts.
 * A base delay under one millisecond is raised to one millisecond.
 */
@Slf4j
public final class BoundedRetry {

    private static final Duration MIN_DELAY = Duration.ofMillis(1);

    private BoundedRetry() {
    }

    public static Retry of(String name, int maxAttempts, Duration baseDelay) {
        return of(name, maxAttempts, baseDelay, e -> true);
    }

    public static Retry of(String name, int maxAttempts, Duration baseDelay, Predicate<Throwable> retryOn) {
        Duration delay = baseDelay == null || baseDelay.compareTo(MIN_DELAY) < 0 ? MIN_DELAY : baseDelay;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(delay, 2.0))
                .retryOnException(retryOn)
                .build();

        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn("{} attempt {} failed: {}",
                name, event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
