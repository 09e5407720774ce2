package com.foreman.core.resilience;

import java.time.Duration;
import java.util.Set;

/**
 * Bounded exponential backoff settings.
 *
 * @param maxAttempts       total attempts including the first one
 * @param initialDelay      wait before the second attempt
 * @param maxDelay          upper bound for any single wait
 * @param backoffMultiplier factor applied to the wait after each retry
 * @param retryableErrors   error codes (see {@link ErrorCodes}) that may be retried; anything else fails at once
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    Duration maxDelay,
    double backoffMultiplier,
    Set<String> retryableErrors
) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(
            3, Duration.ofMillis(100), Duration.ofMillis(5000), 2.0, ErrorCodes.TRANSIENT);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least initialDelay");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1");
        }
        retryableErrors = retryableErrors != null ? Set.copyOf(retryableErrors) : Set.of();
    }

    public RetryPolicy withRetryableErrors(Set<String> codes) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, backoffMultiplier, codes);
    }

    /** Delay that follows {@code current}: multiplied and capped at {@link #maxDelay()}. */
    public Duration nextDelay(Duration current) {
        long next = (long) (current.toMillis() * backoffMultiplier);
        return next >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(next);
    }
}
