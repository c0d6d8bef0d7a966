package com.pricetrack.ingest.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry settings for {@link BackoffExecutor}. The delay before attempt
 * {@code n + 1} is {@code initialDelay * backoffFactor^(n - 1)}.
 */
public record BackoffPolicy(
    int maxAttempts,
    Duration initialDelay,
    double backoffFactor,
    boolean retryOnEmptyResult,
    Predicate<Throwable> retryOn
) {
    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1");
        }
        if (retryOn == null) {
            retryOn = failure -> true;
        }
    }

    public BackoffPolicy(int maxAttempts, Duration initialDelay, double backoffFactor, boolean retryOnEmptyResult) {
        this(maxAttempts, initialDelay, backoffFactor, retryOnEmptyResult, failure -> true);
    }

    public Duration delayBeforeRetry(int failedAttempt) {
        int exponent = Math.max(0, failedAttempt - 1);
        double millis = initialDelay.toMillis() * Math.pow(backoffFactor, exponent);
        return Duration.ofMillis(Math.round(millis));
    }

    public boolean shouldRetry(Throwable failure) {
        return retryOn.test(failure);
    }
}
