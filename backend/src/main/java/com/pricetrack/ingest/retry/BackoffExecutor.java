package com.pricetrack.ingest.retry;

import com.pricetrack.ingest.error.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Bounded retry with exponential backoff around a zero-argument operation.
 * Blocks the calling thread for the whole retry window.
 */
public class BackoffExecutor {
    private static final Logger log = LoggerFactory.getLogger(BackoffExecutor.class);

    private final Sleeper sleeper;

    public BackoffExecutor(Sleeper sleeper) {
        this.sleeper = sleeper == null ? Sleeper.THREAD_SLEEP : sleeper;
    }

    /**
     * Runs {@code operation} until it yields a value or the policy gives up.
     *
     * @return the first present result; empty when every attempt came back
     *     empty, or immediately on an empty result if the policy does not retry
     *     empty results
     * @throws RetryExhaustedException when the final attempt failed and at
     *     least one attempt raised; the cause is the last failure
     * @throws RuntimeException a failure the policy does not retry is rethrown
     *     as is (checked exceptions are wrapped in a RetryExhaustedException)
     */
    public <T> Optional<T> execute(Callable<Optional<T>> operation, BackoffPolicy policy) {
        int maxAttempts = policy.maxAttempts();
        Throwable lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Optional<T> result = operation.call();
                if (result != null && result.isPresent()) {
                    log.debug("Attempt {}/{} succeeded", attempt, maxAttempts);
                    return result;
                }
                if (!policy.retryOnEmptyResult()) {
                    log.info("Attempt {}/{} returned no result; not retrying empty results", attempt, maxAttempts);
                    return Optional.empty();
                }
                log.warn("Attempt {}/{} returned no result", attempt, maxAttempts);
            } catch (Exception e) {
                if (!policy.shouldRetry(e)) {
                    log.warn("Attempt {}/{} failed with non-retryable {}", attempt, maxAttempts, e.getClass().getSimpleName());
                    throw rethrow(e, attempt);
                }
                lastFailure = e;
                log.warn("Attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage(), e);
            }

            if (attempt < maxAttempts) {
                Duration delay = policy.delayBeforeRetry(attempt);
                log.info("Retrying in {} ms (attempt {}/{})", delay.toMillis(), attempt + 1, maxAttempts);
                if (!sleep(delay)) {
                    throw new RetryExhaustedException(attempt, lastFailure);
                }
            }
        }

        if (lastFailure != null) {
            log.error("All {} attempts failed", maxAttempts);
            throw new RetryExhaustedException(maxAttempts, lastFailure);
        }
        log.error("All {} attempts returned no result", maxAttempts);
        return Optional.empty();
    }

    private RuntimeException rethrow(Exception failure, int attempt) {
        if (failure instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new RetryExhaustedException(attempt, failure);
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while backing off; giving up");
            return false;
        }
    }
}
