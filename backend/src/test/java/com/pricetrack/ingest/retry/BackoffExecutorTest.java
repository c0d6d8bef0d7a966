package com.pricetrack.ingest.retry;

import com.pricetrack.ingest.error.ExtractionException;
import com.pricetrack.ingest.error.InvalidProductException;
import com.pricetrack.ingest.error.RetryExhaustedException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffExecutorTest {
    private static final BackoffPolicy DEFAULT_POLICY = new BackoffPolicy(3, Duration.ofSeconds(5), 2.0, true);

    private final List<Duration> sleeps = new ArrayList<>();
    private final BackoffExecutor executor = new BackoffExecutor(sleeps::add);

    @Test
    void sleepsFiveThenTenSecondsBeforeGivingUp() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new ExtractionException("123", "timeout");
        }, DEFAULT_POLICY))
            .isInstanceOf(RetryExhaustedException.class)
            .hasCauseInstanceOf(ExtractionException.class)
            .satisfies(e -> assertThat(((RetryExhaustedException) e).attempts()).isEqualTo(3));

        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(10));
    }

    @Test
    void successOnSecondAttemptSleepsOnce() {
        AtomicInteger calls = new AtomicInteger();

        Optional<String> result = executor.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new ExtractionException("123", "connection reset");
            }
            return Optional.of("ok");
        }, DEFAULT_POLICY);

        assertThat(result).contains("ok");
        assertThat(calls.get()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
    }

    @Test
    void firstAttemptSuccessNeverSleeps() {
        Optional<Integer> result = executor.execute(() -> Optional.of(42), DEFAULT_POLICY);

        assertThat(result).contains(42);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void emptyResultsAreRetriedThenReturnedEmpty() {
        AtomicInteger calls = new AtomicInteger();

        Optional<String> result = executor.execute(() -> {
            calls.incrementAndGet();
            return Optional.empty();
        }, DEFAULT_POLICY);

        assertThat(result).isEmpty();
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void emptyResultReturnsImmediatelyWhenPolicyDoesNotRetryEmpty() {
        AtomicInteger calls = new AtomicInteger();
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ofSeconds(5), 2.0, false);

        Optional<String> result = executor.execute(() -> {
            calls.incrementAndGet();
            return Optional.empty();
        }, policy);

        assertThat(result).isEmpty();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void lastFailureWinsWhenFailuresAndEmptyResultsMix() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute(() -> {
            int call = calls.incrementAndGet();
            if (call == 2) {
                throw new ExtractionException("123", "boom on two");
            }
            return Optional.empty();
        }, DEFAULT_POLICY))
            .isInstanceOf(RetryExhaustedException.class)
            .hasMessageContaining("boom on two");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void nonRetryableFailureIsRethrownWithoutSleeping() {
        AtomicInteger calls = new AtomicInteger();
        BackoffPolicy policy = new BackoffPolicy(
            3,
            Duration.ofSeconds(5),
            2.0,
            true,
            failure -> !(failure instanceof InvalidProductException)
        );

        assertThatThrownBy(() -> executor.execute(() -> {
            calls.incrementAndGet();
            throw new InvalidProductException("123", List.of("title"));
        }, policy))
            .isInstanceOf(InvalidProductException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void checkedFailuresAreCarriedAsCause() {
        assertThatThrownBy(() -> executor.execute(() -> {
            throw new IOException("socket closed");
        }, DEFAULT_POLICY))
            .isInstanceOf(RetryExhaustedException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void interruptedSleepStopsRetryingAndKeepsInterruptFlag() {
        BackoffExecutor interrupting = new BackoffExecutor(duration -> {
            throw new InterruptedException("shutdown");
        });
        AtomicInteger calls = new AtomicInteger();

        try {
            assertThatThrownBy(() -> interrupting.execute(() -> {
                calls.incrementAndGet();
                throw new ExtractionException("123", "timeout");
            }, DEFAULT_POLICY))
                .isInstanceOf(RetryExhaustedException.class)
                .satisfies(e -> assertThat(((RetryExhaustedException) e).attempts()).isEqualTo(1));
            assertThat(calls.get()).isEqualTo(1);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void realSleeperWaitsAtLeastTheScheduledDelays() {
        BackoffExecutor realExecutor = new BackoffExecutor(Sleeper.THREAD_SLEEP);
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ofMillis(20), 2.0, true);

        long started = System.nanoTime();
        Optional<String> result = realExecutor.execute(Optional::empty, policy);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        assertThat(result).isEmpty();
        assertThat(elapsedMs).isGreaterThanOrEqualTo(55L);
    }

    @Test
    void policyComputesExponentialDelays() {
        BackoffPolicy policy = new BackoffPolicy(4, Duration.ofMillis(100), 3.0, true);

        assertThat(policy.delayBeforeRetry(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayBeforeRetry(2)).isEqualTo(Duration.ofMillis(300));
        assertThat(policy.delayBeforeRetry(3)).isEqualTo(Duration.ofMillis(900));
    }

    @Test
    void policyRejectsInvalidSettings() {
        assertThatThrownBy(() -> new BackoffPolicy(0, Duration.ofSeconds(1), 2.0, true))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(3, Duration.ofSeconds(-1), 2.0, true))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(3, Duration.ofSeconds(1), 0.5, true))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
