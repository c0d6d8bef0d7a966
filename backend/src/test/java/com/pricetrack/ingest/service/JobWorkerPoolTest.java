package com.pricetrack.ingest.service;

import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.error.JobInterruptedException;
import com.pricetrack.ingest.model.JobUnit;
import com.pricetrack.ingest.queue.InMemoryJobQueue;
import com.pricetrack.ingest.queue.JobQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class JobWorkerPoolTest {

    @Mock
    private JobQueue jobQueue;
    @Mock
    private JobOrchestratorService orchestratorService;

    @Test
    void acknowledgesOnlyAfterExecutionFinishes() {
        JobWorkerPool pool = new JobWorkerPool(jobQueue, orchestratorService, new TrackerProperties());
        JobUnit unit = new JobUnit("job-1", "111", 1);

        assertThat(pool.runUnit(1, unit)).isTrue();

        verify(orchestratorService).execute(unit);
        verify(jobQueue).acknowledge(unit);
    }

    @Test
    void crashedExecutionLeavesUnitForRedelivery() {
        JobWorkerPool pool = new JobWorkerPool(jobQueue, orchestratorService, new TrackerProperties());
        JobUnit unit = new JobUnit("job-1", "111", 1);
        doThrow(new IllegalStateException("db down")).when(orchestratorService).execute(unit);

        assertThat(pool.runUnit(1, unit)).isFalse();

        verify(jobQueue, never()).acknowledge(unit);
        verify(jobQueue).release(unit);
    }

    @Test
    void interruptedExecutionReleasesUnitWithoutAcknowledging() {
        JobWorkerPool pool = new JobWorkerPool(jobQueue, orchestratorService, new TrackerProperties());
        JobUnit unit = new JobUnit("job-1", "111", 1);
        doThrow(new JobInterruptedException("job-1", null)).when(orchestratorService).execute(unit);

        assertThat(pool.runUnit(1, unit)).isFalse();

        verify(jobQueue, never()).acknowledge(unit);
        verify(jobQueue).release(unit);
    }

    @Test
    void crashedUnitOnMemoryQueueIsHandedOutAgain() throws Exception {
        InMemoryJobQueue queue = new InMemoryJobQueue(Clock.systemUTC());
        JobWorkerPool pool = new JobWorkerPool(queue, orchestratorService, new TrackerProperties());
        queue.enqueue(new JobUnit("job-1", "111"));
        JobUnit first = queue.poll(Duration.ofMillis(10));
        doThrow(new IllegalStateException("db down")).when(orchestratorService).execute(first);

        pool.runUnit(1, first);

        assertThat(queue.stats().leasedCount()).isZero();
        JobUnit again = queue.poll(Duration.ofMillis(10));
        assertThat(again.jobId()).isEqualTo("job-1");
        assertThat(again.deliveryCount()).isEqualTo(2);
    }

    @Test
    void startedWorkersDrainTheQueue() {
        TrackerProperties properties = new TrackerProperties();
        properties.getWorkers().setWorkerCount(2);
        properties.getWorkers().setPollIntervalMs(50);
        InMemoryJobQueue queue = new InMemoryJobQueue(Clock.systemUTC());
        JobWorkerPool pool = new JobWorkerPool(queue, orchestratorService, properties);

        pool.start();
        try {
            assertThat(pool.isRunning()).isTrue();
            assertThat(pool.getActiveWorkerCount()).isEqualTo(2);

            queue.enqueue(new JobUnit("job-1", "111"));
            queue.enqueue(new JobUnit("job-2", "222"));

            verify(orchestratorService, timeout(2000)).execute(new JobUnit("job-1", "111", 1));
            verify(orchestratorService, timeout(2000)).execute(new JobUnit("job-2", "222", 1));
        } finally {
            pool.stop();
        }
        assertThat(pool.isRunning()).isFalse();
        assertThat(pool.getActiveWorkerCount()).isZero();
    }
}
