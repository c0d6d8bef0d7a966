package com.pricetrack.ingest.queue;

import com.pricetrack.ingest.model.JobQueueStats;
import com.pricetrack.ingest.model.JobUnit;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Process-local queue. Units are lost on restart, so jobs left PENDING or
 * IN_PROGRESS by a crash or shutdown have to be resubmitted;
 * {@code StaleJobReporter} lists the IN_PROGRESS ones at the next start-up.
 * A released unit goes back to the tail of the queue.
 */
@Component
@ConditionalOnProperty(prefix = "tracker.queue", name = "backend", havingValue = "memory")
public class InMemoryJobQueue implements JobQueue {
    private final BlockingQueue<QueuedUnit> queue = new LinkedBlockingQueue<>();
    private final Map<String, JobUnit> inFlight = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobQueue(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void enqueue(JobUnit unit) {
        QueuedUnit queued = new QueuedUnit(unit, clock.instant());
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            // The job row must be visible before a worker can pick the unit up.
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    queue.offer(queued);
                }
            });
            return;
        }
        queue.offer(queued);
    }

    @Override
    public JobUnit poll(Duration timeout) throws InterruptedException {
        QueuedUnit next = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null) {
            return null;
        }
        JobUnit delivered = new JobUnit(next.unit().jobId(), next.unit().webCode(), next.unit().deliveryCount() + 1);
        inFlight.put(delivered.jobId(), delivered);
        return delivered;
    }

    @Override
    public void acknowledge(JobUnit unit) {
        inFlight.remove(unit.jobId());
    }

    @Override
    public void release(JobUnit unit) {
        JobUnit delivered = inFlight.remove(unit.jobId());
        if (delivered != null) {
            queue.offer(new QueuedUnit(delivered, clock.instant()));
        }
    }

    @Override
    public JobQueueStats stats() {
        QueuedUnit head = queue.peek();
        return new JobQueueStats(
            "memory",
            queue.size(),
            inFlight.size(),
            head == null ? null : head.enqueuedAt()
        );
    }

    private record QueuedUnit(JobUnit unit, Instant enqueuedAt) {
    }
}
