package com.pricetrack.ingest.queue;

import com.pricetrack.ingest.model.JobQueueStats;
import com.pricetrack.ingest.model.JobUnit;

import java.time.Duration;

/**
 * Single logical queue between submission and the worker pool. Delivery is
 * at-least-once: a unit that is polled but never acknowledged may be handed
 * out again.
 */
public interface JobQueue {

    void enqueue(JobUnit unit);

    /**
     * Blocks for at most {@code timeout} waiting for a unit.
     *
     * @return the next unit, or {@code null} when none arrived in time
     */
    JobUnit poll(Duration timeout) throws InterruptedException;

    void acknowledge(JobUnit unit);

    /**
     * Hands back a polled unit whose execution did not finish. The unit stays
     * deliverable; it is never dropped.
     */
    void release(JobUnit unit);

    JobQueueStats stats();
}
