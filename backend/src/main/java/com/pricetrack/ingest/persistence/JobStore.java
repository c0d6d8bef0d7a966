package com.pricetrack.ingest.persistence;

import com.pricetrack.ingest.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable job records. Transition methods only apply when the stored status
 * allows the move and return {@code false} otherwise; terminal jobs are never
 * rewritten.
 */
public interface JobStore {

    void insert(String jobId, String webCode, Instant createdAt);

    Optional<Job> findById(String jobId);

    List<Job> findRecent(int limit);

    boolean markInProgress(String jobId, Instant now);

    boolean markCompleted(String jobId, String result, Long productId, int attempts, Instant now);

    boolean markFailed(String jobId, String error, int attempts, Instant now);

    List<Job> findStaleInProgress(Instant updatedBefore);

    Map<String, Long> countByStatus();

    boolean isReachable();
}
