package com.pricetrack.ingest.model;

import java.time.Instant;

public record Job(
    String jobId,
    String webCode,
    JobStatus status,
    String result,
    String error,
    Long productId,
    int attempts,
    Instant createdAt,
    Instant updatedAt
) {
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
