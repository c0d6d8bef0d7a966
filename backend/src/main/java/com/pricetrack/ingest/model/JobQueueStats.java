package com.pricetrack.ingest.model;

import java.time.Instant;

public record JobQueueStats(
    String backend,
    long queuedCount,
    long leasedCount,
    Instant oldestEnqueuedAt
) {
}
