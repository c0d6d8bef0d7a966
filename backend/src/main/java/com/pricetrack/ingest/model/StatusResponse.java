package com.pricetrack.ingest.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    Map<String, Long> jobCounts,
    JobQueueStats queue,
    boolean workersRunning,
    int activeWorkerCount
) {
}
