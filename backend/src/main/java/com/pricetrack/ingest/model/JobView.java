package com.pricetrack.ingest.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record JobView(
    String jobId,
    String webCode,
    JobStatus status,
    String statusLabel,
    JsonNode result,
    JsonNode error,
    Long productId,
    int attempts,
    Instant createdAt,
    Instant updatedAt
) {
}
