package com.pricetrack.ingest.model;

public record JobSubmitResponse(String jobId, JobStatus status) {
}
