package com.pricetrack.ingest.model;

/**
 * Unit of work handed from submission to a worker. {@code deliveryCount} is 1
 * on first delivery and grows when an unacknowledged unit is redelivered.
 */
public record JobUnit(
    String jobId,
    String webCode,
    int deliveryCount
) {
    public JobUnit(String jobId, String webCode) {
        this(jobId, webCode, 0);
    }

    public boolean isRedelivery() {
        return deliveryCount > 1;
    }
}
