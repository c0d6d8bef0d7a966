package com.pricetrack.ingest.model;

public record IngestionResult(
    long productId,
    IngestionOutcome outcome,
    NormalizedProduct product
) {
}
