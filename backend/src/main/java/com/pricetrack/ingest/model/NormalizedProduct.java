package com.pricetrack.ingest.model;

import java.time.Instant;

public record NormalizedProduct(
    String webCode,
    String title,
    String model,
    String url,
    long priceCents,
    long saveCents,
    Instant observedAt
) {
}
