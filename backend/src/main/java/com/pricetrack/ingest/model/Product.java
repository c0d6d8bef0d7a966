package com.pricetrack.ingest.model;

import java.time.Instant;

public record Product(
    long productId,
    String webCode,
    String title,
    String model,
    String url,
    long priceCents,
    long saveCents,
    Instant createdAt,
    Instant updatedAt
) {
}
