package com.pricetrack.ingest.model;

import java.time.Instant;

public record PriceHistoryEntry(
    String webCode,
    long priceCents,
    long saveCents,
    Instant observedAt
) {
    public static PriceHistoryEntry of(NormalizedProduct product) {
        return new PriceHistoryEntry(
            product.webCode(),
            product.priceCents(),
            product.saveCents(),
            product.observedAt()
        );
    }
}
