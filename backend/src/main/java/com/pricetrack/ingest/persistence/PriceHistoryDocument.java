package com.pricetrack.ingest.persistence;

import com.pricetrack.ingest.model.PriceHistoryEntry;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "price_history")
public record PriceHistoryDocument(
    @Id String id,
    @Indexed String webCode,
    long priceCents,
    long saveCents,
    Instant observedAt
) {
    static PriceHistoryDocument from(PriceHistoryEntry entry) {
        return new PriceHistoryDocument(null, entry.webCode(), entry.priceCents(), entry.saveCents(), entry.observedAt());
    }

    PriceHistoryEntry toEntry() {
        return new PriceHistoryEntry(webCode, priceCents, saveCents, observedAt);
    }
}
