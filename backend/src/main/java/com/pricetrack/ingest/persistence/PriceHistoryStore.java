package com.pricetrack.ingest.persistence;

import com.pricetrack.ingest.model.PriceHistoryEntry;

import java.util.List;

/**
 * Append-only price history. Implementations never update or delete entries.
 */
public interface PriceHistoryStore {

    void append(PriceHistoryEntry entry);

    /** Entries for one web code, oldest first. */
    List<PriceHistoryEntry> findByWebCode(String webCode);

    long countByWebCode(String webCode);
}
