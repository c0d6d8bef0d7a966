package com.pricetrack.ingest.extract;

import com.pricetrack.ingest.model.NormalizedProduct;

import java.util.Optional;

/**
 * Fetches and normalizes one product. Must not write to tracker storage.
 * An empty result means the product was not found; transient faults are
 * raised as {@link com.pricetrack.ingest.error.ExtractionException}.
 */
public interface ProductExtractor {
    Optional<NormalizedProduct> fetch(String webCode);
}
