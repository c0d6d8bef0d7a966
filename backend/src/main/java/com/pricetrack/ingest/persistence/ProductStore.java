package com.pricetrack.ingest.persistence;

import com.pricetrack.ingest.model.NormalizedProduct;
import com.pricetrack.ingest.model.Product;

import java.time.Instant;
import java.util.Optional;

public interface ProductStore {

    Optional<Product> findByWebCode(String webCode);

    long insert(NormalizedProduct product);

    void updatePrice(long productId, long priceCents, long saveCents, Instant observedAt);

    void refresh(long productId, long saveCents, Instant observedAt);
}
