package com.pricetrack.ingest.service;

import com.pricetrack.ingest.model.PriceHistoryEntry;
import com.pricetrack.ingest.model.Product;
import com.pricetrack.ingest.persistence.PriceHistoryStore;
import com.pricetrack.ingest.persistence.ProductStore;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class ProductQueryService {
    private final ProductStore productStore;
    private final PriceHistoryStore historyStore;

    public ProductQueryService(ProductStore productStore, PriceHistoryStore historyStore) {
        this.productStore = productStore;
        this.historyStore = historyStore;
    }

    public Optional<Product> findProduct(String webCode) {
        if (webCode == null || webCode.isBlank()) {
            return Optional.empty();
        }
        return productStore.findByWebCode(webCode.trim());
    }

    public List<PriceHistoryEntry> priceHistory(String webCode) {
        if (webCode == null || webCode.isBlank()) {
            return List.of();
        }
        return historyStore.findByWebCode(webCode.trim());
    }
}
