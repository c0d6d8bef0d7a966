package com.pricetrack.ingest.service;

import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.error.IngestionException;
import com.pricetrack.ingest.error.InvalidProductException;
import com.pricetrack.ingest.model.IngestionOutcome;
import com.pricetrack.ingest.model.IngestionResult;
import com.pricetrack.ingest.model.NormalizedProduct;
import com.pricetrack.ingest.model.PriceHistoryEntry;
import com.pricetrack.ingest.model.Product;
import com.pricetrack.ingest.persistence.PriceHistoryStore;
import com.pricetrack.ingest.persistence.ProductStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a freshly extracted product is a new row, a price change, a
 * same-day repeat or a first sighting on a new day, and writes accordingly.
 *
 * <p>Same-day repeats with an unchanged price write nothing, which is what
 * keeps resubmitted and retried jobs from duplicating history.
 */
@Service
public class ProductIngestionService {
    private static final Logger log = LoggerFactory.getLogger(ProductIngestionService.class);

    private final ProductStore productStore;
    private final PriceHistoryStore historyStore;
    private final TransactionOperations transactionOperations;
    private final ZoneId zone;

    public ProductIngestionService(
        ProductStore productStore,
        PriceHistoryStore historyStore,
        TransactionOperations transactionOperations,
        TrackerProperties properties
    ) {
        this.productStore = productStore;
        this.historyStore = historyStore;
        this.transactionOperations = transactionOperations;
        this.zone = properties.zone();
    }

    public IngestionResult ingest(NormalizedProduct product) {
        validate(product);
        try {
            IngestionResult result = transactionOperations.execute(status -> decideAndWrite(product));
            if (result == null) {
                throw new IngestionException(product.webCode(), "Ingestion produced no result", null);
            }
            log.info(
                "Ingested {} -> {} (productId={}, priceCents={})",
                product.webCode(),
                result.outcome(),
                result.productId(),
                product.priceCents()
            );
            return result;
        } catch (DataAccessException e) {
            throw new IngestionException(product.webCode(), "Storage failure while ingesting " + product.webCode(), e);
        }
    }

    private IngestionResult decideAndWrite(NormalizedProduct product) {
        Optional<Product> existing = productStore.findByWebCode(product.webCode());
        if (existing.isEmpty()) {
            long productId = productStore.insert(product);
            historyStore.append(PriceHistoryEntry.of(product));
            return new IngestionResult(productId, IngestionOutcome.INSERTED, product);
        }

        Product stored = existing.get();
        if (stored.priceCents() != product.priceCents()) {
            productStore.updatePrice(stored.productId(), product.priceCents(), product.saveCents(), product.observedAt());
            historyStore.append(PriceHistoryEntry.of(product));
            return new IngestionResult(stored.productId(), IngestionOutcome.UPDATED_CHANGED, product);
        }

        if (sameDay(stored, product)) {
            return new IngestionResult(stored.productId(), IngestionOutcome.NO_ACTION_SAME_DAY_UNCHANGED, product);
        }

        productStore.refresh(stored.productId(), product.saveCents(), product.observedAt());
        historyStore.append(PriceHistoryEntry.of(product));
        return new IngestionResult(stored.productId(), IngestionOutcome.UPDATED_TODAY, product);
    }

    private boolean sameDay(Product stored, NormalizedProduct product) {
        LocalDate storedDay = LocalDate.ofInstant(stored.updatedAt(), zone);
        LocalDate observedDay = LocalDate.ofInstant(product.observedAt(), zone);
        return storedDay.equals(observedDay);
    }

    static void validate(NormalizedProduct product) {
        if (product == null) {
            throw new InvalidProductException(null, List.of("product"));
        }
        List<String> invalid = new ArrayList<>();
        if (isBlank(product.webCode())) {
            invalid.add("webCode");
        }
        if (isBlank(product.title())) {
            invalid.add("title");
        }
        if (isBlank(product.url())) {
            invalid.add("url");
        }
        if (product.observedAt() == null) {
            invalid.add("observedAt");
        }
        if (product.priceCents() < 0) {
            invalid.add("priceCents");
        }
        if (product.saveCents() < 0) {
            invalid.add("saveCents");
        }
        if (!invalid.isEmpty()) {
            throw new InvalidProductException(product.webCode(), invalid);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
