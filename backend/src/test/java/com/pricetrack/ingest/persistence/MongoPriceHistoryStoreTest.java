package com.pricetrack.ingest.persistence;

import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.model.PriceHistoryEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoPriceHistoryStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-02T12:00:00Z");

    @Mock
    private MongoTemplate mongoTemplate;

    @Test
    void appendInsertsDocumentIntoConfiguredCollection() {
        TrackerProperties properties = new TrackerProperties();
        properties.getHistory().setCollection("price_history_test");
        MongoPriceHistoryStore store = new MongoPriceHistoryStore(mongoTemplate, properties);

        store.append(new PriceHistoryEntry("16162309", 39999L, 10000L, T0));

        ArgumentCaptor<PriceHistoryDocument> captor = ArgumentCaptor.forClass(PriceHistoryDocument.class);
        verify(mongoTemplate).insert(captor.capture(), eq("price_history_test"));
        PriceHistoryDocument document = captor.getValue();
        assertThat(document.id()).isNull();
        assertThat(document.webCode()).isEqualTo("16162309");
        assertThat(document.priceCents()).isEqualTo(39999L);
        assertThat(document.saveCents()).isEqualTo(10000L);
        assertThat(document.observedAt()).isEqualTo(T0);
    }

    @Test
    void findMapsDocumentsBackToEntries() {
        MongoPriceHistoryStore store = new MongoPriceHistoryStore(mongoTemplate, new TrackerProperties());
        when(mongoTemplate.find(any(Query.class), eq(PriceHistoryDocument.class), eq("price_history")))
            .thenReturn(List.of(
                new PriceHistoryDocument("a", "16162309", 100L, 0L, T0),
                new PriceHistoryDocument("b", "16162309", 150L, 0L, T0.plusSeconds(60))
            ));

        List<PriceHistoryEntry> history = store.findByWebCode("16162309");

        assertThat(history).containsExactly(
            new PriceHistoryEntry("16162309", 100L, 0L, T0),
            new PriceHistoryEntry("16162309", 150L, 0L, T0.plusSeconds(60))
        );
    }
}
