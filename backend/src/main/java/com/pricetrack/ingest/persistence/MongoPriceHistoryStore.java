package com.pricetrack.ingest.persistence;

import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.model.PriceHistoryEntry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@ConditionalOnProperty(prefix = "tracker.history", name = "backend", havingValue = "mongo", matchIfMissing = true)
public class MongoPriceHistoryStore implements PriceHistoryStore {
    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoPriceHistoryStore(MongoTemplate mongoTemplate, TrackerProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.collection = properties.getHistory().getCollection();
    }

    @Override
    public void append(PriceHistoryEntry entry) {
        mongoTemplate.insert(PriceHistoryDocument.from(entry), collection);
    }

    @Override
    public List<PriceHistoryEntry> findByWebCode(String webCode) {
        Query query = Query.query(Criteria.where("webCode").is(webCode))
            .with(Sort.by(Sort.Direction.ASC, "observedAt"));
        return mongoTemplate.find(query, PriceHistoryDocument.class, collection).stream()
            .map(PriceHistoryDocument::toEntry)
            .toList();
    }

    @Override
    public long countByWebCode(String webCode) {
        return mongoTemplate.count(Query.query(Criteria.where("webCode").is(webCode)), PriceHistoryDocument.class, collection);
    }
}
