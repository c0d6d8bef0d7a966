package com.pricetrack.ingest.persistence;

import com.pricetrack.ingest.model.PriceHistoryEntry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

/**
 * Relational history backend, used when no document store is available.
 * Shares the transaction of the product write.
 */
@Repository
@ConditionalOnProperty(prefix = "tracker.history", name = "backend", havingValue = "jdbc")
public class JdbcPriceHistoryStore implements PriceHistoryStore {
    private final NamedParameterJdbcTemplate jdbc;

    public JdbcPriceHistoryStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void append(PriceHistoryEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("webCode", entry.webCode())
            .addValue("priceCents", entry.priceCents())
            .addValue("saveCents", entry.saveCents())
            .addValue("observedAt", Timestamp.from(entry.observedAt()));
        jdbc.update(
            """
                INSERT INTO price_history (web_code, price_cents, save_cents, observed_at)
                VALUES (:webCode, :priceCents, :saveCents, :observedAt)
                """,
            params
        );
    }

    @Override
    public List<PriceHistoryEntry> findByWebCode(String webCode) {
        return jdbc.query(
            """
                SELECT web_code, price_cents, save_cents, observed_at
                FROM price_history
                WHERE web_code = :webCode
                ORDER BY observed_at ASC, history_id ASC
                """,
            new MapSqlParameterSource().addValue("webCode", webCode),
            (rs, rowNum) -> new PriceHistoryEntry(
                rs.getString("web_code"),
                rs.getLong("price_cents"),
                rs.getLong("save_cents"),
                rs.getTimestamp("observed_at").toInstant()
            )
        );
    }

    @Override
    public long countByWebCode(String webCode) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM price_history WHERE web_code = :webCode",
            new MapSqlParameterSource().addValue("webCode", webCode),
            Long.class
        );
        return count == null ? 0L : count;
    }
}
