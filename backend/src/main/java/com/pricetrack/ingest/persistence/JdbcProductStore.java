package com.pricetrack.ingest.persistence;

import com.pricetrack.ingest.model.NormalizedProduct;
import com.pricetrack.ingest.model.Product;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcProductStore implements ProductStore {
    private static final RowMapper<Product> PRODUCT_ROW_MAPPER = (rs, rowNum) -> new Product(
        rs.getLong("product_id"),
        rs.getString("web_code"),
        rs.getString("title"),
        rs.getString("model"),
        rs.getString("url"),
        rs.getLong("price_cents"),
        rs.getLong("save_cents"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant()
    );

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcProductStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Product> findByWebCode(String webCode) {
        List<Product> products = jdbc.query(
            """
                SELECT product_id, web_code, title, model, url, price_cents, save_cents, created_at, updated_at
                FROM products
                WHERE web_code = :webCode
                """,
            new MapSqlParameterSource().addValue("webCode", webCode),
            PRODUCT_ROW_MAPPER
        );
        return products.isEmpty() ? Optional.empty() : Optional.of(products.get(0));
    }

    @Override
    public long insert(NormalizedProduct product) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("webCode", product.webCode())
            .addValue("title", product.title())
            .addValue("model", product.model())
            .addValue("url", product.url())
            .addValue("priceCents", product.priceCents())
            .addValue("saveCents", product.saveCents())
            .addValue("now", Timestamp.from(product.observedAt()));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO products (web_code, title, model, url, price_cents, save_cents, created_at, updated_at)
                VALUES (:webCode, :title, :model, :url, :priceCents, :saveCents, :now, :now)
                """,
            params,
            keyHolder,
            new String[] {"product_id"}
        );

        Number key = keyHolder.getKey();
        if (key != null) {
            return key.longValue();
        }

        Long fallback = jdbc.queryForObject(
            "SELECT product_id FROM products WHERE web_code = :webCode",
            new MapSqlParameterSource().addValue("webCode", product.webCode()),
            Long.class
        );
        if (fallback == null) {
            throw new IllegalStateException("Failed to resolve product_id for " + product.webCode());
        }
        return fallback;
    }

    @Override
    public void updatePrice(long productId, long priceCents, long saveCents, Instant observedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("productId", productId)
            .addValue("priceCents", priceCents)
            .addValue("saveCents", saveCents)
            .addValue("now", Timestamp.from(observedAt));
        jdbc.update(
            """
                UPDATE products
                SET price_cents = :priceCents,
                    save_cents = :saveCents,
                    updated_at = :now
                WHERE product_id = :productId
                """,
            params
        );
    }

    @Override
    public void refresh(long productId, long saveCents, Instant observedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("productId", productId)
            .addValue("saveCents", saveCents)
            .addValue("now", Timestamp.from(observedAt));
        jdbc.update(
            """
                UPDATE products
                SET save_cents = :saveCents,
                    updated_at = :now
                WHERE product_id = :productId
                """,
            params
        );
    }
}
