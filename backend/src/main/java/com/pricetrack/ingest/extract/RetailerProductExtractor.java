package com.pricetrack.ingest.extract;

import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.error.ExtractionException;
import com.pricetrack.ingest.model.NormalizedProduct;
import org.jsoup.HttpStatusException;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
public class RetailerProductExtractor implements ProductExtractor {
    private static final Logger log = LoggerFactory.getLogger(RetailerProductExtractor.class);

    private final ProductPageClient pageClient;
    private final ProductPageParser parser;
    private final TrackerProperties properties;
    private final Clock clock;

    public RetailerProductExtractor(
        ProductPageClient pageClient,
        ProductPageParser parser,
        TrackerProperties properties,
        Clock clock
    ) {
        this.pageClient = pageClient;
        this.parser = parser;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Optional<NormalizedProduct> fetch(String webCode) {
        String url = productUrl(webCode);
        Document document;
        try {
            document = pageClient.fetchProductPage(
                url,
                properties.getExtraction().getUserAgent(),
                properties.getExtraction().getTimeoutMs()
            );
        } catch (HttpStatusException e) {
            if (e.getStatusCode() == 404 || e.getStatusCode() == 410) {
                log.info("Product page not found for web code {} (status {})", webCode, e.getStatusCode());
                return Optional.empty();
            }
            throw new ExtractionException(webCode, "http_status_" + e.getStatusCode() + " fetching " + url, e);
        } catch (IOException e) {
            throw new ExtractionException(webCode, "io_error fetching " + url + ": " + e.getMessage(), e);
        }

        Instant observedAt = clock.instant();
        Optional<NormalizedProduct> product = parser.parse(document, webCode, observedAt);
        if (product.isEmpty()) {
            log.info("No product details on page {} for web code {}", url, webCode);
        }
        return product;
    }

    String productUrl(String webCode) {
        String encoded = URLEncoder.encode(webCode == null ? "" : webCode.trim(), StandardCharsets.UTF_8);
        return properties.getExtraction().getProductUrlTemplate().replace("{webCode}", encoded);
    }
}
