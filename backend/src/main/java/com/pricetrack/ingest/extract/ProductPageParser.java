package com.pricetrack.ingest.extract;

import com.pricetrack.ingest.model.NormalizedProduct;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Reads the product fields out of a retailer product page. Prefers the
 * page's {@code data-automation} attributes over generated CSS class names.
 */
@Component
public class ProductPageParser {
    static final String TITLE_SELECTOR = "h1";
    static final String MODEL_SELECTOR = "[data-automation=MODEL_NUMBER_ID]";
    static final String WEB_CODE_SELECTOR = "[data-automation=SKU_ID]";
    static final String PRICE_SELECTOR = "[data-automation=product-price] span, span[class*=screenReaderOnly]";
    static final String SAVING_SELECTOR = "[data-automation=product-saving], span[class*=productSaving]";

    public Optional<NormalizedProduct> parse(Document document, String requestedWebCode, Instant observedAt) {
        if (document == null) {
            return Optional.empty();
        }
        String webCode = ProductAmounts.stripPrefix(text(document, WEB_CODE_SELECTOR), "Web Code:");
        String priceText = text(document, PRICE_SELECTOR);
        if (webCode.isEmpty() || priceText.isEmpty()) {
            return Optional.empty();
        }
        if (requestedWebCode != null && !requestedWebCode.isBlank() && !requestedWebCode.trim().equals(webCode)) {
            return Optional.empty();
        }

        String title = text(document, TITLE_SELECTOR);
        String model = ProductAmounts.stripPrefix(text(document, MODEL_SELECTOR), "Model:");
        String savingText = ProductAmounts.stripPrefix(text(document, SAVING_SELECTOR), "SAVE");
        String url = document.location();

        return Optional.of(new NormalizedProduct(
            webCode,
            title,
            model.isEmpty() ? null : model,
            url == null || url.isBlank() ? null : url,
            ProductAmounts.toCents(priceText),
            ProductAmounts.toCents(savingText),
            observedAt
        ));
    }

    private String text(Document document, String selector) {
        Element element = document.selectFirst(selector);
        return element == null ? "" : element.text().trim();
    }
}
