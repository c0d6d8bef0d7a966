package com.pricetrack.ingest.extract;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

public final class ProductAmounts {
    private static final Pattern NON_AMOUNT = Pattern.compile("[^\\d.]");

    private ProductAmounts() {
    }

    /**
     * Parses a display amount such as {@code "$1,299.99"} or {@code "SAVE $50"}
     * into cents. Blank or unparseable input is 0.
     */
    public static long toCents(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        String cleaned = NON_AMOUNT.matcher(raw).replaceAll("");
        if (cleaned.isEmpty() || cleaned.equals(".")) {
            return 0L;
        }
        try {
            return new BigDecimal(cleaned)
                .movePointRight(2)
                .setScale(0, RoundingMode.DOWN)
                .longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return 0L;
        }
    }

    public static String stripPrefix(String text, String prefix) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (prefix != null && !prefix.isEmpty() && trimmed.contains(prefix)) {
            return trimmed.replace(prefix, "").trim();
        }
        return trimmed;
    }
}
