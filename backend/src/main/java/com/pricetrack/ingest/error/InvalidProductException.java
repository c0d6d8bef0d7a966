package com.pricetrack.ingest.error;

import java.util.List;

/**
 * A normalized product that cannot be ingested. Retrying the same extraction
 * will not fix it, so the backoff policy does not retry this type.
 */
public class InvalidProductException extends InvalidInputException {
    private final String webCode;
    private final List<String> invalidFields;

    public InvalidProductException(String webCode, List<String> invalidFields) {
        super("Invalid product " + webCode + ": " + String.join(",", invalidFields));
        this.webCode = webCode;
        this.invalidFields = List.copyOf(invalidFields);
    }

    public String webCode() {
        return webCode;
    }

    public List<String> invalidFields() {
        return invalidFields;
    }
}
