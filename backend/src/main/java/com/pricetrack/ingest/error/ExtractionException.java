package com.pricetrack.ingest.error;

public class ExtractionException extends RetryableFailureException {
    public ExtractionException(String webCode, String message) {
        super(webCode, message, null);
    }

    public ExtractionException(String webCode, String message, Throwable cause) {
        super(webCode, message, cause);
    }

    @Override
    public String errorCode() {
        return "extraction_failure";
    }
}
