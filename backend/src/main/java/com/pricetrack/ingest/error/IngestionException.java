package com.pricetrack.ingest.error;

public class IngestionException extends RetryableFailureException {
    public IngestionException(String webCode, String message, Throwable cause) {
        super(webCode, message, cause);
    }

    @Override
    public String errorCode() {
        return "ingestion_failure";
    }
}
