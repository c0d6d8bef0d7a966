package com.pricetrack.ingest.error;

public abstract class RetryableFailureException extends RuntimeException {
    private final String webCode;

    protected RetryableFailureException(String webCode, String message, Throwable cause) {
        super(message, cause);
        this.webCode = webCode;
    }

    public String webCode() {
        return webCode;
    }

    public abstract String errorCode();
}
