package com.pricetrack.ingest.error;

public class RetryExhaustedException extends RuntimeException {
    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("Gave up after " + attempts + " attempt(s): " + describe(lastFailure), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "no result";
        }
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }
}
