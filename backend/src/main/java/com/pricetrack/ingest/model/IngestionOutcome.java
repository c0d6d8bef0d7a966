package com.pricetrack.ingest.model;

public enum IngestionOutcome {
    INSERTED,
    UPDATED_CHANGED,
    UPDATED_TODAY,
    NO_ACTION_SAME_DAY_UNCHANGED;

    public boolean wroteHistory() {
        return this != NO_ACTION_SAME_DAY_UNCHANGED;
    }
}
