package com.pricetrack.ingest.model;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    PENDING("Pending"),
    IN_PROGRESS("In Progress"),
    COMPLETED("Completed"),
    FAILED("Failed");

    private final String label;

    JobStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Statuses a job may move to from this one. IN_PROGRESS may be re-entered
     * when a queue unit is redelivered after a worker crash.
     */
    public Set<JobStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS -> EnumSet.of(IN_PROGRESS, COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    public boolean canTransitionTo(JobStatus next) {
        return next != null && allowedNext().contains(next);
    }

    public static JobStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing job status");
        }
        return JobStatus.valueOf(raw.trim());
    }
}
