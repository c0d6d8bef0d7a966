package com.pricetrack.ingest.error;

/**
 * Raised when a worker is interrupted mid-job. The job keeps its IN_PROGRESS
 * state so the unit can be delivered again.
 */
public class JobInterruptedException extends RuntimeException {
    private final String jobId;

    public JobInterruptedException(String jobId, Throwable cause) {
        super("Interrupted while running job " + jobId, cause);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
