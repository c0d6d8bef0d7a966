package com.pricetrack.ingest.service;

import com.pricetrack.ingest.model.JobQueueStats;
import com.pricetrack.ingest.model.StatusResponse;
import com.pricetrack.ingest.persistence.JobStore;
import com.pricetrack.ingest.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class TrackerStatusService {
    private static final Logger log = LoggerFactory.getLogger(TrackerStatusService.class);

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final JobWorkerPool workerPool;

    public TrackerStatusService(JobStore jobStore, JobQueue jobQueue, JobWorkerPool workerPool) {
        this.jobStore = jobStore;
        this.jobQueue = jobQueue;
        this.workerPool = workerPool;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = jobStore.isReachable();
        } catch (Exception e) {
            log.warn("Database connectivity check failed", e);
            dbConnected = false;
        }

        Map<String, Long> counts = Map.of();
        JobQueueStats queueStats = null;
        if (dbConnected) {
            try {
                counts = jobStore.countByStatus();
                queueStats = jobQueue.stats();
            } catch (Exception e) {
                log.warn("Failed to load job status counts", e);
            }
        }
        return new StatusResponse(
            dbConnected,
            counts,
            queueStats,
            workerPool.isRunning(),
            workerPool.getActiveWorkerCount()
        );
    }
}
