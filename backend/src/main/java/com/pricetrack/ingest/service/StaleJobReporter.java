package com.pricetrack.ingest.service;

import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.model.Job;
import com.pricetrack.ingest.persistence.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Start-up check for jobs stuck IN_PROGRESS, typically left behind by a
 * worker that died mid-execution.
 */
@Component
public class StaleJobReporter implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StaleJobReporter.class);

    private final JobStore jobStore;
    private final JobOrchestratorService orchestratorService;
    private final TrackerProperties properties;
    private final Clock clock;

    public StaleJobReporter(
        JobStore jobStore,
        JobOrchestratorService orchestratorService,
        TrackerProperties properties,
        Clock clock
    ) {
        this.jobStore = jobStore;
        this.orchestratorService = orchestratorService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = jobStore.isReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping stale job check because database is unreachable");
            return;
        }
        report();
    }

    int report() {
        int staleMinutes = properties.getJobs().getStaleMinutes();
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(staleMinutes));
        List<Job> stale = jobStore.findStaleInProgress(cutoff);
        int failed = 0;
        for (Job job : stale) {
            log.warn(
                "Job {} for web code {} has been IN_PROGRESS since {}",
                job.jobId(),
                job.webCode(),
                job.updatedAt()
            );
            if (properties.getJobs().isFailStaleOnStartup()
                && orchestratorService.failStale(job, "No progress for more than " + staleMinutes + " minutes")) {
                failed++;
                log.info("Marked stale job {} FAILED", job.jobId());
            }
        }
        return failed;
    }
}
