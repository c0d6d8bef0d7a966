package com.pricetrack.ingest.service;

import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.error.JobInterruptedException;
import com.pricetrack.ingest.model.JobUnit;
import com.pricetrack.ingest.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed pool of worker threads draining the {@link JobQueue}. Each worker runs
 * one job at a time: poll, execute, acknowledge.
 */
@Service
public class JobWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(JobWorkerPool.class);

    private final JobQueue jobQueue;
    private final JobOrchestratorService orchestratorService;
    private final TrackerProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;
    private int activeWorkerCount;

    public JobWorkerPool(JobQueue jobQueue, JobOrchestratorService orchestratorService, TrackerProperties properties) {
        this.jobQueue = jobQueue;
        this.orchestratorService = orchestratorService;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorkers().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getActiveWorkerCount() {
        return activeWorkerCount;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getWorkers().getWorkerCount();
            Duration pollTimeout = Duration.ofMillis(properties.getWorkers().getPollIntervalMs());
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("job-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollTimeout));
            }
            log.info("Started {} job worker(s)", workerCount);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Stopped job workers");
        }
    }

    private void workerLoop(int workerIndex, Duration pollTimeout) {
        Thread.currentThread().setName("job-worker-" + workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            JobUnit unit;
            try {
                unit = jobQueue.poll(pollTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                log.warn("Worker {} failed to poll the job queue", workerIndex, e);
                pause(pollTimeout);
                continue;
            }
            if (unit == null) {
                continue;
            }
            if (!runUnit(workerIndex, unit)) {
                pause(pollTimeout);
            }
        }
    }

    /**
     * Executes one unit and acknowledges it. A unit whose execution throws is
     * released unacknowledged so it is delivered again.
     *
     * @return false when execution did not finish
     */
    boolean runUnit(int workerIndex, JobUnit unit) {
        try {
            orchestratorService.execute(unit);
        } catch (JobInterruptedException e) {
            log.info("Worker {} interrupted during job {}; releasing it", workerIndex, unit.jobId());
            releaseQuietly(workerIndex, unit);
            return false;
        } catch (Exception e) {
            log.warn("Worker {} failed while executing job {}", workerIndex, unit.jobId(), e);
            releaseQuietly(workerIndex, unit);
            return false;
        }
        try {
            jobQueue.acknowledge(unit);
        } catch (Exception e) {
            log.warn("Worker {} failed to acknowledge job {}", workerIndex, unit.jobId(), e);
        }
        return true;
    }

    private void releaseQuietly(int workerIndex, JobUnit unit) {
        try {
            jobQueue.release(unit);
        } catch (Exception e) {
            log.warn("Worker {} failed to release job {}", workerIndex, unit.jobId(), e);
        }
    }

    private void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
