package com.pricetrack.ingest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.error.InvalidInputException;
import com.pricetrack.ingest.error.InvalidProductException;
import com.pricetrack.ingest.error.JobInterruptedException;
import com.pricetrack.ingest.error.JobNotFoundException;
import com.pricetrack.ingest.error.RetryExhaustedException;
import com.pricetrack.ingest.error.RetryableFailureException;
import com.pricetrack.ingest.extract.ProductExtractor;
import com.pricetrack.ingest.model.IngestionResult;
import com.pricetrack.ingest.model.Job;
import com.pricetrack.ingest.model.JobUnit;
import com.pricetrack.ingest.model.JobView;
import com.pricetrack.ingest.persistence.JobStore;
import com.pricetrack.ingest.queue.JobQueue;
import com.pricetrack.ingest.retry.BackoffExecutor;
import com.pricetrack.ingest.retry.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

@Service
public class JobOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(JobOrchestratorService.class);
    private static final Pattern WEB_CODE_PATTERN = Pattern.compile("[A-Za-z0-9-]+");
    private static final int MAX_ERROR_LENGTH = 500;

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final ProductExtractor extractor;
    private final ProductIngestionService ingestionService;
    private final BackoffExecutor backoffExecutor;
    private final TransactionOperations transactionOperations;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TrackerProperties properties;

    public JobOrchestratorService(
        JobStore jobStore,
        JobQueue jobQueue,
        ProductExtractor extractor,
        ProductIngestionService ingestionService,
        BackoffExecutor backoffExecutor,
        TransactionOperations transactionOperations,
        ObjectMapper objectMapper,
        Clock clock,
        TrackerProperties properties
    ) {
        this.jobStore = jobStore;
        this.jobQueue = jobQueue;
        this.extractor = extractor;
        this.ingestionService = ingestionService;
        this.backoffExecutor = backoffExecutor;
        this.transactionOperations = transactionOperations;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Records a PENDING job and queues it for a worker. Never waits on
     * extraction.
     *
     * @throws InvalidInputException when the web code is blank, too long or
     *     contains characters outside {@code [A-Za-z0-9-]}
     */
    public String submit(String rawWebCode) {
        String webCode = normalizeWebCode(rawWebCode);
        String jobId = UUID.randomUUID().toString();
        transactionOperations.executeWithoutResult(status -> {
            jobStore.insert(jobId, webCode, clock.instant());
            jobQueue.enqueue(new JobUnit(jobId, webCode));
        });
        log.info("Submitted job {} for web code {}", jobId, webCode);
        return jobId;
    }

    /**
     * Runs one delivered unit to a terminal state. Redeliveries of finished
     * jobs are ignored. Failures end up on the job row and are not rethrown.
     *
     * @throws JobInterruptedException when the worker thread is interrupted;
     *     the job stays IN_PROGRESS and the unit must not be acknowledged
     */
    public void execute(JobUnit unit) {
        Optional<Job> current = jobStore.findById(unit.jobId());
        if (current.isEmpty()) {
            log.warn("Skipping unit for unknown job {}", unit.jobId());
            return;
        }
        Job job = current.get();
        if (job.isTerminal()) {
            log.info("Skipping job {}: already {}", job.jobId(), job.status());
            return;
        }
        if (!jobStore.markInProgress(job.jobId(), clock.instant())) {
            log.warn("Job {} could not be moved to IN_PROGRESS; skipping", job.jobId());
            return;
        }
        log.info("Job {} in progress for web code {} (delivery {})", job.jobId(), job.webCode(), unit.deliveryCount());

        AtomicInteger attempts = new AtomicInteger();
        try {
            Optional<IngestionResult> result = backoffExecutor.execute(
                () -> {
                    attempts.incrementAndGet();
                    return extractor.fetch(job.webCode()).map(ingestionService::ingest);
                },
                retryPolicy()
            );
            if (result.isPresent()) {
                complete(job, result.get(), attempts.get());
            } else {
                fail(job, "not_found", "No product found for web code " + job.webCode(), attempts.get());
            }
        } catch (RetryExhaustedException e) {
            throwIfInterrupted(job, attempts.get(), e);
            Throwable cause = e.getCause();
            String code = cause instanceof RetryableFailureException retryable ? retryable.errorCode() : "retry_exhausted";
            fail(job, code, e.getMessage(), attempts.get());
        } catch (InvalidProductException e) {
            fail(job, "invalid_product", e.getMessage(), attempts.get());
        } catch (RuntimeException e) {
            throwIfInterrupted(job, attempts.get(), e);
            log.warn("Job {} failed unexpectedly", job.jobId(), e);
            fail(job, "unexpected_error", e.getClass().getSimpleName() + ": " + e.getMessage(), attempts.get());
        }
    }

    public Job getJob(String jobId) {
        return findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public Optional<Job> findJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        return jobStore.findById(jobId.trim());
    }

    public List<Job> listJobs(Integer limit) {
        int resolved = limit == null ? properties.getJobs().getDefaultListLimit() : Math.max(1, limit);
        return jobStore.findRecent(resolved);
    }

    public JobView toView(Job job) {
        return new JobView(
            job.jobId(),
            job.webCode(),
            job.status(),
            job.status().label(),
            readJson(job.result()),
            readJson(job.error()),
            job.productId(),
            job.attempts(),
            job.createdAt(),
            job.updatedAt()
        );
    }

    /** Fails a job that was left IN_PROGRESS, e.g. by a crashed worker. */
    public boolean failStale(Job job, String message) {
        String error = errorJson("stale_in_progress", message, job.attempts());
        return jobStore.markFailed(job.jobId(), error, job.attempts(), clock.instant());
    }

    BackoffPolicy retryPolicy() {
        TrackerProperties.Retry retry = properties.getRetry();
        return new BackoffPolicy(
            retry.getMaxAttempts(),
            Duration.ofMillis(retry.getInitialDelayMs()),
            retry.getBackoffFactor(),
            retry.isRetryOnEmptyResult(),
            failure -> !(failure instanceof InvalidInputException)
        );
    }

    String normalizeWebCode(String rawWebCode) {
        String webCode = rawWebCode == null ? "" : rawWebCode.trim();
        if (webCode.isEmpty()) {
            throw new InvalidInputException("webCode is required");
        }
        int maxLength = properties.getJobs().getMaxWebCodeLength();
        if (webCode.length() > maxLength) {
            throw new InvalidInputException("webCode must be at most " + maxLength + " characters");
        }
        if (!WEB_CODE_PATTERN.matcher(webCode).matches()) {
            throw new InvalidInputException("webCode may only contain letters, digits and '-'");
        }
        return webCode;
    }

    private static void throwIfInterrupted(Job job, int attempts, RuntimeException failure) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Job {} interrupted after {} attempt(s); leaving it IN_PROGRESS", job.jobId(), attempts);
            throw new JobInterruptedException(job.jobId(), failure);
        }
    }

    private void complete(Job job, IngestionResult result, int attempts) {
        String resultJson = writeJson(result);
        if (jobStore.markCompleted(job.jobId(), resultJson, result.productId(), attempts, clock.instant())) {
            log.info(
                "Job {} completed: {} productId={} after {} attempt(s)",
                job.jobId(),
                result.outcome(),
                result.productId(),
                attempts
            );
        } else {
            log.warn("Job {} was no longer IN_PROGRESS; completion not recorded", job.jobId());
        }
    }

    private void fail(Job job, String code, String message, int attempts) {
        String error = errorJson(code, message, attempts);
        if (jobStore.markFailed(job.jobId(), error, attempts, clock.instant())) {
            log.warn("Job {} failed ({}) after {} attempt(s): {}", job.jobId(), code, attempts, message);
        } else {
            log.warn("Job {} was no longer IN_PROGRESS; failure not recorded", job.jobId());
        }
    }

    private String errorJson(String code, String message, int attempts) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", code);
        node.put("message", truncate(message));
        node.put("attempts", attempts);
        return node.toString();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job result", e);
        }
    }

    private JsonNode readJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(raw);
        }
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
