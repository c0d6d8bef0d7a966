package com.pricetrack.ingest.queue;

import com.pricetrack.config.TrackerProperties;
import com.pricetrack.ingest.model.JobQueueStats;
import com.pricetrack.ingest.model.JobUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.lang.management.ManagementFactory;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Queue backed by the {@code job_queue} table. A poll claims a row by setting
 * a lease; the row is deleted on acknowledge and becomes claimable again once
 * the lease runs out.
 */
@Repository
@ConditionalOnProperty(prefix = "tracker.queue", name = "backend", havingValue = "jdbc", matchIfMissing = true)
public class JdbcJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobQueue.class);
    private static final int CLAIM_CANDIDATES = 5;
    private static final long IDLE_SLEEP_MS = 100;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;
    private final long leaseSeconds;
    private final String instanceId;

    public JdbcJobQueue(NamedParameterJdbcTemplate jdbc, Clock clock, TrackerProperties properties) {
        this.jdbc = jdbc;
        this.clock = clock;
        this.leaseSeconds = properties.getQueue().getLeaseSeconds();
        this.instanceId = "worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @Override
    public void enqueue(JobUnit unit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", unit.jobId())
            .addValue("webCode", unit.webCode())
            .addValue("now", Timestamp.from(clock.instant()));
        jdbc.update(
            """
                INSERT INTO job_queue (job_id, web_code, enqueued_at, delivery_count)
                VALUES (:jobId, :webCode, :now, 0)
                """,
            params
        );
    }

    @Override
    public JobUnit poll(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            JobUnit claimed = claimNext();
            if (claimed != null) {
                return claimed;
            }
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                return null;
            }
            Thread.sleep(Math.min(IDLE_SLEEP_MS, remainingMs));
        }
    }

    JobUnit claimNext() {
        Instant now = clock.instant();
        MapSqlParameterSource candidateParams = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("limit", CLAIM_CANDIDATES);
        List<String> candidates = jdbc.queryForList(
            """
                SELECT job_id
                FROM job_queue
                WHERE locked_until IS NULL OR locked_until < :now
                ORDER BY enqueued_at ASC, job_id ASC
                LIMIT :limit
                """,
            candidateParams,
            String.class
        );

        String lockOwner = instanceId + "/" + Thread.currentThread().getName();
        for (String jobId : candidates) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("now", Timestamp.from(now))
                .addValue("lockedUntil", Timestamp.from(now.plusSeconds(leaseSeconds)))
                .addValue("lockOwner", lockOwner);
            // Conditional on the lease still being free, so only one poller wins the row.
            int claimed = jdbc.update(
                """
                    UPDATE job_queue
                    SET locked_until = :lockedUntil,
                        lock_owner = :lockOwner,
                        delivery_count = delivery_count + 1
                    WHERE job_id = :jobId
                      AND (locked_until IS NULL OR locked_until < :now)
                    """,
                params
            );
            if (claimed == 1) {
                JobUnit unit = loadUnit(jobId);
                if (unit != null) {
                    if (unit.isRedelivery()) {
                        log.warn("Redelivering job {} (delivery {})", unit.jobId(), unit.deliveryCount());
                    }
                    return unit;
                }
            }
        }
        return null;
    }

    private JobUnit loadUnit(String jobId) {
        List<JobUnit> units = jdbc.query(
            """
                SELECT job_id, web_code, delivery_count
                FROM job_queue
                WHERE job_id = :jobId
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            (rs, rowNum) -> new JobUnit(
                rs.getString("job_id"),
                rs.getString("web_code"),
                rs.getInt("delivery_count")
            )
        );
        return units.isEmpty() ? null : units.get(0);
    }

    @Override
    public void acknowledge(JobUnit unit) {
        jdbc.update(
            "DELETE FROM job_queue WHERE job_id = :jobId",
            new MapSqlParameterSource().addValue("jobId", unit.jobId())
        );
    }

    @Override
    public void release(JobUnit unit) {
        // The lease is kept; the row becomes claimable again once it runs out.
        log.debug("Released job {} with lease intact", unit.jobId());
    }

    @Override
    public JobQueueStats stats() {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(clock.instant()));
        Long queuedCount = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM job_queue
                WHERE locked_until IS NULL OR locked_until < :now
                """,
            params,
            Long.class
        );
        Long leasedCount = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM job_queue
                WHERE locked_until IS NOT NULL
                  AND locked_until >= :now
                """,
            params,
            Long.class
        );
        Timestamp oldest = jdbc.queryForObject(
            "SELECT MIN(enqueued_at) FROM job_queue",
            params,
            Timestamp.class
        );
        return new JobQueueStats(
            "jdbc",
            queuedCount == null ? 0L : queuedCount,
            leasedCount == null ? 0L : leasedCount,
            oldest == null ? null : oldest.toInstant()
        );
    }
}
