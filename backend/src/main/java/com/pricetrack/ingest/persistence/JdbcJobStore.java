package com.pricetrack.ingest.persistence;

import com.pricetrack.ingest.model.Job;
import com.pricetrack.ingest.model.JobStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcJobStore implements JobStore {
    private static final RowMapper<Job> JOB_ROW_MAPPER = (rs, rowNum) -> new Job(
        rs.getString("job_id"),
        rs.getString("web_code"),
        JobStatus.parse(rs.getString("status")),
        rs.getString("result"),
        rs.getString("error"),
        rs.getObject("product_id") == null ? null : rs.getLong("product_id"),
        rs.getInt("attempts"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant()
    );

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcJobStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void insert(String jobId, String webCode, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("webCode", webCode)
            .addValue("status", JobStatus.PENDING.name())
            .addValue("now", Timestamp.from(createdAt));
        jdbc.update(
            """
                INSERT INTO jobs (job_id, web_code, status, attempts, created_at, updated_at)
                VALUES (:jobId, :webCode, :status, 0, :now, :now)
                """,
            params
        );
    }

    @Override
    public Optional<Job> findById(String jobId) {
        List<Job> jobs = jdbc.query(
            """
                SELECT job_id, web_code, status, result, error, product_id, attempts, created_at, updated_at
                FROM jobs
                WHERE job_id = :jobId
                """,
            new MapSqlParameterSource().addValue("jobId", jobId),
            JOB_ROW_MAPPER
        );
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    @Override
    public List<Job> findRecent(int limit) {
        return jdbc.query(
            """
                SELECT job_id, web_code, status, result, error, product_id, attempts, created_at, updated_at
                FROM jobs
                ORDER BY created_at DESC, job_id
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            JOB_ROW_MAPPER
        );
    }

    @Override
    public boolean markInProgress(String jobId, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", JobStatus.IN_PROGRESS.name())
            .addValue("pending", JobStatus.PENDING.name())
            .addValue("inProgress", JobStatus.IN_PROGRESS.name())
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE jobs
                SET status = :status,
                    updated_at = GREATEST(updated_at, :now)
                WHERE job_id = :jobId
                  AND status IN (:pending, :inProgress)
                """,
            params
        );
        return updated == 1;
    }

    @Override
    public boolean markCompleted(String jobId, String result, Long productId, int attempts, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", JobStatus.COMPLETED.name())
            .addValue("inProgress", JobStatus.IN_PROGRESS.name())
            .addValue("result", result)
            .addValue("productId", productId, Types.BIGINT)
            .addValue("attempts", attempts)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE jobs
                SET status = :status,
                    result = :result,
                    error = NULL,
                    product_id = COALESCE(:productId, product_id),
                    attempts = :attempts,
                    updated_at = GREATEST(updated_at, :now)
                WHERE job_id = :jobId
                  AND status = :inProgress
                """,
            params
        );
        return updated == 1;
    }

    @Override
    public boolean markFailed(String jobId, String error, int attempts, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", JobStatus.FAILED.name())
            .addValue("inProgress", JobStatus.IN_PROGRESS.name())
            .addValue("error", error)
            .addValue("attempts", attempts)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE jobs
                SET status = :status,
                    result = NULL,
                    error = :error,
                    attempts = :attempts,
                    updated_at = GREATEST(updated_at, :now)
                WHERE job_id = :jobId
                  AND status = :inProgress
                """,
            params
        );
        return updated == 1;
    }

    @Override
    public List<Job> findStaleInProgress(Instant updatedBefore) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("inProgress", JobStatus.IN_PROGRESS.name())
            .addValue("cutoff", Timestamp.from(updatedBefore));
        return jdbc.query(
            """
                SELECT job_id, web_code, status, result, error, product_id, attempts, created_at, updated_at
                FROM jobs
                WHERE status = :inProgress
                  AND updated_at < :cutoff
                ORDER BY updated_at ASC
                """,
            params,
            JOB_ROW_MAPPER
        );
    }

    @Override
    public Map<String, Long> countByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (JobStatus status : JobStatus.values()) {
            counts.put(status.name(), 0L);
        }
        jdbc.query(
            """
                SELECT status, COUNT(*) AS total
                FROM jobs
                GROUP BY status
                """,
            new MapSqlParameterSource(),
            rs -> {
                String status = rs.getString("status");
                if (status != null) {
                    counts.put(status, rs.getLong("total"));
                }
            }
        );
        return counts;
    }

    @Override
    public boolean isReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }
}
