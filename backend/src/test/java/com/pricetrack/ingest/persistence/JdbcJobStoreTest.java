package com.pricetrack.ingest.persistence;

import com.pricetrack.ingest.model.Job;
import com.pricetrack.ingest.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcJobStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-02T12:00:00Z");

    @Autowired
    private JobStore jobStore;

    @Test
    void insertedJobStartsPendingWithNoResult() {
        String jobId = UUID.randomUUID().toString();
        jobStore.insert(jobId, "16162309", T0);

        Job job = jobStore.findById(jobId).orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals("16162309", job.webCode());
        assertNull(job.result());
        assertNull(job.error());
        assertNull(job.productId());
        assertEquals(0, job.attempts());
        assertEquals(T0, job.createdAt());
        assertEquals(T0, job.updatedAt());
    }

    @Test
    void completedJobIsFinal() {
        String jobId = UUID.randomUUID().toString();
        jobStore.insert(jobId, "16162309", T0);

        assertTrue(jobStore.markInProgress(jobId, T0.plusSeconds(1)));
        assertTrue(jobStore.markCompleted(jobId, "{\"outcome\":\"INSERTED\"}", null, 1, T0.plusSeconds(2)));

        assertFalse(jobStore.markInProgress(jobId, T0.plusSeconds(3)));
        assertFalse(jobStore.markFailed(jobId, "{\"error\":\"late\"}", 3, T0.plusSeconds(4)));
        assertFalse(jobStore.markCompleted(jobId, "{\"outcome\":\"UPDATED_CHANGED\"}", null, 2, T0.plusSeconds(5)));

        Job job = jobStore.findById(jobId).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals("{\"outcome\":\"INSERTED\"}", job.result());
        assertNull(job.error());
        assertEquals(1, job.attempts());
        assertEquals(T0.plusSeconds(2), job.updatedAt());
    }

    @Test
    void pendingJobCannotJumpToTerminal() {
        String jobId = UUID.randomUUID().toString();
        jobStore.insert(jobId, "16162309", T0);

        assertFalse(jobStore.markCompleted(jobId, "{}", null, 1, T0.plusSeconds(1)));
        assertFalse(jobStore.markFailed(jobId, "{}", 1, T0.plusSeconds(1)));
        assertEquals(JobStatus.PENDING, jobStore.findById(jobId).orElseThrow().status());
    }

    @Test
    void redeliveredInProgressJobMayBeClaimedAgain() {
        String jobId = UUID.randomUUID().toString();
        jobStore.insert(jobId, "16162309", T0);

        assertTrue(jobStore.markInProgress(jobId, T0.plusSeconds(1)));
        assertTrue(jobStore.markInProgress(jobId, T0.plusSeconds(60)));
        assertTrue(jobStore.markFailed(jobId, "{\"error\":\"not_found\"}", 3, T0.plusSeconds(61)));

        Job job = jobStore.findById(jobId).orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertNull(job.result());
        assertEquals("{\"error\":\"not_found\"}", job.error());
        assertEquals(3, job.attempts());
    }

    @Test
    void updatedAtNeverMovesBackwards() {
        String jobId = UUID.randomUUID().toString();
        jobStore.insert(jobId, "16162309", T0);

        assertTrue(jobStore.markInProgress(jobId, T0.plusSeconds(30)));
        assertTrue(jobStore.markFailed(jobId, "{}", 1, T0.plusSeconds(10)));

        Job job = jobStore.findById(jobId).orElseThrow();
        assertEquals(T0.plusSeconds(30), job.updatedAt());
        assertFalse(job.updatedAt().isBefore(job.createdAt()));
    }

    @Test
    void findsStaleInProgressJobsOnly() {
        String stale = UUID.randomUUID().toString();
        String fresh = UUID.randomUUID().toString();
        String pending = UUID.randomUUID().toString();
        jobStore.insert(stale, "111", T0);
        jobStore.insert(fresh, "222", T0);
        jobStore.insert(pending, "333", T0);
        jobStore.markInProgress(stale, T0.plusSeconds(60));
        jobStore.markInProgress(fresh, T0.plusSeconds(7200));

        List<Job> found = jobStore.findStaleInProgress(T0.plusSeconds(3600));

        assertThat(found).extracting(Job::jobId).contains(stale).doesNotContain(fresh, pending);
    }

    @Test
    void recentJobsAreNewestFirstAndCountsCoverEveryStatus() {
        String older = UUID.randomUUID().toString();
        String newer = UUID.randomUUID().toString();
        jobStore.insert(older, "111", Instant.parse("2099-01-01T00:00:00Z"));
        jobStore.insert(newer, "222", Instant.parse("2099-01-02T00:00:00Z"));

        List<Job> recent = jobStore.findRecent(2);
        assertThat(recent).extracting(Job::jobId).containsExactly(newer, older);

        Map<String, Long> counts = jobStore.countByStatus();
        assertThat(counts).containsKeys("PENDING", "IN_PROGRESS", "COMPLETED", "FAILED");
        assertThat(counts.get("PENDING")).isGreaterThanOrEqualTo(2L);
        assertTrue(jobStore.isReachable());
    }
}
