/* (C)2026 */
package com.ammann.hashbreaker.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.CrackJobEntity;
import com.ammann.hashbreaker.model.JobUpdate;
import com.ammann.hashbreaker.support.TestJobs;
import io.quarkus.test.TestTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class PanacheJobStoreTest {

    @Inject JobStore store;

    @BeforeEach
    @TestTransaction
    void cleanup() {
        CrackJobEntity.deleteAll();
    }

    @Test
    @TestTransaction
    void setThenGetReturnsStoredRecord() {
        CrackJob job = TestJobs.pending("job-1", 60, Instant.now());

        store.set(job);
        CrackJobEntity.getEntityManager().flush();
        CrackJobEntity.getEntityManager().clear();

        assertThat(store.get("job-1")).hasValueSatisfying(found -> {
            assertThat(found.status()).isEqualTo(JobStatus.PENDING);
            assertThat(found.targetHash()).isEqualTo(TestJobs.MD5_HELLO);
            assertThat(found.timeoutSeconds()).isEqualTo(60);
        });
        assertThat(store.get("unknown")).isEmpty();
    }

    @Test
    @TestTransaction
    void expiredRecordIsInvisibleAndPurged() {
        store.set(TestJobs.pending("gone", 60, Instant.now()), Duration.ofSeconds(-1));
        store.set(TestJobs.pending("kept", 60, Instant.now()));

        assertThat(store.get("gone")).isEmpty();
        assertThat(store.update("gone", JobUpdate.builder().progress(15).build())).isFalse();
        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.get("kept")).isPresent();
    }

    @Test
    @TestTransaction
    void updateMergesPartialAndRefreshesExpiry() {
        store.set(TestJobs.pending("job-1", 60, Instant.now()), Duration.ofMinutes(1));

        boolean updated = store.update("job-1", JobUpdate.builder()
                .status(JobStatus.RUNNING)
                .startedAt(Instant.now())
                .progress(15)
                .phaseNumber(1)
                .build());

        assertThat(updated).isTrue();
        CrackJob job = store.get("job-1").orElseThrow();
        assertThat(job.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.progress()).isEqualTo(15);
        assertThat(job.phaseNumber()).isEqualTo(1);
        assertThat(job.version()).isEqualTo(1);
        assertThat(job.targetHash()).isEqualTo(TestJobs.MD5_HELLO);
        CrackJobEntity entity = CrackJobEntity.findById("job-1");
        assertThat(entity.expiresAt).isAfter(Instant.now().plus(Duration.ofHours(23)));
    }

    @Test
    @TestTransaction
    void updateKeepsSettledOutcome() {
        store.set(TestJobs.pending("job-1", 60, Instant.now()));
        store.update("job-1", JobUpdate.builder().status(JobStatus.CANCELLED).reason("User requested cancellation").build());

        store.update("job-1", JobUpdate.builder()
                .status(JobStatus.SUCCESS).result("hello").crackedInPhase(1).attempts(5L).build());

        CrackJob job = store.get("job-1").orElseThrow();
        assertThat(job.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.result()).isNull();
        assertThat(job.attempts()).isEqualTo(5L);
    }

    @Test
    @TestTransaction
    void findByStatusReturnsMatchingLiveRecords() {
        Instant now = Instant.now();
        store.set(TestJobs.pending("pending", 60, now.minusSeconds(5)));
        store.set(TestJobs.pending("running", 60, now.minusSeconds(10)));
        store.update("running", JobUpdate.builder().status(JobStatus.RUNNING).startedAt(now).build());
        store.set(TestJobs.pending("failed", 60, now));
        store.update("failed", JobUpdate.builder().status(JobStatus.FAILED).build());

        List<CrackJob> orphans = store.findByStatus(EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING));

        assertThat(orphans).extracting(CrackJob::id).containsExactly("running", "pending");
    }

    @Test
    void pingSucceedsAgainstLiveDatabase() {
        assertThat(store.ping()).isTrue();
    }
}
