/* (C)2026 */
package com.ammann.hashbreaker.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.JobUpdate;
import com.ammann.hashbreaker.support.MutableClock;
import com.ammann.hashbreaker.support.TestJobs;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryJobStoreTest {

    private MutableClock clock;
    private InMemoryJobStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        HashBreakerSettings settings = HashBreakerSettings.defaults().toBuilder()
                .jobTtl(Duration.ofHours(1))
                .build();
        store = new InMemoryJobStore(settings, clock);
    }

    @Test
    void getReturnsStoredRecord() {
        CrackJob job = TestJobs.pending("job-1", 60, clock.instant());
        store.set(job);

        assertThat(store.get("job-1")).contains(job);
        assertThat(store.get("unknown")).isEmpty();
    }

    @Test
    void recordDisappearsAfterTtl() {
        store.set(TestJobs.pending("job-1", 60, clock.instant()), Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(5));

        assertThat(store.get("job-1")).isEmpty();
        assertThat(store.update("job-1", JobUpdate.builder().progress(10).build())).isFalse();
    }

    @Test
    void updateMergesAndRefreshesExpiry() {
        store.set(TestJobs.pending("job-1", 60, clock.instant()), Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4));
        boolean updated = store.update("job-1",
                JobUpdate.builder().status(JobStatus.RUNNING).startedAt(clock.instant()).build());
        clock.advance(Duration.ofMinutes(30));

        assertThat(updated).isTrue();
        assertThat(store.get("job-1")).hasValueSatisfying(job -> {
            assertThat(job.status()).isEqualTo(JobStatus.RUNNING);
            assertThat(job.version()).isEqualTo(1);
        });
    }

    @Test
    void updateOfUnknownJobReportsFalse() {
        assertThat(store.update("missing", JobUpdate.builder().progress(10).build())).isFalse();
        assertThat(store.get("missing")).isEmpty();
    }

    @Test
    void findByStatusFiltersAndOrdersBySubmission() {
        store.set(TestJobs.pending("late", 60, clock.instant().plusSeconds(10)));
        store.set(TestJobs.pending("early", 60, clock.instant()));
        store.set(TestJobs.pending("done", 60, clock.instant()));
        store.update("done", JobUpdate.builder().status(JobStatus.SUCCESS).build());

        List<CrackJob> pending = store.findByStatus(EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING));

        assertThat(pending).extracting(CrackJob::id).containsExactly("early", "late");
    }

    @Test
    void purgeRemovesOnlyExpiredRecords() {
        store.set(TestJobs.pending("short", 60, clock.instant()), Duration.ofMinutes(1));
        store.set(TestJobs.pending("long", 60, clock.instant()), Duration.ofHours(2));

        clock.advance(Duration.ofMinutes(2));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.purgeExpired()).isZero();
        assertThat(store.get("long")).isPresent();
    }

    @Test
    void pingAlwaysSucceeds() {
        assertThat(store.ping()).isTrue();
    }
}
