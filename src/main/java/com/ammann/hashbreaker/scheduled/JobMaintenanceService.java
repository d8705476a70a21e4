/* (C)2026 */
package com.ammann.hashbreaker.scheduled;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.JobUpdate;
import com.ammann.hashbreaker.store.JobStore;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduled.ConcurrentExecution;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import org.jboss.logging.Logger;

/**
 * Scheduled maintenance of job records.
 * <p>
 * Provides two functions:
 * <ol>
 *   <li><b>Purge:</b> removes records whose time-to-live has passed</li>
 *   <li><b>Watchdog:</b> fails RUNNING jobs that outlived their timeout plus their lane's hard
 *   time limit, e.g. after a worker thread died without recording an outcome</li>
 * </ol>
 */
@ApplicationScoped
public class JobMaintenanceService {

    private static final Logger LOG = Logger.getLogger(JobMaintenanceService.class);

    static final String REASON_STUCK = "Job exceeded maximum runtime";

    private final JobStore store;
    private final HashBreakerSettings settings;
    private final Clock clock;

    @Inject
    public JobMaintenanceService(JobStore store, HashBreakerSettings settings, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }

    @Scheduled(
            every = "${hash-breaker.maintenance.purge-interval}",
            identity = "job-purge",
            concurrentExecution = ConcurrentExecution.SKIP)
    public void purgeExpiredJobs() {
        long purged = store.purgeExpired();
        if (purged > 0) {
            LOG.infof("Purge: removed %d expired job records", purged);
        } else {
            LOG.debug("Purge: no expired job records");
        }
    }

    @Scheduled(
            every = "${hash-breaker.maintenance.watchdog-interval}",
            identity = "job-watchdog",
            concurrentExecution = ConcurrentExecution.SKIP)
    public void detectStuckJobs() {
        Instant now = clock.instant();
        int marked = 0;
        for (CrackJob job : store.findByStatus(EnumSet.of(JobStatus.RUNNING))) {
            if (job.startedAt() == null) {
                continue;
            }
            Instant deadline = job.startedAt()
                    .plusSeconds(job.timeoutSeconds())
                    .plus(settings.hardTimeLimit(job.priority()));
            if (now.isAfter(deadline)) {
                store.update(job.id(), JobUpdate.builder()
                        .status(JobStatus.FAILED)
                        .reason(REASON_STUCK)
                        .progress(100)
                        .completedAt(now)
                        .build());
                marked++;
            }
        }
        if (marked > 0) {
            LOG.warnf("Watchdog: marked %d stuck jobs as FAILED", marked);
        }
    }
}
