/* (C)2026 */
package com.ammann.hashbreaker.startup;

import com.ammann.hashbreaker.dispatch.PriorityDispatcher;
import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.JobDelivery;
import com.ammann.hashbreaker.model.JobUpdate;
import com.ammann.hashbreaker.store.JobStore;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Starts the dispatcher on application startup and recovers orphaned jobs.
 * <p>
 * Lanes live in memory, so jobs that were PENDING or RUNNING when the service stopped are only
 * known to the job store. PENDING orphans are queued again; RUNNING orphans are queued as a
 * redelivery and restart from phase 1. Orphans without a stored hash cannot be re-run and are
 * marked FAILED.
 */
@ApplicationScoped
public class DispatcherStartup {

    private static final Logger LOG = Logger.getLogger(DispatcherStartup.class);

    static final String REASON_UNRECOVERABLE = "Server restarted before job could be recovered";

    private final PriorityDispatcher dispatcher;
    private final JobStore store;
    private final Clock clock;

    @Inject
    public DispatcherStartup(PriorityDispatcher dispatcher, JobStore store, Clock clock) {
        this.dispatcher = dispatcher;
        this.store = store;
        this.clock = clock;
    }

    void onStart(@Observes StartupEvent event) {
        dispatcher.start();
        recoverOrphans();
    }

    void onStop(@Observes ShutdownEvent event) {
        dispatcher.stop();
    }

    void recoverOrphans() {
        LOG.info("Job recovery: checking for orphaned jobs...");
        List<CrackJob> orphans = store.findByStatus(EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING));

        int requeued = 0;
        int failed = 0;
        for (CrackJob job : orphans) {
            if (job.targetHash() == null || job.targetHash().isBlank()) {
                store.update(job.id(), JobUpdate.builder()
                        .status(JobStatus.FAILED)
                        .reason(REASON_UNRECOVERABLE)
                        .completedAt(clock.instant())
                        .build());
                failed++;
                continue;
            }
            JobDelivery delivery = JobDelivery.first(job);
            dispatcher.dispatch(job.status() == JobStatus.RUNNING ? delivery.redelivered() : delivery);
            requeued++;
        }

        if (requeued + failed > 0) {
            LOG.warnf("Job recovery: requeued %d orphaned jobs, marked %d as FAILED", requeued, failed);
        } else {
            LOG.info("Job recovery: no orphaned jobs found");
        }
    }
}
