/* (C)2026 */
package com.ammann.hashbreaker.service;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.engine.CancellationSignal;
import com.ammann.hashbreaker.enumeration.CrackingPhase;
import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.JobDelivery;
import com.ammann.hashbreaker.model.JobUpdate;
import com.ammann.hashbreaker.model.PhaseResult;
import com.ammann.hashbreaker.phase.PhaseStrategy;
import com.ammann.hashbreaker.store.JobStore;
import io.quarkus.arc.All;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Drives one job through the attack phases.
 *
 * <p>Job lifecycle: PENDING -> RUNNING -> (SUCCESS | FAILED | CANCELLED)
 *
 * <p>Each phase gets a fixed share of the original timeout, clamped to the time left. Between
 * phases the pipeline re-reads the job to observe cancellation; during streaming work the same
 * check runs through a throttled {@link CancellationSignal}. A phase that is already running
 * always finishes or times out before cancellation takes effect.
 *
 * <p>Failures inside the phases become FAILED with the exception message as reason. Job store
 * failures while reading the job at dequeue, or while persisting that failure, propagate to the
 * dispatcher, which redelivers the job. A thread interrupted by the dispatcher's hard time limit
 * abandons the job without writing anything; the dispatcher records the outcome.
 */
@ApplicationScoped
public class CrackingPipeline {

    private static final Logger LOG = Logger.getLogger(CrackingPipeline.class);

    static final String REASON_NOT_FOUND = "Password not found after all phases";
    static final String REASON_CANCELLED = "User requested cancellation";
    static final String REASON_CANCELLED_BEFORE_START = "Cancelled before processing";

    private final JobStore store;
    private final List<PhaseStrategy> phases;
    private final CrackingMetrics metrics;
    private final HashBreakerSettings settings;
    private final Clock clock;

    @Inject
    public CrackingPipeline(
            JobStore store,
            @All List<PhaseStrategy> phases,
            CrackingMetrics metrics,
            HashBreakerSettings settings,
            Clock clock) {
        this.store = store;
        this.phases = phases.stream().sorted(Comparator.comparing(PhaseStrategy::phase)).toList();
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Runs the job to a terminal state.
     *
     * @param job delivery taken from a dispatcher lane
     * @return the terminal status written, or empty when the run was abandoned after an interrupt
     * @throws com.ammann.hashbreaker.exception.JobStoreException if job state cannot be read at
     *         dequeue or a failure cannot be persisted
     */
    public Optional<JobStatus> execute(JobDelivery job) {
        String jobId = job.jobId();
        long startMillis = clock.millis();

        Optional<CrackJob> current = store.get(jobId);
        if (current.isPresent() && current.get().status() == JobStatus.CANCELLED) {
            LOG.infof("Job %s: cancelled before processing started", jobId);
            return finish(jobId, JobStatus.CANCELLED, Duration.ZERO, JobUpdate.builder()
                    .status(JobStatus.CANCELLED)
                    .reason(REASON_CANCELLED_BEFORE_START)
                    .attempts(0L)
                    .timeElapsed(0.0)
                    .completedAt(clock.instant()));
        }
        if (current.isPresent() && current.get().status().isTerminal()) {
            LOG.warnf("Job %s: already %s, ignoring delivery", jobId, current.get().status());
            return Optional.of(current.get().status());
        }

        metrics.jobStarted();
        long attempts = 0;
        Integer lastPhase = null;
        try {
            markRunning(job, current);
            CancellationSignal cancellation = CancellationSignal.throttled(
                    () -> isCancelled(jobId), settings.cancellationPollInterval(), clock);

            for (PhaseStrategy strategy : phases) {
                CrackingPhase phase = strategy.phase();
                if (Thread.currentThread().isInterrupted()) {
                    return abandon(jobId);
                }
                if (isCancelled(jobId)) {
                    LOG.infof("Job %s: cancelled before %s after %d attempts", jobId, phase.label(), attempts);
                    return finish(jobId, JobStatus.CANCELLED, elapsed(startMillis), JobUpdate.builder()
                            .status(JobStatus.CANCELLED)
                            .reason(REASON_CANCELLED)
                            .attempts(attempts)
                            .lastPhase(lastPhase)
                            .timeElapsed(elapsedSeconds(startMillis))
                            .completedAt(clock.instant()));
                }

                double elapsed = elapsedSeconds(startMillis);
                if (elapsed >= job.timeoutSeconds()) {
                    LOG.infof("Job %s: time budget of %ds used up before %s", jobId, job.timeoutSeconds(), phase.label());
                    break;
                }
                double budget = phase.budgetSeconds(job.timeoutSeconds(), elapsed);

                store.update(jobId, JobUpdate.builder()
                        .progress(phase.progressMilestone())
                        .currentPhase(phase.label())
                        .phaseNumber(phase.number())
                        .timeElapsed(elapsed)
                        .timeRemaining(remainingSeconds(job.timeoutSeconds(), elapsed))
                        .build());
                LOG.infof("Job %s: starting %s with %.1fs budget", jobId, phase.label(), budget);

                long phaseStart = clock.millis();
                PhaseResult result = strategy.run(job.targetHash(), job.hashTypeId(), budget, cancellation);
                metrics.phaseFinished(phase, result.attempts(), Duration.ofMillis(clock.millis() - phaseStart));
                attempts += result.attempts();
                lastPhase = phase.number();

                if (result.error() != null) {
                    LOG.warnf("Job %s: %s reported an error: %s", jobId, phase.label(), result.error());
                }
                if (result.cracked()) {
                    LOG.infof("Job %s: cracked in phase %d via %s after %d attempts",
                            jobId, phase.number(), result.method(), attempts);
                    LOG.debugf("Job %s: recovered plaintext %s", jobId, result.password());
                    return finish(jobId, JobStatus.SUCCESS, elapsed(startMillis), JobUpdate.builder()
                            .status(JobStatus.SUCCESS)
                            .result(result.password())
                            .crackedInPhase(phase.number())
                            .lastPhase(phase.number())
                            .attempts(attempts)
                            .progress(100)
                            .timeElapsed(elapsedSeconds(startMillis))
                            .timeRemaining(0)
                            .completedAt(clock.instant()));
                }
            }

            LOG.infof("Job %s: password not found after all phases (%d attempts)", jobId, attempts);
            return finish(jobId, JobStatus.FAILED, elapsed(startMillis), JobUpdate.builder()
                    .status(JobStatus.FAILED)
                    .reason(REASON_NOT_FOUND)
                    .lastPhase(CrackingPhase.last().number())
                    .attempts(attempts)
                    .progress(100)
                    .timeElapsed(elapsedSeconds(startMillis))
                    .completedAt(clock.instant()));
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                return abandon(jobId);
            }
            LOG.errorf(e, "Job %s: pipeline failed", jobId);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return finish(jobId, JobStatus.FAILED, elapsed(startMillis), JobUpdate.builder()
                    .status(JobStatus.FAILED)
                    .reason(reason)
                    .lastPhase(lastPhase)
                    .attempts(attempts)
                    .progress(100)
                    .timeElapsed(elapsedSeconds(startMillis))
                    .completedAt(clock.instant()));
        } finally {
            metrics.jobEnded();
        }
    }

    private void markRunning(JobDelivery job, Optional<CrackJob> current) {
        JobUpdate running = JobUpdate.builder()
                .status(JobStatus.RUNNING)
                .startedAt(clock.instant())
                .progress(0)
                .timeElapsed(0.0)
                .timeRemaining(job.timeoutSeconds())
                .build();
        if (current.isPresent() && store.update(job.jobId(), running)) {
            return;
        }
        LOG.warnf("Job %s: no stored record at dequeue, recreating it", job.jobId());
        CrackJob recreated = CrackJob.pending(job.jobId(), job.targetHash(), job.hashTypeId(),
                job.timeoutSeconds(), job.priority(), clock.instant());
        store.set(CrackJob.merge(recreated, running));
    }

    private boolean isCancelled(String jobId) {
        return store.get(jobId).map(j -> j.status() == JobStatus.CANCELLED).orElse(false);
    }

    /**
     * Writes the outcome and reports the status the record actually holds afterwards, which
     * differs from {@code status} when a cancel or the watchdog settled the job first.
     */
    private Optional<JobStatus> finish(String jobId, JobStatus status, Duration duration, JobUpdate.Builder update) {
        JobStatus stored = status;
        if (store.update(jobId, update.build())) {
            stored = store.get(jobId).map(CrackJob::status).orElse(status);
            if (stored != status) {
                LOG.infof("Job %s: outcome %s discarded, record was already %s", jobId, status, stored);
            }
        } else {
            LOG.warnf("Job %s: record vanished before %s could be stored", jobId, status);
        }
        metrics.jobFinished(stored, duration);
        return Optional.of(stored);
    }

    private Optional<JobStatus> abandon(String jobId) {
        LOG.warnf("Job %s: worker interrupted, abandoning pipeline", jobId);
        return Optional.empty();
    }

    private Duration elapsed(long startMillis) {
        return Duration.ofMillis(Math.max(0L, clock.millis() - startMillis));
    }

    private double elapsedSeconds(long startMillis) {
        return Math.max(0L, clock.millis() - startMillis) / 1000.0;
    }

    private static int remainingSeconds(int timeoutSeconds, double elapsed) {
        return (int) Math.max(0L, (long) Math.floor(timeoutSeconds - elapsed));
    }
}
