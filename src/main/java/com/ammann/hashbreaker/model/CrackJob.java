/* (C)2026 */
package com.ammann.hashbreaker.model;

import com.ammann.hashbreaker.enumeration.JobPriority;
import com.ammann.hashbreaker.enumeration.JobStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable, versioned lifecycle record of one cracking request.
 * <p>
 * Records are never mutated; every change goes through {@link #merge(CrackJob, JobUpdate)},
 * which produces the next version. Once the status is terminal the record is settled: status,
 * {@code result}, {@code crackedInPhase} and {@code reason} never change again. A worker that
 * was mid-phase when its job was cancelled may still fill in {@code attempts} and
 * {@code lastPhase} if the cancel did not set them.
 *
 * @param targetHash hash under audit; stored so the job can be re-dispatched after a restart,
 *                   never exposed through the API
 */
public record CrackJob(
        String id,
        long version,
        JobStatus status,
        String targetHash,
        int hashTypeId,
        int timeoutSeconds,
        JobPriority priority,
        Instant submittedAt,
        Instant startedAt,
        Instant completedAt,
        Integer progress,
        String currentPhase,
        Integer phaseNumber,
        Double timeElapsed,
        Integer timeRemaining,
        String result,
        Integer crackedInPhase,
        Long attempts,
        String reason,
        Integer lastPhase) {

    public CrackJob {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(priority, "priority");
    }

    /**
     * Creates the initial PENDING record of a freshly submitted job.
     */
    public static CrackJob pending(
            String id,
            String targetHash,
            int hashTypeId,
            int timeoutSeconds,
            JobPriority priority,
            Instant submittedAt) {
        return new CrackJob(id, 0L, JobStatus.PENDING, targetHash, hashTypeId, timeoutSeconds,
                priority, submittedAt, null, null, 0, null, null, null, timeoutSeconds,
                null, null, null, null, null);
    }

    /**
     * Applies a partial update and returns the next version.
     * <p>
     * Fields absent from {@code partial} are kept and the phase number never decreases within a
     * run. An update that enters RUNNING with a start time begins a new run: {@code startedAt} is
     * replaced and the phase counters restart, so a redelivered job is timed from its new start.
     * <p>
     * Terminal records are settled. Status and outcome never change again; the only writes
     * accepted are {@code attempts}, {@code lastPhase} and {@code timeElapsed} into a CANCELLED
     * record that does not carry them yet, which lets the owning worker close its books after a
     * concurrent cancel. A terminal record always reports {@code timeRemaining = 0}.
     *
     * @param old current record
     * @param partial fields to change
     * @return merged record with {@code version = old.version + 1}
     */
    public static CrackJob merge(CrackJob old, JobUpdate partial) {
        if (old.status.isTerminal()) {
            return settle(old, partial);
        }
        JobStatus status = partial.status() == null ? old.status : partial.status();
        boolean newRun = partial.status() == JobStatus.RUNNING && partial.startedAt() != null;

        Integer phaseNumber = newRun ? partial.phaseNumber() : old.phaseNumber;
        if (!newRun && partial.phaseNumber() != null) {
            phaseNumber = old.phaseNumber == null
                    ? partial.phaseNumber()
                    : Math.max(old.phaseNumber, partial.phaseNumber());
        }

        Integer timeRemaining = status.isTerminal()
                ? Integer.valueOf(0)
                : pick(partial.timeRemaining(), old.timeRemaining);

        return new CrackJob(
                old.id,
                old.version + 1,
                status,
                old.targetHash,
                old.hashTypeId,
                old.timeoutSeconds,
                old.priority,
                old.submittedAt,
                newRun ? partial.startedAt() : old.startedAt,
                pick(partial.completedAt(), old.completedAt),
                pick(partial.progress(), old.progress),
                newRun ? partial.currentPhase() : pick(partial.currentPhase(), old.currentPhase),
                phaseNumber,
                pick(partial.timeElapsed(), old.timeElapsed),
                timeRemaining,
                pick(partial.result(), old.result),
                pick(partial.crackedInPhase(), old.crackedInPhase),
                pick(partial.attempts(), old.attempts),
                pick(partial.reason(), old.reason),
                pick(partial.lastPhase(), old.lastPhase));
    }

    private static CrackJob settle(CrackJob old, JobUpdate partial) {
        boolean cancelled = old.status == JobStatus.CANCELLED;
        return new CrackJob(old.id, old.version + 1, old.status, old.targetHash, old.hashTypeId,
                old.timeoutSeconds, old.priority, old.submittedAt, old.startedAt, old.completedAt,
                old.progress, old.currentPhase, old.phaseNumber,
                cancelled ? keep(old.timeElapsed, partial.timeElapsed()) : old.timeElapsed,
                0,
                old.result,
                old.crackedInPhase,
                cancelled ? keep(old.attempts, partial.attempts()) : old.attempts,
                old.reason,
                cancelled ? keep(old.lastPhase, partial.lastPhase()) : old.lastPhase);
    }

    /**
     * Returns a read-time view with elapsed and remaining time recomputed.
     * <p>
     * RUNNING jobs are recomputed against {@code now}; terminal jobs report zero remaining time;
     * PENDING jobs are returned unchanged. The result is not meant to be persisted.
     */
    public CrackJob withDerivedTiming(Instant now) {
        if (status.isTerminal()) {
            if (Integer.valueOf(0).equals(timeRemaining)) {
                return this;
            }
            return withTiming(timeElapsed, 0);
        }
        if (status != JobStatus.RUNNING || startedAt == null) {
            return this;
        }
        double elapsed = Math.max(0L, Duration.between(startedAt, now).toMillis()) / 1000.0;
        int remaining = (int) Math.max(0L, (long) Math.floor(timeoutSeconds - elapsed));
        return withTiming(elapsed, remaining);
    }

    private CrackJob withTiming(Double elapsed, Integer remaining) {
        return new CrackJob(id, version, status, targetHash, hashTypeId, timeoutSeconds, priority,
                submittedAt, startedAt, completedAt, progress, currentPhase, phaseNumber,
                elapsed, remaining, result, crackedInPhase, attempts, reason, lastPhase);
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    private static <T> T keep(T existing, T proposed) {
        return existing != null ? existing : proposed;
    }
}
