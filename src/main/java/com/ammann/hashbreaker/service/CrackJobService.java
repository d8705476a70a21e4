/* (C)2026 */
package com.ammann.hashbreaker.service;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.dispatch.PriorityDispatcher;
import com.ammann.hashbreaker.dto.JobCancelResponseDTO;
import com.ammann.hashbreaker.dto.JobStatusDTO;
import com.ammann.hashbreaker.dto.JobSubmissionRequestDTO;
import com.ammann.hashbreaker.dto.JobSubmissionResponseDTO;
import com.ammann.hashbreaker.enumeration.HashType;
import com.ammann.hashbreaker.enumeration.JobPriority;
import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.exception.JobAlreadyTerminalException;
import com.ammann.hashbreaker.exception.JobNotFoundException;
import com.ammann.hashbreaker.exception.ValidationException;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.JobDelivery;
import com.ammann.hashbreaker.model.JobUpdate;
import com.ammann.hashbreaker.store.JobStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Job submission, status and cancellation.
 */
@ApplicationScoped
public class CrackJobService {

    private static final Logger LOG = Logger.getLogger(CrackJobService.class);

    private final JobStore store;
    private final PriorityDispatcher dispatcher;
    private final HashBreakerSettings settings;
    private final Clock clock;

    @Inject
    public CrackJobService(JobStore store, PriorityDispatcher dispatcher, HashBreakerSettings settings, Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Validates the request, stores a PENDING record and queues it on its priority lane.
     *
     * @throws ValidationException if any parameter is missing or out of range
     */
    public JobSubmissionResponseDTO submit(JobSubmissionRequestDTO request) {
        if (request == null) {
            throw ValidationException.missingParameter("body");
        }
        if (request.hash() == null || request.hash().isBlank()) {
            throw ValidationException.missingParameter("hash");
        }
        if (request.hashTypeId() == null) {
            throw ValidationException.missingParameter("hash_type_id");
        }
        if (HashType.fromModeId(request.hashTypeId()).isEmpty()) {
            throw ValidationException.invalidParameter("hash_type_id", request.hashTypeId(),
                    "one of " + Arrays.stream(HashType.values()).map(HashType::modeId).toList());
        }

        int timeout = request.timeoutSeconds() != null ? request.timeoutSeconds() : settings.defaultTimeoutSeconds();
        if (timeout < settings.minTimeoutSeconds() || timeout > settings.maxTimeoutSeconds()) {
            throw ValidationException.invalidParameter("timeout_seconds", timeout,
                    "between " + settings.minTimeoutSeconds() + " and " + settings.maxTimeoutSeconds());
        }

        JobPriority priority = JobPriority.NORMAL;
        if (request.priority() != null) {
            priority = JobPriority.parse(request.priority())
                    .orElseThrow(() -> ValidationException.invalidParameter("priority", request.priority(),
                            "one of " + Arrays.toString(JobPriority.values())));
        }

        CrackJob job = CrackJob.pending(UUID.randomUUID().toString(), request.hash().strip(),
                request.hashTypeId(), timeout, priority, clock.instant());
        store.set(job);
        dispatcher.dispatch(JobDelivery.first(job));

        LOG.infof("Job %s: submitted (hash type %d, timeout %ds, priority %s)",
                job.id(), job.hashTypeId(), timeout, priority);
        return JobSubmissionResponseDTO.accepted(job.id());
    }

    /**
     * Returns the job with elapsed and remaining time recomputed for RUNNING jobs.
     *
     * @throws JobNotFoundException if no live record exists
     */
    public JobStatusDTO getStatus(String jobId) {
        CrackJob job = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return JobStatusDTO.from(job.withDerivedTiming(clock.instant()));
    }

    /**
     * Flags the job as CANCELLED. A running job stops at its next phase boundary.
     *
     * @throws JobNotFoundException if no live record exists
     * @throws JobAlreadyTerminalException if the job already reached a terminal state
     */
    public JobCancelResponseDTO cancel(String jobId) {
        CrackJob job = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.status().isTerminal()) {
            throw new JobAlreadyTerminalException(jobId, job.status());
        }

        Instant now = clock.instant();
        JobUpdate.Builder update = JobUpdate.builder()
                .status(JobStatus.CANCELLED)
                .reason("User requested cancellation")
                .completedAt(now);
        if (job.status() == JobStatus.PENDING) {
            update.attempts(0L).timeElapsed(0.0);
        }
        if (!store.update(jobId, update.build())) {
            throw new JobNotFoundException(jobId);
        }

        LOG.infof("Job %s: cancellation requested while %s", jobId, job.status());
        return new JobCancelResponseDTO(jobId, JobStatus.CANCELLED.name(), "Job cancellation requested", now);
    }
}
