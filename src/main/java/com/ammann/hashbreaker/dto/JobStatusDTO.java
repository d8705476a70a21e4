/* (C)2026 */
package com.ammann.hashbreaker.dto;

import com.ammann.hashbreaker.model.CrackJob;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * DTO for job status.
 * <p>
 * Used by the polling endpoint. The target hash is never included.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusDTO(
        @JsonProperty("job_id") String jobId,
        String status,
        String priority,
        @JsonProperty("hash_type_id") int hashTypeId,
        @JsonProperty("timeout_seconds") int timeoutSeconds,
        @JsonProperty("submitted_at") Instant submittedAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        Integer progress,
        @JsonProperty("current_phase") String currentPhase,
        @JsonProperty("phase_number") Integer phaseNumber,
        @JsonProperty("time_elapsed") Double timeElapsed,
        @JsonProperty("time_remaining") Integer timeRemaining,
        String result,
        @JsonProperty("cracked_in_phase") Integer crackedInPhase,
        Long attempts,
        String reason,
        @JsonProperty("last_phase") Integer lastPhase) {

    /**
     * Convert record to DTO.
     *
     * @param job Job record, usually with derived timing already applied
     * @return DTO representation
     */
    public static JobStatusDTO from(CrackJob job) {
        return new JobStatusDTO(
                job.id(),
                job.status().name(),
                job.priority().name(),
                job.hashTypeId(),
                job.timeoutSeconds(),
                job.submittedAt(),
                job.startedAt(),
                job.completedAt(),
                job.progress(),
                job.currentPhase(),
                job.phaseNumber(),
                job.timeElapsed(),
                job.timeRemaining(),
                job.result(),
                job.crackedInPhase(),
                job.attempts(),
                job.reason(),
                job.lastPhase());
    }
}
