/* (C)2026 */
package com.ammann.hashbreaker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response for a newly accepted job.
 */
public record JobSubmissionResponseDTO(
        @JsonProperty("job_id") String jobId,
        String status,
        String message) {

    public static JobSubmissionResponseDTO accepted(String jobId) {
        return new JobSubmissionResponseDTO(jobId, "PENDING", "Job queued for processing");
    }
}
