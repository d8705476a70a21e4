/* (C)2026 */
package com.ammann.hashbreaker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Response of a successful cancel request.
 */
public record JobCancelResponseDTO(
        @JsonProperty("job_id") String jobId,
        String status,
        String message,
        @JsonProperty("cancelled_at") Instant cancelledAt) {}
