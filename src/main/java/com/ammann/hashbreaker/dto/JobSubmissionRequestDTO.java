/* (C)2026 */
package com.ammann.hashbreaker.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Body of a job submission. Optional fields fall back to configured defaults.
 */
@Schema(description = "Hash audit job submission")
public record JobSubmissionRequestDTO(
        @Schema(description = "Target hash", required = true) String hash,
        @JsonProperty("hash_type_id") @Schema(description = "Hash mode, e.g. 0 for MD5", required = true) Integer hashTypeId,
        @JsonProperty("timeout_seconds") @Schema(description = "Total time budget in seconds") Integer timeoutSeconds,
        @Schema(description = "LOW, NORMAL or HIGH") String priority) {}
