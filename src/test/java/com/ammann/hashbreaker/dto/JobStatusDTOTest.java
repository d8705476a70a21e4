/* (C)2026 */
package com.ammann.hashbreaker.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.hashbreaker.enumeration.JobStatus;
import com.ammann.hashbreaker.model.CrackJob;
import com.ammann.hashbreaker.model.JobUpdate;
import com.ammann.hashbreaker.support.TestJobs;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JobStatusDTOTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void serializesSnakeCaseAndOmitsUnsetFields() throws JsonProcessingException {
        CrackJob job = TestJobs.pending("job-1", 60, Instant.parse("2026-03-01T10:00:00Z"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(JobStatusDTO.from(job)));

        assertThat(json.get("job_id").asText()).isEqualTo("job-1");
        assertThat(json.get("status").asText()).isEqualTo("PENDING");
        assertThat(json.get("time_remaining").asInt()).isEqualTo(60);
        assertThat(json.has("result")).isFalse();
        assertThat(json.has("started_at")).isFalse();
    }

    @Test
    void neverExposesTargetHash() throws JsonProcessingException {
        CrackJob job = CrackJob.merge(TestJobs.pending("job-1", 60, Instant.parse("2026-03-01T10:00:00Z")),
                JobUpdate.builder().status(JobStatus.SUCCESS).result("hello").crackedInPhase(1).attempts(5L).build());

        String json = mapper.writeValueAsString(JobStatusDTO.from(job));

        assertThat(json).doesNotContain(TestJobs.MD5_HELLO);
        assertThat(json).contains("\"cracked_in_phase\":1", "\"result\":\"hello\"", "\"attempts\":5");
    }
}
