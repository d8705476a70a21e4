/* (C)2026 */
package com.ammann.hashbreaker.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.hashbreaker.exception.JobStoreException;
import com.ammann.hashbreaker.store.JobStore;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

class JobStoreHealthCheckTest {

    private final JobStore store = mock(JobStore.class);

    @Test
    void upWhenPingSucceeds() {
        when(store.ping()).thenReturn(true);

        HealthCheckResponse response = check().call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data).containsKey("latency-ms"));
    }

    @Test
    void downWithErrorWhenStoreFails() {
        when(store.ping()).thenThrow(new JobStoreException("Job store ping failed", null));

        HealthCheckResponse response = check().call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(
                data -> assertThat(data).containsEntry("error", "Job store ping failed"));
    }

    private JobStoreHealthCheck check() {
        JobStoreHealthCheck check = new JobStoreHealthCheck();
        check.jobStore = store;
        return check;
    }
}
