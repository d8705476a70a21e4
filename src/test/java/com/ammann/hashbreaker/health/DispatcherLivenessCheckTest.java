/* (C)2026 */
package com.ammann.hashbreaker.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.hashbreaker.dispatch.PriorityDispatcher;
import com.ammann.hashbreaker.enumeration.JobPriority;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

class DispatcherLivenessCheckTest {

    @Test
    void upWhileWorkersArePolling() {
        HealthCheckResponse response = check(true, 4).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> {
            assertThat(data).containsEntry("active-workers", 4L);
            assertThat(data).containsEntry("queue-high", 2L);
        });
    }

    @Test
    void downWhenStartedDispatcherLostAllWorkers() {
        assertThat(check(true, 0).call().getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
    }

    @Test
    void upBeforeDispatcherStarted() {
        assertThat(check(false, 0).call().getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
    }

    private static DispatcherLivenessCheck check(boolean running, int workers) {
        PriorityDispatcher dispatcher = mock(PriorityDispatcher.class);
        when(dispatcher.isRunning()).thenReturn(running);
        when(dispatcher.activeWorkers()).thenReturn(workers);
        when(dispatcher.queueDepth(any())).thenReturn(0);
        when(dispatcher.queueDepth(JobPriority.HIGH)).thenReturn(2);
        DispatcherLivenessCheck check = new DispatcherLivenessCheck();
        check.dispatcher = dispatcher;
        return check;
    }
}
