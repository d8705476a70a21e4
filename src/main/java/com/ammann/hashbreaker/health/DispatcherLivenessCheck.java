/* (C)2026 */
package com.ammann.hashbreaker.health;

import com.ammann.hashbreaker.dispatch.PriorityDispatcher;
import com.ammann.hashbreaker.enumeration.JobPriority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Locale;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check on the job dispatcher.
 *
 * <p>DOWN when the dispatcher was started but none of its workers is polling any more, which
 * means queued jobs would never be processed.
 */
@Liveness
@ApplicationScoped
public class DispatcherLivenessCheck implements HealthCheck {

    @Inject PriorityDispatcher dispatcher;

    @Override
    public HealthCheckResponse call() {
        boolean running = dispatcher.isRunning();
        int workers = dispatcher.activeWorkers();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("job-dispatcher")
                .status(!running || workers > 0)
                .withData("running", running)
                .withData("active-workers", workers);
        for (JobPriority priority : JobPriority.values()) {
            builder.withData("queue-" + priority.name().toLowerCase(Locale.ROOT), dispatcher.queueDepth(priority));
        }
        return builder.build();
    }
}
