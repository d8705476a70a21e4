/* (C)2026 */
package com.ammann.hashbreaker.health;

import com.ammann.hashbreaker.store.JobStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the job store with round-trip latency.
 */
@Readiness
@ApplicationScoped
public class JobStoreHealthCheck implements HealthCheck {

    @Inject JobStore jobStore;

    @Override
    public HealthCheckResponse call() {
        long start = System.nanoTime();
        boolean reachable;
        String error = null;
        try {
            reachable = jobStore.ping();
        } catch (RuntimeException e) {
            reachable = false;
            error = e.getMessage();
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;

        var builder = HealthCheckResponse.named("job-store")
                .status(reachable)
                .withData("latency-ms", latencyMs);
        if (error != null) {
            builder.withData("error", error);
        }
        return builder.build();
    }
}
