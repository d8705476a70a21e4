/* (C)2026 */
package com.ammann.hashbreaker.health;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Health check for the external cracking tool binary.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: binary exists and is executable</li>
 *   <li>DOWN: binary missing or not executable; phases would all fail to launch</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class CrackingToolHealthCheck implements HealthCheck {

    @Inject HashBreakerSettings settings;

    @Override
    public HealthCheckResponse call() {
        Path tool = settings.toolPath();
        boolean exists = Files.exists(tool);
        boolean executable = exists && Files.isExecutable(tool);

        return HealthCheckResponse.named("cracking-tool")
                .status(executable)
                .withData("path", tool.toString())
                .withData("exists", exists)
                .withData("executable", executable)
                .build();
    }
}
