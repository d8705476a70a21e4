/* (C)2026 */
package com.ammann.hashbreaker.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class CrackingToolHealthCheckTest {

    @TempDir Path tempDir;

    @Test
    void downWhenBinaryMissing() {
        HealthCheckResponse response = check(tempDir.resolve("hashcat")).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data).containsEntry("exists", false));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void upWhenBinaryIsExecutable() throws IOException {
        Path tool = Files.createFile(tempDir.resolve("hashcat"),
                PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwxr-xr-x")));

        assertThat(check(tool).call().getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
    }

    private static CrackingToolHealthCheck check(Path tool) {
        CrackingToolHealthCheck check = new CrackingToolHealthCheck();
        check.settings = HashBreakerSettings.defaults().toBuilder().toolPath(tool).build();
        return check;
    }
}
