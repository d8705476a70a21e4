/* (C)2026 */
package com.ammann.hashbreaker.engine;

import com.ammann.hashbreaker.config.HashBreakerSettings;
import com.ammann.hashbreaker.enumeration.AttackMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the cracking tool command line.
 */
final class ToolCommandBuilder {

    private ToolCommandBuilder() {}

    /**
     * Whole seconds passed to {@code --runtime} and used as the wait bound; at least one.
     */
    static long runtimeSeconds(double timeoutSeconds) {
        return Math.max(1L, (long) Math.floor(timeoutSeconds));
    }

    static List<String> build(
            HashBreakerSettings settings,
            int hashTypeId,
            AttackMode attackMode,
            Path hashFile,
            List<String> attackArgs,
            Path outfile,
            double timeoutSeconds,
            boolean stdin) {
        List<String> command = new ArrayList<>();
        command.add(settings.toolPath().toString());
        command.add("-m");
        command.add(String.valueOf(hashTypeId));
        command.add("-a");
        command.add(String.valueOf(attackMode.code()));
        command.add(hashFile.toString());
        command.addAll(attackArgs);
        command.add("--runtime");
        command.add(String.valueOf(runtimeSeconds(timeoutSeconds)));
        command.add("--quiet");
        command.add("--outfile");
        command.add(outfile.toString());
        command.add("--outfile-format");
        command.add("2");
        if (settings.toolForce()) {
            command.add("--force");
        }
        if (settings.potfileDisable()) {
            command.add("--potfile-disable");
        }
        if (stdin) {
            command.add("--stdin");
        }
        return command;
    }
}
