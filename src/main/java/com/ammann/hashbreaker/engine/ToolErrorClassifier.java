/* (C)2026 */
package com.ammann.hashbreaker.engine;

import com.ammann.hashbreaker.enumeration.ToolErrorKind;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps a finished tool invocation to a {@link ToolErrorKind}.
 * <p>
 * Recognised stderr tokens are a closed set matched case-insensitively. Exit codes 0 to 4 are
 * the tool's normal outcomes (cracked, exhausted, aborted, checkpoint, runtime limit).
 */
public final class ToolErrorClassifier {

    static final List<String> NO_DEVICE_TOKENS = List.of(
            "no opencl", "no cuda", "no hip", "no devices found", "no devices available");

    private static final Set<Integer> NORMAL_EXIT_CODES = Set.of(0, 1, 2, 3, 4);

    private ToolErrorClassifier() {}

    public static ToolErrorKind classify(int exitCode, boolean timedOut, String stderr) {
        if (stderr != null && !stderr.isEmpty()) {
            String normalized = stderr.toLowerCase(Locale.ROOT);
            for (String token : NO_DEVICE_TOKENS) {
                if (normalized.contains(token)) {
                    return ToolErrorKind.NO_DEVICE;
                }
            }
        }
        if (timedOut) {
            return ToolErrorKind.TIMEOUT;
        }
        return NORMAL_EXIT_CODES.contains(exitCode) ? ToolErrorKind.NONE : ToolErrorKind.EXECUTION_FAILURE;
    }
}
