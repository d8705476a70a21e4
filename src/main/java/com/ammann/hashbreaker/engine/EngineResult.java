/* (C)2026 */
package com.ammann.hashbreaker.engine;

import com.ammann.hashbreaker.enumeration.ToolErrorKind;

/**
 * Outcome of one cracking tool invocation.
 *
 * @param exitCode process exit code, {@code -1} when the process was killed
 * @param attempts candidates written to stdin in streaming mode, {@code null} in batch mode
 * @param cancelled streaming stopped early because the job was cancelled
 */
public record EngineResult(
        boolean cracked,
        String password,
        int exitCode,
        String stdout,
        String stderr,
        double durationSeconds,
        boolean timedOut,
        ToolErrorKind errorKind,
        Long attempts,
        boolean cancelled) {}
