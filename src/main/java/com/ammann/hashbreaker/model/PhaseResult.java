/* (C)2026 */
package com.ammann.hashbreaker.model;

import com.ammann.hashbreaker.enumeration.CrackingPhase;

/**
 * Outcome of one attack phase. Folded into the job record by the pipeline, never persisted as is.
 *
 * @param attempts guesses made; measured or estimated depending on the phase
 * @param method how the phase ran, e.g. {@code cpu_dictionary} when the tool had no device
 * @param error description of a tool-level problem, {@code null} when the phase ran normally
 */
public record PhaseResult(
        boolean cracked,
        String password,
        long attempts,
        int phase,
        String method,
        boolean timeout,
        String error) {

    public static PhaseResult cracked(CrackingPhase phase, String method, String password, long attempts) {
        return new PhaseResult(true, password, attempts, phase.number(), method, false, null);
    }

    public static PhaseResult notCracked(CrackingPhase phase, String method, long attempts, boolean timeout) {
        return new PhaseResult(false, null, attempts, phase.number(), method, timeout, null);
    }

    public static PhaseResult failed(CrackingPhase phase, String method, String error) {
        return new PhaseResult(false, null, 0L, phase.number(), method, false, error);
    }
}
