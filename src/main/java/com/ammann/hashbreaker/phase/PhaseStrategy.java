/* (C)2026 */
package com.ammann.hashbreaker.phase;

import com.ammann.hashbreaker.engine.CancellationSignal;
import com.ammann.hashbreaker.enumeration.CrackingPhase;
import com.ammann.hashbreaker.model.PhaseResult;

/**
 * One attack phase of the cracking pipeline.
 * <p>
 * Implementations are stateless with respect to jobs and never throw for tool-level problems:
 * those are reported through {@link PhaseResult#error()} so the pipeline can move on.
 */
public interface PhaseStrategy {

    CrackingPhase phase();

    /**
     * @param timeoutSeconds budget for this phase only, already clamped by the pipeline
     * @param cancellation checked during long-running streaming work
     */
    PhaseResult run(String targetHash, int hashTypeId, double timeoutSeconds, CancellationSignal cancellation);
}
