/* (C)2026 */
package com.ammann.hashbreaker.support;

import com.ammann.hashbreaker.engine.CancellationSignal;
import com.ammann.hashbreaker.enumeration.CrackingPhase;
import com.ammann.hashbreaker.model.PhaseResult;
import com.ammann.hashbreaker.phase.PhaseStrategy;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.DoubleFunction;

/**
 * Phase whose outcome is decided by the test. Records the budgets it was given.
 */
public final class ScriptedPhase implements PhaseStrategy {

    private final CrackingPhase phase;
    private final DoubleFunction<PhaseResult> behaviour;
    private final List<Double> budgets = new CopyOnWriteArrayList<>();

    private ScriptedPhase(CrackingPhase phase, DoubleFunction<PhaseResult> behaviour) {
        this.phase = phase;
        this.behaviour = behaviour;
    }

    public static ScriptedPhase of(CrackingPhase phase, DoubleFunction<PhaseResult> behaviour) {
        return new ScriptedPhase(phase, behaviour);
    }

    public static ScriptedPhase miss(CrackingPhase phase, long attempts) {
        return of(phase, budget -> PhaseResult.notCracked(phase, phase.method(), attempts, false));
    }

    public static ScriptedPhase crack(CrackingPhase phase, String password, long attempts) {
        return of(phase, budget -> PhaseResult.cracked(phase, phase.method(), password, attempts));
    }

    @Override
    public CrackingPhase phase() {
        return phase;
    }

    @Override
    public PhaseResult run(String targetHash, int hashTypeId, double timeoutSeconds, CancellationSignal cancellation) {
        budgets.add(timeoutSeconds);
        return behaviour.apply(timeoutSeconds);
    }

    public int invocations() {
        return budgets.size();
    }

    public List<Double> budgets() {
        return budgets;
    }
}
