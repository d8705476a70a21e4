/* (C)2026 */
package com.ammann.hashbreaker.enumeration;

/**
 * The four attack phases in execution order.
 * <p>
 * Each phase owns a fixed share of the job's total timeout and a UI progress milestone that is
 * published when the phase starts. The shares add up to exactly 1.0.
 */
public enum CrackingPhase {
    QUICK_DICTIONARY(1, "Phase 1: Quick Dictionary Attack", "quick_dictionary", 0.10, 15),
    RULE_BASED(2, "Phase 2: Rule-Based Attack", "rule_based", 0.25, 35),
    AI_GENERATION(3, "Phase 3: AI Generation", "ai_generation", 0.35, 60),
    MASK_ATTACK(4, "Phase 4: Limited Mask Attack", "mask_attack", 0.30, 80);

    private final int number;
    private final String label;
    private final String method;
    private final double timeShare;
    private final int progressMilestone;

    CrackingPhase(int number, String label, String method, double timeShare, int progressMilestone) {
        this.number = number;
        this.label = label;
        this.method = method;
        this.timeShare = timeShare;
        this.progressMilestone = progressMilestone;
    }

    public int number() {
        return number;
    }

    public String label() {
        return label;
    }

    /** Method name reported in phase results and used as the metrics tag. */
    public String method() {
        return method;
    }

    public double timeShare() {
        return timeShare;
    }

    public int progressMilestone() {
        return progressMilestone;
    }

    /**
     * Time budget for this phase.
     * <p>
     * The share applies to the original total timeout, then is clamped to what is left.
     *
     * @param totalTimeoutSeconds timeout fixed at submission
     * @param elapsedSeconds time already spent on the job
     * @return budget in seconds, never more than the remaining time
     */
    public double budgetSeconds(double totalTimeoutSeconds, double elapsedSeconds) {
        return Math.min(timeShare * totalTimeoutSeconds, totalTimeoutSeconds - elapsedSeconds);
    }

    public static CrackingPhase last() {
        return MASK_ATTACK;
    }
}
