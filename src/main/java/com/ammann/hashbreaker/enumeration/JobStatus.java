/* (C)2026 */
package com.ammann.hashbreaker.enumeration;

/**
 * Current job status.
 * <p>
 * Expected transition sequence is PENDING to RUNNING and then to exactly one of SUCCESS, FAILED
 * or CANCELLED. A PENDING job may also move straight to CANCELLED.
 */
public enum JobStatus {
    /** Job accepted and waiting in a priority lane */
    PENDING,
    /** Job is actively running attack phases */
    RUNNING,
    /** Hash was cracked */
    SUCCESS,
    /** All phases exhausted or the job failed with an error */
    FAILED,
    /** Job was cancelled by the user */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }
}
