/* (C)2026 */
package com.ammann.hashbreaker.enumeration;

/**
 * Classification of a cracking tool invocation outcome.
 * <p>
 * Produced by {@code ToolErrorClassifier}; callers switch on this value and never inspect raw
 * tool output.
 */
public enum ToolErrorKind {
    /** Tool ran and exited normally, cracked or exhausted */
    NONE,
    /** No OpenCL/CUDA/HIP compute device was available */
    NO_DEVICE,
    /** Invocation was stopped because its time budget ran out */
    TIMEOUT,
    /** Non-zero exit without a recognised cause */
    EXECUTION_FAILURE
}
