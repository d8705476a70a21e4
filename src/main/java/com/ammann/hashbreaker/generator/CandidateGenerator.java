/* (C)2026 */
package com.ammann.hashbreaker.generator;

import java.util.List;

/**
 * Source of password candidates for the AI-generation phase.
 */
@FunctionalInterface
public interface CandidateGenerator {

    /**
     * Produces up to {@code count} candidates. Returning fewer (including none) signals that the
     * generator is exhausted.
     */
    List<String> generate(int count);
}
