/* (C)2026 */
package com.ammann.hashbreaker.enumeration;

import java.util.Locale;
import java.util.Optional;

/**
 * Requested urgency of a job. Each priority maps to its own dispatcher lane.
 */
public enum JobPriority {
    HIGH,
    NORMAL,
    LOW;

    /**
     * Parses a priority name case-insensitively.
     *
     * @param value raw value, may be null
     * @return matching priority or empty if the value is blank or unknown
     */
    public static Optional<JobPriority> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
