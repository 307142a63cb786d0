package com.correlationsentinel.core.model;

import java.util.Locale;

/**
 * Severity of a rule and of the alerts it produces.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Parse a severity name case-insensitively.
     *
     * @param value severity name, e.g. {@code "high"}
     * @return the matching severity
     * @throws IllegalArgumentException if {@code value} is {@code null} or unknown
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // Sigma uses "informational"
        if (normalized.equals("INFORMATIONAL") || normalized.equals("INFO")) {
            return LOW;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: low, medium, high, critical", e);
        }
    }
}
