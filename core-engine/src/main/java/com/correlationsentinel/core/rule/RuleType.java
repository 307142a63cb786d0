package com.correlationsentinel.core.rule;

import java.util.Locale;

/**
 * The rule variants the engine evaluates.
 *
 * @since 1.0.0
 */
public enum RuleType {
    /** Pattern match against one event (SIGMA-style). */
    SINGLE,
    /** Threshold of matching events sharing key fields within a time window. */
    CORRELATION,
    /** Ordered or unordered steps completed by events sharing key fields. */
    SEQUENCE;

    /**
     * Parse a type name. {@code single}, {@code sigma} and {@code simple} all
     * map to {@link #SINGLE}; {@code correlation} and {@code threshold} to
     * {@link #CORRELATION}; {@code sequence} to {@link #SEQUENCE}.
     *
     * @param value type name, case-insensitive
     * @return the rule type
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RuleType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rule type must not be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "single", "sigma", "simple" -> SINGLE;
            case "correlation", "threshold" -> CORRELATION;
            case "sequence" -> SEQUENCE;
            default -> throw new IllegalArgumentException("Unknown rule type: '" + value
                    + "'. Supported types: single, sigma, correlation, sequence");
        };
    }
}
