package com.correlationsentinel.core.model;

import java.util.Locale;

/**
 * What happens when a rule matches.
 *
 * <ul>
 * <li>{@code ALERT} – the match is scored, deduplicated and emitted</li>
 * <li>{@code SUPPRESS} – the match is assembled and counted but no alert is
 * emitted (used to silence known-benign activity while keeping
 * visibility in metrics)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum RuleAction {
    ALERT,
    SUPPRESS;

    /**
     * @param value action name, case-insensitive
     * @return the matching action
     * @throws IllegalArgumentException if {@code value} is unknown
     */
    public static RuleAction parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rule action must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rule action: '" + value
                    + "'. Supported: alert, suppress", e);
        }
    }
}
