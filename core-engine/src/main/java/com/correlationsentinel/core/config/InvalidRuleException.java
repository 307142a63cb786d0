package com.correlationsentinel.core.config;

import java.util.List;

/**
 * Thrown when a rule definition cannot be compiled into an executable rule.
 *
 * <p>
 * Carries every problem found in the definition, not only the first one, so
 * that a rule author can fix them in a single round trip.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidRuleException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String ruleId;
    private final List<String> errors;

    public InvalidRuleException(String ruleId, List<String> errors) {
        super("Invalid rule '" + ruleId + "': " + String.join("; ", errors));
        this.ruleId = ruleId;
        this.errors = List.copyOf(errors);
    }

    public String getRuleId() {
        return ruleId;
    }

    public List<String> getErrors() {
        return errors;
    }
}
