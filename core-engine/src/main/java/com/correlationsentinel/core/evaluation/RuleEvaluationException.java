package com.correlationsentinel.core.evaluation;

/**
 * A rule failed at runtime while being evaluated against an event. The rule is
 * isolated; other rules keep running.
 *
 * @since 1.0.0
 */
public class RuleEvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String ruleId;

    public RuleEvaluationException(String ruleId, String message, Throwable cause) {
        super("Rule '" + ruleId + "': " + message, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
