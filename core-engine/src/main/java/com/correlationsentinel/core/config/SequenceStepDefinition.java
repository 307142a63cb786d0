package com.correlationsentinel.core.config;

import java.io.Serializable;
import java.util.Objects;

/**
 * External form of one step of a sequence rule.
 *
 * <pre>
 * steps:
 *   - name: login
 *     conditions: { op: equals, field: action, value: login }
 *     timeoutMs: 600000
 *   - name: escalate
 *     conditions: { op: equals, field: action, value: sudo }
 * </pre>
 *
 * @since 1.0.0
 */
public class SequenceStepDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private ConditionDefinition conditions;

    /** Gap allowed before the next step; 30 minutes when unset. */
    private Long timeoutMs;

    public SequenceStepDefinition() {
    }

    /**
     * @param name       step label
     * @param conditions what completes the step
     * @return a new step definition with the default timeout
     */
    public static SequenceStepDefinition of(String name, ConditionDefinition conditions) {
        SequenceStepDefinition def = new SequenceStepDefinition();
        def.setName(name);
        def.setConditions(conditions);
        return def;
    }

    public SequenceStepDefinition copy() {
        SequenceStepDefinition c = new SequenceStepDefinition();
        c.name = name;
        c.conditions = conditions != null ? conditions.copy() : null;
        c.timeoutMs = timeoutMs;
        return c;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ConditionDefinition getConditions() {
        return conditions;
    }

    public void setConditions(ConditionDefinition conditions) {
        this.conditions = conditions;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SequenceStepDefinition that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(timeoutMs, that.timeoutMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, timeoutMs);
    }

    @Override
    public String toString() {
        return "SequenceStepDefinition{name='" + name + "', timeoutMs=" + timeoutMs + '}';
    }
}
