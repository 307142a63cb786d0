package com.correlationsentinel.core.rule;

import com.correlationsentinel.core.rule.condition.Condition;

import java.time.Duration;
import java.util.Objects;

/**
 * One step of a {@link SequenceRule}.
 *
 * @since 1.0.0
 */
public final class SequenceStep {

    /** Gap allowed after a step when none is configured. */
    public static final long DEFAULT_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    private final String name;
    private final Condition condition;
    private final long timeoutMs;

    /**
     * @param name      label used in match descriptions
     * @param condition what an event must satisfy to complete the step
     * @param timeoutMs how long after this step the next one may arrive; must be &gt; 0
     */
    public SequenceStep(String name, Condition condition, long timeoutMs) {
        this.name = Objects.requireNonNull(name, "step name must not be null");
        this.condition = Objects.requireNonNull(condition, "step condition must not be null");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("step timeoutMs must be > 0, got: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    public SequenceStep(String name, Condition condition) {
        this(name, condition, DEFAULT_TIMEOUT_MS);
    }

    public String getName() {
        return name;
    }

    public Condition getCondition() {
        return condition;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public String toString() {
        return name + "(" + condition.describe() + ")";
    }
}
