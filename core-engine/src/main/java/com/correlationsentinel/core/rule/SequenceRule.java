package com.correlationsentinel.core.rule;

import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.rule.condition.Condition;
import com.correlationsentinel.core.rule.condition.OrCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Rule that fires when events sharing the same correlation field values
 * complete every one of its {@link #getSteps() steps}.
 *
 * <p>
 * An {@link #isOrdered() ordered} sequence only accepts the step it is
 * waiting for; an event matching any other step is ignored. An unordered
 * sequence accepts each step once, in any order. After a step completes, the
 * next one must arrive within that step's timeout, and every step must fall
 * within {@link #getTimeWindowMs() timeWindowMs} of the first one; otherwise
 * the sequence starts over. Without explicit correlation fields, sequences
 * are tracked per event source.
 * </p>
 *
 * <p>
 * The rule's condition tree is the disjunction of its step conditions and is
 * derived by the builder.
 * </p>
 *
 * @since 1.0.0
 */
public final class SequenceRule extends Rule implements WindowedRule {

    /** Correlation used when none is configured. */
    public static final List<String> DEFAULT_CORRELATION_FIELDS = List.of(Event.FIELD_SOURCE_IDENTIFIER);

    private final List<SequenceStep> steps;
    private final boolean ordered;
    private final List<String> correlationFields;
    private final long timeWindowMs;

    private SequenceRule(Builder b) {
        super(b);
        this.steps = List.copyOf(b.steps);
        this.ordered = b.ordered;
        this.correlationFields = b.correlationFields == null || b.correlationFields.isEmpty()
                ? DEFAULT_CORRELATION_FIELDS
                : List.copyOf(b.correlationFields);
        if (b.timeWindowMs <= 0) {
            throw new IllegalArgumentException("timeWindowMs must be > 0 for rule '" + getId()
                    + "', got: " + b.timeWindowMs);
        }
        this.timeWindowMs = b.timeWindowMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public RuleType getType() {
        return RuleType.SEQUENCE;
    }

    @Override
    public List<String> effectiveDedupeFields() {
        return getDedupeFields().isEmpty() ? correlationFields : getDedupeFields();
    }

    public List<SequenceStep> getSteps() {
        return steps;
    }

    public boolean isOrdered() {
        return ordered;
    }

    @Override
    public List<String> getCorrelationFields() {
        return correlationFields;
    }

    @Override
    public long getTimeWindowMs() {
        return timeWindowMs;
    }

    /**
     * @return e.g. {@code "Sequence completed: login -> escalate"}
     */
    public String describeCompletion() {
        String names = steps.stream().map(SequenceStep::getName).collect(Collectors.joining(" -> "));
        return (ordered ? "Sequence completed: " : "Unordered sequence completed: ") + names;
    }

    /**
     * Builder for {@link SequenceRule}.
     */
    public static final class Builder extends Rule.Builder<Builder> {
        private final List<SequenceStep> steps = new ArrayList<>();
        private boolean ordered = true;
        private List<String> correlationFields;
        private long timeWindowMs;

        @Override
        protected Builder self() {
            return this;
        }

        public Builder step(SequenceStep step) {
            steps.add(Objects.requireNonNull(step, "step must not be null"));
            return this;
        }

        public Builder steps(List<SequenceStep> steps) {
            this.steps.clear();
            steps.forEach(this::step);
            return this;
        }

        public Builder ordered(boolean ordered) {
            this.ordered = ordered;
            return this;
        }

        public Builder correlationFields(List<String> correlationFields) {
            this.correlationFields = correlationFields;
            return this;
        }

        public Builder timeWindowMs(long timeWindowMs) {
            this.timeWindowMs = timeWindowMs;
            return this;
        }

        @Override
        public SequenceRule build() {
            if (steps.size() < 2) {
                throw new IllegalArgumentException("A sequence needs at least two steps, got: " + steps.size());
            }
            List<Condition> any = new ArrayList<>(steps.size());
            for (SequenceStep step : steps) {
                any.add(step.getCondition());
            }
            conditions(new OrCondition(any));
            return new SequenceRule(this);
        }
    }
}
