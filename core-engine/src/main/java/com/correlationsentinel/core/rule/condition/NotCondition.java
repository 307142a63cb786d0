package com.correlationsentinel.core.rule.condition;

import com.correlationsentinel.core.model.Event;

import java.util.Objects;
import java.util.Set;

/**
 * Logical NOT. Contributes no matched fields: a negated comparison has no
 * satisfying value to record.
 *
 * @since 1.0.0
 */
public final class NotCondition implements Condition {

    private final Condition child;

    public NotCondition(Condition child) {
        this.child = Objects.requireNonNull(child, "NOT child must not be null");
    }

    @Override
    public boolean evaluate(Event event, MatchCollector collector) {
        return !child.evaluate(event, new MatchCollector());
    }

    public Condition getChild() {
        return child;
    }

    @Override
    public String describe() {
        return "NOT " + child.describe();
    }

    @Override
    public Set<String> referencedFields() {
        return child.referencedFields();
    }

    @Override
    public String toString() {
        return describe();
    }
}
