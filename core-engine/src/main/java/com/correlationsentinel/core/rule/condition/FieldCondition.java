package com.correlationsentinel.core.rule.condition;

import com.correlationsentinel.core.model.Event;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base class of the leaf comparisons.
 *
 * <p>
 * Resolves the field on the event and hands the value to
 * {@link #testValue(Object)}. A collection-valued field matches when any of
 * its elements matches.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class FieldCondition implements Condition {

    protected final String field;

    protected FieldCondition(String field) {
        this.field = Objects.requireNonNull(field, "Condition field must not be null");
        if (field.isBlank()) {
            throw new IllegalArgumentException("Condition field must not be blank");
        }
    }

    @Override
    public boolean evaluate(Event event, MatchCollector collector) {
        Optional<Object> value = event.getField(field);
        if (value.isEmpty()) {
            return false;
        }
        Object raw = value.get();
        boolean matched = raw instanceof Collection<?> values
                ? testCollection(values)
                : testValue(raw);
        if (matched) {
            collector.record(field, raw, describe());
        }
        return matched;
    }

    /**
     * @param value non-null scalar field value
     * @return {@code true} if the value satisfies the comparison
     */
    protected abstract boolean testValue(Object value);

    protected boolean testCollection(Collection<?> values) {
        for (Object element : values) {
            if (element != null && testValue(element)) {
                return true;
            }
        }
        return false;
    }

    public String getField() {
        return field;
    }

    @Override
    public Set<String> referencedFields() {
        return Set.of(field);
    }

    /**
     * Render a value the way comparisons see it, see {@link Event#render(Object)}.
     */
    static String render(Object value) {
        return Event.render(value);
    }

    static Double toDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return describe();
    }
}
