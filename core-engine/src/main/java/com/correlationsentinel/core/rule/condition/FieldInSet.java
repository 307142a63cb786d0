package com.correlationsentinel.core.rule.condition;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Set membership: {@code field in [a, b, c]}, or its negation when built with
 * {@code negated = true} ({@code not_in}). A missing field never satisfies
 * either form.
 *
 * @since 1.0.0
 */
public final class FieldInSet extends FieldCondition {

    private final Set<String> values;
    private final boolean caseSensitive;
    private final boolean negated;

    public FieldInSet(String field, Collection<?> values, boolean caseSensitive, boolean negated) {
        super(field);
        Objects.requireNonNull(values, "values must not be null for field " + field);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty for field " + field);
        }
        this.caseSensitive = caseSensitive;
        this.negated = negated;
        Set<String> normalized = new LinkedHashSet<>();
        for (Object v : values) {
            normalized.add(normalize(render(v)));
        }
        this.values = Set.copyOf(normalized);
    }

    public FieldInSet(String field, Collection<?> values) {
        this(field, values, true, false);
    }

    @Override
    protected boolean testValue(Object value) {
        boolean member = values.contains(normalize(render(value)));
        return negated != member;
    }

    @Override
    protected boolean testCollection(Collection<?> elements) {
        if (!negated) {
            return super.testCollection(elements);
        }
        // not_in on a list: no element may be a member
        for (Object element : elements) {
            if (element != null && values.contains(normalize(render(element)))) {
                return false;
            }
        }
        return true;
    }

    private String normalize(String value) {
        return caseSensitive ? value : value.toLowerCase(Locale.ROOT);
    }

    public Set<String> getValues() {
        return values;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public String describe() {
        return field + (negated ? " not in " : " in ") + values;
    }
}
