package com.correlationsentinel.core.rule.condition;

import java.util.Locale;
import java.util.Objects;

/**
 * Substring match on the string rendering of a field. Case-insensitive by
 * default.
 *
 * @since 1.0.0
 */
public final class FieldContains extends FieldCondition {

    private final String substring;
    private final boolean caseSensitive;
    private final String needle;

    public FieldContains(String field, String substring, boolean caseSensitive) {
        super(field);
        this.substring = Objects.requireNonNull(substring, "contains value must not be null for field " + field);
        this.caseSensitive = caseSensitive;
        this.needle = caseSensitive ? substring : substring.toLowerCase(Locale.ROOT);
    }

    @Override
    protected boolean testValue(Object value) {
        String haystack = render(value);
        if (!caseSensitive) {
            haystack = haystack.toLowerCase(Locale.ROOT);
        }
        return haystack.contains(needle);
    }

    public String getSubstring() {
        return substring;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    @Override
    public String describe() {
        return field + " contains '" + substring + "'";
    }
}
