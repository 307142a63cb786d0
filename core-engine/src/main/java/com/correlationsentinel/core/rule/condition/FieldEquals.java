package com.correlationsentinel.core.rule.condition;

import java.util.Locale;
import java.util.Objects;

/**
 * {@code field == value}. Case-sensitive unless configured otherwise; numbers
 * compare by value ({@code 5} equals {@code 5.0}).
 *
 * @since 1.0.0
 */
public final class FieldEquals extends FieldCondition {

    private final Object expected;
    private final String expectedRendered;
    private final boolean caseSensitive;

    public FieldEquals(String field, Object expected, boolean caseSensitive) {
        super(field);
        this.expected = Objects.requireNonNull(expected, "equals value must not be null for field " + field);
        this.caseSensitive = caseSensitive;
        this.expectedRendered = caseSensitive
                ? render(expected)
                : render(expected).toLowerCase(Locale.ROOT);
    }

    public FieldEquals(String field, Object expected) {
        this(field, expected, true);
    }

    @Override
    protected boolean testValue(Object value) {
        String actual = render(value);
        return caseSensitive
                ? actual.equals(expectedRendered)
                : actual.toLowerCase(Locale.ROOT).equals(expectedRendered);
    }

    public Object getExpected() {
        return expected;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    @Override
    public String describe() {
        return field + " equals '" + render(expected) + "'";
    }
}
