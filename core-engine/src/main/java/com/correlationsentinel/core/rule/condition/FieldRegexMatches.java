package com.correlationsentinel.core.rule.condition;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Regular-expression search ({@link java.util.regex.Matcher#find()}) on the
 * string rendering of a field. The pattern is compiled once, when the rule is
 * loaded.
 *
 * @since 1.0.0
 */
public final class FieldRegexMatches extends FieldCondition {

    private final Pattern pattern;

    public FieldRegexMatches(String field, Pattern pattern) {
        super(field);
        this.pattern = Objects.requireNonNull(pattern, "regex must not be null for field " + field);
    }

    /**
     * @param field         field to test
     * @param regex         pattern source
     * @param caseSensitive whether matching is case-sensitive
     * @throws java.util.regex.PatternSyntaxException if {@code regex} is invalid
     */
    public FieldRegexMatches(String field, String regex, boolean caseSensitive) {
        this(field, Pattern.compile(regex, caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    @Override
    protected boolean testValue(Object value) {
        return pattern.matcher(render(value)).find();
    }

    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public String describe() {
        return field + " matches /" + pattern.pattern() + "/";
    }
}
