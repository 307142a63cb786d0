package com.correlationsentinel.core.rule.condition;

/**
 * Numeric comparison: {@code field > bound} or {@code field < bound}.
 * Non-numeric values never match.
 *
 * @since 1.0.0
 */
public final class FieldNumericComparison extends FieldCondition {

    /** Direction of the comparison. */
    public enum Operator {
        GREATER_THAN(">"),
        LESS_THAN("<");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }
    }

    private final Operator operator;
    private final double bound;

    public FieldNumericComparison(String field, Operator operator, double bound) {
        super(field);
        this.operator = operator;
        this.bound = bound;
    }

    @Override
    protected boolean testValue(Object value) {
        Double number = toDouble(value);
        if (number == null || number.isNaN()) {
            return false;
        }
        return operator == Operator.GREATER_THAN ? number > bound : number < bound;
    }

    public Operator getOperator() {
        return operator;
    }

    public double getBound() {
        return bound;
    }

    @Override
    public String describe() {
        return field + " " + operator.symbol + " " + render(bound);
    }
}
