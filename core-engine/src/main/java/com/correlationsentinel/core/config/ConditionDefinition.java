package com.correlationsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * External (YAML/JSON) form of a condition-tree node.
 *
 * <pre>
 * conditions:
 *   op: and
 *   conditions:
 *     - op: equals
 *       field: sourceIdentifier
 *       value: auth_failure
 *     - op: in
 *       field: user
 *       values: [alice, bob]
 * </pre>
 *
 * <p>
 * Leaf operators: {@code equals}, {@code contains}, {@code regex}, {@code in},
 * {@code not_in}, {@code gt}, {@code lt}. Combinators: {@code and}, {@code or},
 * {@code not}. The tree is translated into compiled
 * {@link com.correlationsentinel.core.rule.condition.Condition} nodes once, by
 * {@link RuleCompiler}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConditionDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private String op;
    private String field;
    private Object value;
    private List<Object> values;
    private Boolean caseSensitive;
    private List<ConditionDefinition> conditions;

    public ConditionDefinition() {
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * @param op    leaf operator, e.g. {@code "equals"}
     * @param field event field
     * @param value comparison value
     * @return a new leaf definition
     */
    public static ConditionDefinition leaf(String op, String field, Object value) {
        ConditionDefinition def = new ConditionDefinition();
        def.setOp(op);
        def.setField(field);
        def.setValue(value);
        return def;
    }

    /**
     * @param op     {@code "in"} or {@code "not_in"}
     * @param field  event field
     * @param values the set members
     * @return a new set-membership definition
     */
    public static ConditionDefinition set(String op, String field, List<?> values) {
        ConditionDefinition def = new ConditionDefinition();
        def.setOp(op);
        def.setField(field);
        def.setValues(new ArrayList<>(values));
        return def;
    }

    /**
     * @param op       {@code "and"}, {@code "or"} or {@code "not"}
     * @param children child definitions
     * @return a new combinator definition
     */
    public static ConditionDefinition composite(String op, ConditionDefinition... children) {
        ConditionDefinition def = new ConditionDefinition();
        def.setOp(op);
        def.setConditions(new ArrayList<>(Arrays.asList(children)));
        return def;
    }

    /**
     * @return a deep copy of this subtree
     */
    public ConditionDefinition copy() {
        ConditionDefinition c = new ConditionDefinition();
        c.op = op;
        c.field = field;
        c.value = value;
        c.values = values != null ? new ArrayList<>(values) : null;
        c.caseSensitive = caseSensitive;
        if (conditions != null) {
            List<ConditionDefinition> children = new ArrayList<>(conditions.size());
            for (ConditionDefinition child : conditions) {
                children.add(child != null ? child.copy() : null);
            }
            c.conditions = children;
        }
        return c;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getOp() {
        return op;
    }

    public void setOp(String op) {
        this.op = op;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public List<Object> getValues() {
        return values;
    }

    public void setValues(List<Object> values) {
        this.values = values;
    }

    public Boolean getCaseSensitive() {
        return caseSensitive;
    }

    public void setCaseSensitive(Boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    public List<ConditionDefinition> getConditions() {
        return conditions;
    }

    public void setConditions(List<ConditionDefinition> conditions) {
        this.conditions = conditions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConditionDefinition that))
            return false;
        return Objects.equals(op, that.op)
                && Objects.equals(field, that.field)
                && Objects.equals(value, that.value)
                && Objects.equals(values, that.values)
                && Objects.equals(caseSensitive, that.caseSensitive)
                && Objects.equals(conditions, that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, field, value, values, caseSensitive, conditions);
    }

    @Override
    public String toString() {
        return "ConditionDefinition{" +
                "op='" + op + '\'' +
                (field != null ? ", field='" + field + '\'' : "") +
                (value != null ? ", value=" + value : "") +
                (values != null ? ", values=" + values : "") +
                (conditions != null ? ", conditions=" + conditions : "") +
                '}';
    }
}
