package com.correlationsentinel.core.rule.condition;

import com.correlationsentinel.core.model.Event;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Logical AND; short-circuits on the first false child.
 *
 * @since 1.0.0
 */
public final class AndCondition implements Condition {

    private final List<Condition> children;

    public AndCondition(List<Condition> children) {
        Objects.requireNonNull(children, "AND children must not be null");
        if (children.isEmpty()) {
            throw new IllegalArgumentException("AND requires at least one child condition");
        }
        this.children = List.copyOf(children);
    }

    @Override
    public boolean evaluate(Event event, MatchCollector collector) {
        MatchCollector scratch = new MatchCollector();
        for (Condition child : children) {
            if (!child.evaluate(event, scratch)) {
                return false;
            }
        }
        collector.absorb(scratch);
        return true;
    }

    public List<Condition> getChildren() {
        return children;
    }

    @Override
    public String describe() {
        return children.stream().map(Condition::describe)
                .collect(Collectors.joining(" AND ", "(", ")"));
    }

    @Override
    public Set<String> referencedFields() {
        Set<String> fields = new LinkedHashSet<>();
        children.forEach(c -> fields.addAll(c.referencedFields()));
        return fields;
    }

    @Override
    public String toString() {
        return describe();
    }
}
