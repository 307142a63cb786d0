package com.correlationsentinel.core.rule.condition;

import com.correlationsentinel.core.model.Event;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Logical OR. Every child is evaluated so that all satisfied branches
 * contribute their matched fields.
 *
 * @since 1.0.0
 */
public final class OrCondition implements Condition {

    private final List<Condition> children;

    public OrCondition(List<Condition> children) {
        Objects.requireNonNull(children, "OR children must not be null");
        if (children.isEmpty()) {
            throw new IllegalArgumentException("OR requires at least one child condition");
        }
        this.children = List.copyOf(children);
    }

    @Override
    public boolean evaluate(Event event, MatchCollector collector) {
        boolean any = false;
        for (Condition child : children) {
            if (child.evaluate(event, collector)) {
                any = true;
            }
        }
        return any;
    }

    public List<Condition> getChildren() {
        return children;
    }

    @Override
    public String describe() {
        return children.stream().map(Condition::describe)
                .collect(Collectors.joining(" OR ", "(", ")"));
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
