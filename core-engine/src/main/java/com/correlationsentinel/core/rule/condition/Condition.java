package com.correlationsentinel.core.rule.condition;

import com.correlationsentinel.core.model.Event;

import java.util.Set;

/**
 * Node of a rule's boolean condition tree.
 *
 * <p>
 * Evaluation is pure and total: a missing field or a value of the wrong type
 * makes a comparison evaluate to {@code false}, never throw.
 * </p>
 *
 * @since 1.0.0
 */
public interface Condition {

    /**
     * Evaluate this node against an event.
     *
     * @param event     the event to test
     * @param collector receives the field values and descriptions of the
     *                  comparisons that made the node true; left untouched
     *                  when the node evaluates to {@code false}
     * @return {@code true} if the event satisfies this node
     */
    boolean evaluate(Event event, MatchCollector collector);

    /**
     * Evaluate without collecting matched fields.
     *
     * @param event the event to test
     * @return {@code true} if the event satisfies this node
     */
    default boolean test(Event event) {
        return evaluate(event, new MatchCollector());
    }

    /**
     * @return human-readable rendering, e.g. {@code user equals 'alice'}
     */
    String describe();

    /**
     * @return every field name referenced in this subtree
     */
    Set<String> referencedFields();
}
