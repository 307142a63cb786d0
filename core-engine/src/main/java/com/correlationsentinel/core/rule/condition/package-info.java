/**
 * Condition trees evaluated against a single event.
 *
 * <p>
 * Leaves extend {@link com.correlationsentinel.core.rule.condition.FieldCondition}
 * and record the field values they matched into a
 * {@link com.correlationsentinel.core.rule.condition.MatchCollector}; the
 * {@code and}, {@code or} and {@code not} composites short-circuit.
 * </p>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.rule.condition;
