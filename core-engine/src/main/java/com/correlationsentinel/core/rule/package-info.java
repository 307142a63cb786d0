/**
 * Compiled, immutable rules.
 *
 * <ul>
 * <li>{@link com.correlationsentinel.core.rule.SingleEventRule} – fires on one
 * event</li>
 * <li>{@link com.correlationsentinel.core.rule.CorrelationRule} – fires when a
 * window reaches its threshold</li>
 * <li>{@link com.correlationsentinel.core.rule.SequenceRule} – fires when a
 * window completes every step</li>
 * </ul>
 *
 * <p>
 * The two windowed variants share
 * {@link com.correlationsentinel.core.rule.WindowedRule}, which the window
 * store and the dispatcher key on.
 * </p>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.rule;
