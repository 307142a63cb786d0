/**
 * Evaluates one rule against one event and reports a
 * {@link com.correlationsentinel.core.evaluation.Trigger} when the rule fires.
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.evaluation;
