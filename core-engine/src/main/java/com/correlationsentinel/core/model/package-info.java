/**
 * Domain model shared by the engine and the Flink job.
 *
 * <ul>
 * <li>{@link com.correlationsentinel.core.model.Event} – normalized security
 * event</li>
 * <li>{@link com.correlationsentinel.core.model.Match} – the events that
 * satisfied one rule</li>
 * <li>{@link com.correlationsentinel.core.model.Alert} – scored, deduplicated
 * alert emitted downstream</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.model;
