/**
 * Apache Flink deployment of the correlation engine.
 *
 * <p>
 * Consumes normalized events from Kafka, runs the
 * {@link com.correlationsentinel.core.engine.CorrelationPipeline} per
 * organization key and publishes alerts back to Kafka.
 * </p>
 *
 * <ul>
 * <li>{@link com.correlationsentinel.flink.CorrelationJob} – entry point</li>
 * <li>{@link com.correlationsentinel.flink.CorrelationProcessFunction} – keyed
 * operator</li>
 * <li>{@link com.correlationsentinel.flink.JobConfig} – environment-driven
 * configuration</li>
 * <li>{@link com.correlationsentinel.flink.HealthServer} – health and readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.flink;
