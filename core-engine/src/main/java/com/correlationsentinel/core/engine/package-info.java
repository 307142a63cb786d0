/**
 * Engine runtime: ingress, dispatch to worker lanes, the synchronous
 * {@link com.correlationsentinel.core.engine.CorrelationPipeline} and the
 * {@link com.correlationsentinel.core.engine.CorrelationEngine} lifecycle.
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.engine;
