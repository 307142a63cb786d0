/**
 * Micrometer meters of the engine.
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.metrics;
