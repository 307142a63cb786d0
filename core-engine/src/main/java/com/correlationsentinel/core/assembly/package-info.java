/**
 * Turns triggers into idempotent {@link com.correlationsentinel.core.model.Match}es.
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.assembly;
