package com.correlationsentinel.core.delivery;

import com.correlationsentinel.core.model.Alert;

/**
 * Durable fallback for alerts whose delivery exhausted every retry.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface OverflowStore {

    /**
     * @param alert the undelivered alert
     * @param cause the last delivery failure
     */
    void store(Alert alert, Throwable cause);
}
