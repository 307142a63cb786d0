package com.correlationsentinel.core.delivery;

import com.correlationsentinel.core.model.Alert;

/**
 * Downstream consumer of emitted alerts (incident management, notification
 * fan-out).
 *
 * <p>
 * Implementations signal a failed hand-off by throwing; the
 * {@link AlertEmitter} retries and eventually diverts the alert to an
 * {@link OverflowStore}. Calls may arrive concurrently from several emitter
 * threads.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertSink {

    /**
     * Accept one alert.
     *
     * @param alert the alert; never {@code null}
     * @throws AlertDeliveryException if the alert could not be accepted
     */
    void onAlert(Alert alert);
}
