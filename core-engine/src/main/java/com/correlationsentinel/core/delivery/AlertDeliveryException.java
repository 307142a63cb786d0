package com.correlationsentinel.core.delivery;

/**
 * Thrown by an {@link AlertSink} that could not accept an alert.
 */
public class AlertDeliveryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
