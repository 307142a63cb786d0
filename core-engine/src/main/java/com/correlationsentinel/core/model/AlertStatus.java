package com.correlationsentinel.core.model;

/**
 * Lifecycle status of an emitted {@link Alert}.
 *
 * <p>
 * The engine always emits {@code NEW}; transitions are driven by the
 * incident-management side.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertStatus {
    NEW,
    ACKNOWLEDGED,
    RESOLVED;

    /**
     * @param target the requested next status
     * @return {@code true} if moving from this status to {@code target} is allowed
     */
    public boolean canTransitionTo(AlertStatus target) {
        return switch (this) {
            case NEW -> target == ACKNOWLEDGED || target == RESOLVED;
            case ACKNOWLEDGED -> target == RESOLVED;
            case RESOLVED -> false;
        };
    }
}
