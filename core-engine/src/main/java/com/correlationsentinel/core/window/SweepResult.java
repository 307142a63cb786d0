package com.correlationsentinel.core.window;

/**
 * Counts of windows removed by one {@link WindowManager#sweep()}.
 *
 * @since 1.0.0
 */
public final class SweepResult {

    private final int expired;
    private final int finalized;

    SweepResult(int expired, int finalized) {
        this.expired = expired;
        this.finalized = finalized;
    }

    /** Windows that ended without reaching their threshold. */
    public int getExpired() {
        return expired;
    }

    /** Windows that had matched and reached their end time. */
    public int getFinalized() {
        return finalized;
    }

    public int getRemoved() {
        return expired + finalized;
    }

    @Override
    public String toString() {
        return "SweepResult{expired=" + expired + ", finalized=" + finalized + '}';
    }
}
