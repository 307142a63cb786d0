package com.correlationsentinel.core.registry;

import java.time.Instant;

/**
 * Runtime health of one rule: whether it has been marked degraded after
 * failing during evaluation, how often it failed, and the last failure.
 *
 * @since 1.0.0
 */
public final class RuleHealth {

    private static final RuleHealth HEALTHY = new RuleHealth(false, 0, null, null);

    private final boolean degraded;
    private final long errorCount;
    private final String lastError;
    private final Instant lastErrorAt;

    private RuleHealth(boolean degraded, long errorCount, String lastError, Instant lastErrorAt) {
        this.degraded = degraded;
        this.errorCount = errorCount;
        this.lastError = lastError;
        this.lastErrorAt = lastErrorAt;
    }

    public static RuleHealth healthy() {
        return HEALTHY;
    }

    /**
     * @param error description of the failure
     * @param at    when it happened
     * @return a degraded copy with the error count incremented
     */
    RuleHealth withError(String error, Instant at) {
        return new RuleHealth(true, errorCount + 1, error, at);
    }

    public boolean isDegraded() {
        return degraded;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getLastErrorAt() {
        return lastErrorAt;
    }

    @Override
    public String toString() {
        return "RuleHealth{" +
                "degraded=" + degraded +
                ", errorCount=" + errorCount +
                ", lastError='" + lastError + '\'' +
                ", lastErrorAt=" + lastErrorAt +
                '}';
    }
}
