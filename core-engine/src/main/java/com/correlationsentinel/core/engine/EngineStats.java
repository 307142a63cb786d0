package com.correlationsentinel.core.engine;

/**
 * Point-in-time counters of a {@link CorrelationEngine}.
 *
 * @since 1.0.0
 */
public final class EngineStats {

    private final long eventsProcessed;
    private final int activeWindows;
    private final long activeRules;
    private final long alertsEmitted;
    private final long alertsSuppressed;
    private final long ruleErrors;
    private final int pendingWork;

    EngineStats(long eventsProcessed, int activeWindows, long activeRules, long alertsEmitted,
            long alertsSuppressed, long ruleErrors, int pendingWork) {
        this.eventsProcessed = eventsProcessed;
        this.activeWindows = activeWindows;
        this.activeRules = activeRules;
        this.alertsEmitted = alertsEmitted;
        this.alertsSuppressed = alertsSuppressed;
        this.ruleErrors = ruleErrors;
        this.pendingWork = pendingWork;
    }

    public long getEventsProcessed() {
        return eventsProcessed;
    }

    public int getActiveWindows() {
        return activeWindows;
    }

    /** Enabled rules in the current snapshot. */
    public long getActiveRules() {
        return activeRules;
    }

    public long getAlertsEmitted() {
        return alertsEmitted;
    }

    /** Duplicates plus matches of suppression rules. */
    public long getAlertsSuppressed() {
        return alertsSuppressed;
    }

    public long getRuleErrors() {
        return ruleErrors;
    }

    /** Events waiting for dispatch plus work items queued on lanes and alerts queued for delivery. */
    public int getPendingWork() {
        return pendingWork;
    }

    @Override
    public String toString() {
        return "EngineStats{" +
                "eventsProcessed=" + eventsProcessed +
                ", activeWindows=" + activeWindows +
                ", activeRules=" + activeRules +
                ", alertsEmitted=" + alertsEmitted +
                ", alertsSuppressed=" + alertsSuppressed +
                ", ruleErrors=" + ruleErrors +
                ", pendingWork=" + pendingWork +
                '}';
    }
}
