package com.correlationsentinel.core.window;

import java.util.Optional;

/**
 * Outcome of {@link WindowManager#append} and {@link WindowManager#advance}.
 *
 * @since 1.0.0
 */
public final class AppendResult {

    /**
     * What happened to the event.
     */
    public enum Outcome {
        /** The append brought the window to its threshold; reported once per window. */
        MATCHED,
        /** The event joined a window without reaching (or after reaching) the threshold. */
        APPENDED,
        /** A correlation field was absent; the event was ignored for this rule. */
        SKIPPED_MISSING_FIELD,
        /** The event satisfied only steps the sequence is not waiting for. */
        SKIPPED_OUT_OF_ORDER
    }

    private static final AppendResult SKIPPED = new AppendResult(Outcome.SKIPPED_MISSING_FIELD, null, false, false, 0);

    private final Outcome outcome;
    private final WindowSnapshot window;
    private final boolean newWindow;
    private final boolean replacedExpired;
    private final int evicted;

    AppendResult(Outcome outcome, WindowSnapshot window, boolean newWindow, boolean replacedExpired, int evicted) {
        this.outcome = outcome;
        this.window = window;
        this.newWindow = newWindow;
        this.replacedExpired = replacedExpired;
        this.evicted = evicted;
    }

    static AppendResult skipped() {
        return SKIPPED;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isMatched() {
        return outcome == Outcome.MATCHED;
    }

    /**
     * @return the window after the append; empty when no window exists for the key
     */
    public Optional<WindowSnapshot> getWindow() {
        return Optional.ofNullable(window);
    }

    /** Whether the append opened a new window. */
    public boolean isNewWindow() {
        return newWindow;
    }

    /** Whether opening the new window discarded a previous, never matched one for the same key. */
    public boolean isReplacedExpired() {
        return replacedExpired;
    }

    /** Windows of the same rule evicted to stay within the per-rule cap. */
    public int getEvicted() {
        return evicted;
    }

    @Override
    public String toString() {
        return "AppendResult{" +
                "outcome=" + outcome +
                ", window=" + window +
                ", newWindow=" + newWindow +
                ", evicted=" + evicted +
                '}';
    }
}
