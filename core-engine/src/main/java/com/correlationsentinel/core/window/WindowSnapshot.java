package com.correlationsentinel.core.window;

import com.correlationsentinel.core.model.EventRef;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a window taken while its shard lock was held.
 *
 * @since 1.0.0
 */
public final class WindowSnapshot {

    private final String windowId;
    private final WindowKey key;
    private final long ruleVersion;
    private final long startTime;
    private final long endTime;
    private final int threshold;
    private final List<EventRef> entries;
    private final boolean matched;

    WindowSnapshot(String windowId, WindowKey key, long ruleVersion, long startTime, long endTime,
            int threshold, List<EventRef> entries, boolean matched) {
        this.windowId = windowId;
        this.key = key;
        this.ruleVersion = ruleVersion;
        this.startTime = startTime;
        this.endTime = endTime;
        this.threshold = threshold;
        this.entries = List.copyOf(entries);
        this.matched = matched;
    }

    public String getWindowId() {
        return windowId;
    }

    public WindowKey getKey() {
        return key;
    }

    /** Version of the rule that opened the window. */
    public long getRuleVersion() {
        return ruleVersion;
    }

    public Instant getStartTime() {
        return Instant.ofEpochMilli(startTime);
    }

    public Instant getEndTime() {
        return Instant.ofEpochMilli(endTime);
    }

    public int getThreshold() {
        return threshold;
    }

    /** Participating events in arrival order. */
    public List<EventRef> getEntries() {
        return entries;
    }

    public int getEventCount() {
        return entries.size();
    }

    public boolean isMatched() {
        return matched;
    }

    @Override
    public String toString() {
        return "WindowSnapshot{" +
                "windowId='" + windowId + '\'' +
                ", key=" + key +
                ", start=" + getStartTime() +
                ", end=" + getEndTime() +
                ", eventCount=" + entries.size() +
                ", threshold=" + threshold +
                ", matched=" + matched +
                '}';
    }
}
