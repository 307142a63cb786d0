package com.correlationsentinel.core.window;

import com.correlationsentinel.core.model.EventRef;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.UUID;

/**
 * Mutable window state. Only touched by {@link WindowManager} while holding
 * the lock of the shard that owns the key.
 *
 * <p>
 * Sequence windows also track which steps are complete and the deadline for
 * the next one; their threshold is the number of steps.
 * </p>
 */
final class Window {

    private final String id;
    private final WindowKey key;
    private final long ruleVersion;
    private final long startTime;
    private final long endTime;
    private final int threshold;
    private final List<EventRef> entries = new ArrayList<>();
    private boolean matched;
    private final BitSet completedSteps = new BitSet();
    private long stepDeadline = Long.MAX_VALUE;

    Window(WindowKey key, long ruleVersion, long startTime, long timeWindowMs, int threshold) {
        this.key = key;
        this.ruleVersion = ruleVersion;
        this.startTime = startTime;
        this.endTime = startTime + timeWindowMs;
        this.threshold = threshold;
        String identity = key + "|" + startTime;
        this.id = UUID.nameUUIDFromBytes(identity.getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Events at or before the end time (and the pending step's deadline) join;
     * later ones start a new window.
     */
    boolean accepts(long timestamp) {
        return timestamp <= endTime && timestamp <= stepDeadline;
    }

    void add(EventRef entry) {
        entries.add(entry);
    }

    boolean isStepCompleted(int step) {
        return completedSteps.get(step);
    }

    int firstOpenStep() {
        return completedSteps.nextClearBit(0);
    }

    /**
     * @param step     index of the completed step
     * @param entry    the event that completed it
     * @param deadline latest timestamp accepted for the next step
     */
    void completeStep(int step, EventRef entry, long deadline) {
        completedSteps.set(step);
        entries.add(entry);
        stepDeadline = deadline;
    }

    /** Wall-clock time after which the window can be dropped. */
    long expiresAt() {
        return Math.min(endTime, stepDeadline);
    }

    /**
     * @return {@code true} exactly once: on the append that reaches the threshold
     */
    boolean markMatchedIfReached() {
        if (!matched && entries.size() >= threshold) {
            matched = true;
            return true;
        }
        return false;
    }

    WindowSnapshot snapshot() {
        return new WindowSnapshot(id, key, ruleVersion, startTime, endTime, threshold, entries, matched);
    }

    String getId() {
        return id;
    }

    WindowKey getKey() {
        return key;
    }

    long getStartTime() {
        return startTime;
    }

    long getEndTime() {
        return endTime;
    }

    boolean isMatched() {
        return matched;
    }
}
