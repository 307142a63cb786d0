package com.correlationsentinel.core.window;

import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.rule.CorrelationRule;
import com.correlationsentinel.core.rule.SequenceRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every live correlation window.
 *
 * <h3>Windows</h3>
 * <p>
 * Windows are tumbling from their first event: {@code endTime = startTime +
 * timeWindowMs}, fixed when the window is opened, together with the rule's
 * threshold. An event whose timestamp is at or before {@code endTime} joins
 * the live window of its key (late events before {@code startTime}
 * included); a later one closes it and opens a new window. The append that
 * brings a window to its threshold reports {@link AppendResult.Outcome#MATCHED};
 * later appends to the same window report
 * {@link AppendResult.Outcome#APPENDED}.
 * </p>
 *
 * <h3>Sequences</h3>
 * <p>
 * {@link #advance} keeps the progress of sequence rules in the same shards,
 * under the same keys and caps. See {@link SequenceRule}.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * State is split into shards by {@link WindowKey#hashCode()}, each guarded by
 * its own {@link ReentrantLock}. All operations hold at most one shard lock at
 * a time, so unrelated keys never contend and lock ordering cannot deadlock.
 * </p>
 *
 * <h3>Capacity</h3>
 * <p>
 * Each rule may own at most {@code maxWindowsPerRule} live windows. Opening
 * one more evicts the rule's oldest unmatched window (by start time).
 * </p>
 *
 * <h3>Expiry</h3>
 * <p>
 * {@link #sweep()} removes windows whose end time lies before the wall clock.
 * Membership uses event time; expiry uses processing time.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowManager {

    private static final Logger LOG = LoggerFactory.getLogger(WindowManager.class);

    private final Shard[] shards;
    private final int maxWindowsPerRule;
    private final Clock clock;
    private final Map<String, AtomicInteger> liveByRule = new ConcurrentHashMap<>();
    private final AtomicInteger live = new AtomicInteger();

    /**
     * @param shardCount        number of lock shards; must be &gt; 0
     * @param maxWindowsPerRule per-rule live window cap; must be &gt; 0
     * @param clock             wall clock driving {@link #sweep()}
     */
    public WindowManager(int shardCount, int maxWindowsPerRule, Clock clock) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be >= 1, got: " + shardCount);
        }
        if (maxWindowsPerRule < 1) {
            throw new IllegalArgumentException("maxWindowsPerRule must be >= 1, got: " + maxWindowsPerRule);
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxWindowsPerRule = maxWindowsPerRule;
        this.shards = new Shard[shardCount];
        for (int i = 0; i < shardCount; i++) {
            shards[i] = new Shard();
        }
    }

    // ---------------------------------------------------------------
    // Append
    // ---------------------------------------------------------------

    /**
     * Add an event that satisfied a correlation rule's conditions to the
     * window of its key.
     *
     * @param rule          the correlation rule
     * @param event         the matching event; must carry a timestamp
     * @param matchedFields field values that satisfied the conditions
     * @return what happened to the event
     */
    public AppendResult append(CorrelationRule rule, Event event, Map<String, Object> matchedFields) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(event.getTimestamp(), "event timestamp must not be null");

        Optional<WindowKey> maybeKey = WindowKey.of(rule, event);
        if (maybeKey.isEmpty()) {
            LOG.debug("Event {} lacks a correlation field of rule '{}' {}, skipped",
                    event.getId(), rule.getId(), rule.getCorrelationFields());
            return AppendResult.skipped();
        }
        WindowKey key = maybeKey.get();
        long ts = event.getTimestampMillis();

        boolean created = false;
        boolean replacedExpired = false;
        AppendResult.Outcome outcome;
        WindowSnapshot snapshot;

        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            Window window = shard.windows.get(key);
            if (window != null && !window.accepts(ts)) {
                shard.windows.remove(key);
                released(key.getRuleId());
                replacedExpired = !window.isMatched();
                window = null;
            }
            if (window == null) {
                window = new Window(key, rule.getVersion(), ts, rule.getTimeWindowMs(), rule.getThreshold());
                shard.windows.put(key, window);
                acquired(key.getRuleId());
                created = true;
            }
            window.add(EventRef.of(event, matchedFields));
            outcome = window.markMatchedIfReached()
                    ? AppendResult.Outcome.MATCHED
                    : AppendResult.Outcome.APPENDED;
            snapshot = window.snapshot();
        } finally {
            shard.lock.unlock();
        }

        int evicted = created ? enforceCap(key) : 0;
        return new AppendResult(outcome, snapshot, created, replacedExpired, evicted);
    }

    // ---------------------------------------------------------------
    // Sequences
    // ---------------------------------------------------------------

    /**
     * Feed an event that satisfied one or more steps of a sequence rule to the
     * sequence of its key.
     *
     * <p>
     * An ordered sequence advances only when the event satisfies the first
     * open step; an unordered one takes the first open step the event
     * satisfies. A sequence whose pending step timed out, or whose window
     * ended, is dropped before the event is considered, so the event may
     * start a new one. A completed sequence is removed at once and reported
     * {@link AppendResult.Outcome#MATCHED}.
     * </p>
     *
     * @param rule          the sequence rule
     * @param event         the event; must carry a timestamp
     * @param matchingSteps indexes of the steps whose conditions the event satisfies
     * @param matchedFields field values that satisfied those steps
     * @return what happened to the event
     */
    public AppendResult advance(SequenceRule rule, Event event, BitSet matchingSteps,
            Map<String, Object> matchedFields) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(event.getTimestamp(), "event timestamp must not be null");

        Optional<WindowKey> maybeKey = WindowKey.of(rule, event);
        if (maybeKey.isEmpty()) {
            LOG.debug("Event {} lacks a correlation field of sequence '{}' {}, skipped",
                    event.getId(), rule.getId(), rule.getCorrelationFields());
            return AppendResult.skipped();
        }
        WindowKey key = maybeKey.get();
        long ts = event.getTimestampMillis();

        boolean created = false;
        boolean replacedExpired = false;
        AppendResult.Outcome outcome;
        WindowSnapshot snapshot = null;

        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            Window window = shard.windows.get(key);
            if (window != null && !window.accepts(ts)) {
                shard.windows.remove(key);
                released(key.getRuleId());
                replacedExpired = true;
                window = null;
            }
            int step = nextStep(window, rule.isOrdered(), matchingSteps);
            if (step < 0) {
                outcome = AppendResult.Outcome.SKIPPED_OUT_OF_ORDER;
                if (window != null) {
                    snapshot = window.snapshot();
                }
            } else {
                if (window == null) {
                    window = new Window(key, rule.getVersion(), ts, rule.getTimeWindowMs(), rule.getSteps().size());
                    shard.windows.put(key, window);
                    acquired(key.getRuleId());
                    created = true;
                }
                window.completeStep(step, EventRef.of(event, matchedFields),
                        ts + rule.getSteps().get(step).getTimeoutMs());
                if (window.markMatchedIfReached()) {
                    outcome = AppendResult.Outcome.MATCHED;
                    shard.windows.remove(key);
                    released(key.getRuleId());
                } else {
                    outcome = AppendResult.Outcome.APPENDED;
                }
                snapshot = window.snapshot();
            }
        } finally {
            shard.lock.unlock();
        }

        if (outcome == AppendResult.Outcome.SKIPPED_OUT_OF_ORDER) {
            LOG.debug("Event {} does not advance sequence '{}' for {}", event.getId(), rule.getId(), key);
        }
        int evicted = created ? enforceCap(key) : 0;
        return new AppendResult(outcome, snapshot, created, replacedExpired, evicted);
    }

    /**
     * @return the step the event completes, or -1 if it completes none
     */
    private static int nextStep(Window window, boolean ordered, BitSet matchingSteps) {
        if (ordered) {
            int open = window != null ? window.firstOpenStep() : 0;
            return matchingSteps.get(open) ? open : -1;
        }
        for (int i = matchingSteps.nextSetBit(0); i >= 0; i = matchingSteps.nextSetBit(i + 1)) {
            if (window == null || !window.isStepCompleted(i)) {
                return i;
            }
        }
        return -1;
    }

    private int enforceCap(WindowKey key) {
        int evicted = 0;
        while (count(key.getRuleId()) > maxWindowsPerRule && evictOldestUnmatched(key.getRuleId(), key)) {
            evicted++;
        }
        if (evicted > 0) {
            LOG.warn("Rule '{}' exceeded {} live windows, evicted {} oldest unmatched window(s)",
                    key.getRuleId(), maxWindowsPerRule, evicted);
        }
        return evicted;
    }

    /**
     * Evict the oldest unmatched window of a rule, never the one just opened.
     * Scans shard by shard, then re-checks the candidate under its own lock.
     */
    private boolean evictOldestUnmatched(String ruleId, WindowKey keep) {
        WindowKey oldestKey = null;
        String oldestId = null;
        long oldestStart = Long.MAX_VALUE;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                for (Window window : shard.windows.values()) {
                    if (window.getKey().getRuleId().equals(ruleId) && !window.isMatched()
                            && !window.getKey().equals(keep) && window.getStartTime() < oldestStart) {
                        oldestKey = window.getKey();
                        oldestId = window.getId();
                        oldestStart = window.getStartTime();
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        if (oldestKey == null) {
            return false;
        }
        Shard shard = shardFor(oldestKey);
        shard.lock.lock();
        try {
            Window window = shard.windows.get(oldestKey);
            if (window != null && window.getId().equals(oldestId) && !window.isMatched()) {
                shard.windows.remove(oldestKey);
                released(ruleId);
                return true;
            }
            // matched or replaced since the scan; the next opened window retries
            return false;
        } finally {
            shard.lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Expiry
    // ---------------------------------------------------------------

    /**
     * Remove every window whose end time, or pending sequence step deadline,
     * has passed on the wall clock.
     *
     * @return how many expired (never matched) and finalized (matched) windows were removed
     */
    public SweepResult sweep() {
        long now = clock.millis();
        int expired = 0;
        int finalized = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                Iterator<Window> it = shard.windows.values().iterator();
                while (it.hasNext()) {
                    Window window = it.next();
                    if (window.expiresAt() < now) {
                        it.remove();
                        released(window.getKey().getRuleId());
                        if (window.isMatched()) {
                            finalized++;
                        } else {
                            expired++;
                        }
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        if (expired + finalized > 0) {
            LOG.debug("Sweep removed {} expired and {} finalized window(s)", expired, finalized);
        }
        return new SweepResult(expired, finalized);
    }

    /**
     * Drop every window of one rule, e.g. after the rule was deleted.
     *
     * @param ruleId the rule
     * @return number of windows dropped
     */
    public int discardRule(String ruleId) {
        int removed = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                Iterator<WindowKey> it = shard.windows.keySet().iterator();
                while (it.hasNext()) {
                    if (it.next().getRuleId().equals(ruleId)) {
                        it.remove();
                        released(ruleId);
                        removed++;
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        liveByRule.remove(ruleId);
        return removed;
    }

    /**
     * Drop all windows.
     *
     * @return number of unmatched windows discarded
     */
    public int clear() {
        int unmatched = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                for (Window window : shard.windows.values()) {
                    if (!window.isMatched()) {
                        unmatched++;
                    }
                    released(window.getKey().getRuleId());
                }
                shard.windows.clear();
            } finally {
                shard.lock.unlock();
            }
        }
        liveByRule.clear();
        return unmatched;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public int activeWindowCount() {
        return live.get();
    }

    public int activeWindowCount(String ruleId) {
        return count(ruleId);
    }

    /**
     * @param key window key
     * @return a snapshot of the live window for the key, if any
     */
    public Optional<WindowSnapshot> find(WindowKey key) {
        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            Window window = shard.windows.get(key);
            return window != null ? Optional.of(window.snapshot()) : Optional.empty();
        } finally {
            shard.lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Shard shardFor(WindowKey key) {
        return shards[Math.floorMod(key.hashCode(), shards.length)];
    }

    private void acquired(String ruleId) {
        liveByRule.computeIfAbsent(ruleId, id -> new AtomicInteger()).incrementAndGet();
        live.incrementAndGet();
    }

    private void released(String ruleId) {
        AtomicInteger count = liveByRule.get(ruleId);
        if (count != null) {
            count.decrementAndGet();
        }
        live.decrementAndGet();
    }

    private int count(String ruleId) {
        AtomicInteger count = liveByRule.get(ruleId);
        return count != null ? count.get() : 0;
    }

    private static final class Shard {
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<WindowKey, Window> windows = new HashMap<>();
    }
}
