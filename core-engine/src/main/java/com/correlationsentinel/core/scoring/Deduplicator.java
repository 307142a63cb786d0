package com.correlationsentinel.core.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Suppresses repeated alerts for the same dedupe key.
 *
 * <p>
 * A match is suppressed while an unresolved alert with the same key was
 * emitted less than the suppression interval ago. The interval is anchored at
 * the emission and measured in processing time; suppressed matches do not
 * extend it. Thread-safe: each key is updated atomically.
 * </p>
 *
 * @since 1.0.0
 */
public final class Deduplicator {

    private static final Logger LOG = LoggerFactory.getLogger(Deduplicator.class);

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public Deduplicator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Register a match for a key.
     *
     * @param key      dedupe key
     * @param interval suppression interval to start if the match is emitted
     * @return {@code true} if an alert should be emitted, {@code false} if it is suppressed
     */
    public boolean offer(String key, Duration interval) {
        Objects.requireNonNull(key, "key must not be null");
        long now = clock.millis();
        boolean[] emit = new boolean[1];
        entries.compute(key, (k, entry) -> {
            if (entry == null || entry.stateAt(now) != DedupeState.ACTIVE) {
                emit[0] = true;
                return new Entry(now, now + interval.toMillis());
            }
            entry.suppressed++;
            return entry;
        });
        if (!emit[0]) {
            LOG.debug("Suppressed duplicate for key {}", key);
        }
        return emit[0];
    }

    /**
     * @param key dedupe key
     * @return current state of the key
     */
    public DedupeState state(String key) {
        Entry entry = entries.get(key);
        return entry == null ? DedupeState.NONE : entry.stateAt(clock.millis());
    }

    /**
     * @param key dedupe key
     * @return matches suppressed since the last emission for the key
     */
    public long suppressedCount(String key) {
        Entry entry = entries.get(key);
        return entry == null ? 0 : entry.suppressed;
    }

    /**
     * Release a key early because its alert was resolved.
     *
     * @param key dedupe key
     * @return {@code true} if the key was known
     */
    public boolean markResolved(String key) {
        Entry entry = entries.computeIfPresent(key, (k, e) -> {
            e.resolved = true;
            return e;
        });
        return entry != null;
    }

    /**
     * Forget keys that are no longer suppressing.
     *
     * @return number of keys removed
     */
    public int purgeExpired() {
        long now = clock.millis();
        int before = entries.size();
        entries.values().removeIf(e -> e.stateAt(now) == DedupeState.EXPIRED);
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final long expiresAt;
        private final long emittedAt;
        private volatile long suppressed;
        private volatile boolean resolved;

        private Entry(long emittedAt, long expiresAt) {
            this.emittedAt = emittedAt;
            this.expiresAt = expiresAt;
        }

        private DedupeState stateAt(long now) {
            return resolved || now >= expiresAt ? DedupeState.EXPIRED : DedupeState.ACTIVE;
        }

        @Override
        public String toString() {
            return "Entry{emittedAt=" + emittedAt + ", expiresAt=" + expiresAt + ", suppressed=" + suppressed + '}';
        }
    }
}
