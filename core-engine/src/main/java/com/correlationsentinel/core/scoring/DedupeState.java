package com.correlationsentinel.core.scoring;

/**
 * Lifecycle of a deduplication key.
 *
 * <pre>
 * NONE --emit--&gt; ACTIVE --interval elapsed / resolved--&gt; EXPIRED --purge or emit--&gt; NONE / ACTIVE
 * </pre>
 *
 * @since 1.0.0
 */
public enum DedupeState {
    /** No alert emitted for the key (or it was purged). */
    NONE,
    /** An unresolved alert was emitted within the suppression interval; matches are suppressed. */
    ACTIVE,
    /** The interval elapsed or the alert was resolved; the next match emits again. */
    EXPIRED
}
