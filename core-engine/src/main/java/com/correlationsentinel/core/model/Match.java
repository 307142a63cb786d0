package com.correlationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record of a rule firing.
 *
 * <p>
 * A single-event rule produces a match for one event; a correlation rule
 * produces one match per window that reached its threshold. The event
 * references are always ordered by event timestamp ascending (ties keep
 * arrival order).
 * </p>
 *
 * @since 1.0.0
 */
public final class Match implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Comparator<EventRef> BY_TIMESTAMP = Comparator.comparing(EventRef::getTimestamp);

    private final String id;
    private final String ruleId;
    private final long ruleVersion;
    private final String windowId;
    private final String organizationId;
    private final List<String> correlationKey;
    private final Instant timestamp;
    private final List<EventRef> eventRefs;
    private final List<String> matchedConditions;
    private final int threshold;
    private final long windowDurationMs;
    private final String triggerEventId;
    private final double rawConfidence;

    private Match(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.ruleId = Objects.requireNonNull(b.ruleId, "ruleId must not be null");
        this.ruleVersion = b.ruleVersion;
        this.windowId = b.windowId;
        this.organizationId = b.organizationId;
        this.correlationKey = b.correlationKey != null
                ? List.copyOf(b.correlationKey)
                : Collections.emptyList();
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        if (b.eventRefs == null || b.eventRefs.isEmpty()) {
            throw new IllegalArgumentException("A match must reference at least one event");
        }
        List<EventRef> sorted = new ArrayList<>(b.eventRefs);
        // List.sort is stable, so equal timestamps keep arrival order
        sorted.sort(BY_TIMESTAMP);
        this.eventRefs = Collections.unmodifiableList(sorted);
        this.matchedConditions = b.matchedConditions != null
                ? List.copyOf(b.matchedConditions)
                : Collections.emptyList();
        this.threshold = b.threshold;
        if (b.windowDurationMs < 0) {
            throw new IllegalArgumentException("windowDurationMs must be >= 0, got: " + b.windowDurationMs);
        }
        this.windowDurationMs = b.windowDurationMs;
        this.triggerEventId = b.triggerEventId != null
                ? b.triggerEventId
                : eventRefs.get(eventRefs.size() - 1).getEventId();
        this.rawConfidence = b.rawConfidence;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Match}.
     */
    public static class Builder {
        private String id;
        private String ruleId;
        private long ruleVersion;
        private String windowId;
        private String organizationId;
        private List<String> correlationKey;
        private Instant timestamp;
        private List<EventRef> eventRefs;
        private List<String> matchedConditions;
        private int threshold = 1;
        private long windowDurationMs;
        private String triggerEventId;
        private double rawConfidence;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleVersion(long ruleVersion) {
            this.ruleVersion = ruleVersion;
            return this;
        }

        public Builder windowId(String windowId) {
            this.windowId = windowId;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder correlationKey(List<String> correlationKey) {
            this.correlationKey = correlationKey;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder eventRefs(List<EventRef> eventRefs) {
            this.eventRefs = eventRefs;
            return this;
        }

        public Builder matchedConditions(List<String> matchedConditions) {
            this.matchedConditions = matchedConditions;
            return this;
        }

        public Builder threshold(int threshold) {
            this.threshold = threshold;
            return this;
        }

        /** Configured length of the window; {@code 0} for single-event matches. */
        public Builder windowDurationMs(long windowDurationMs) {
            this.windowDurationMs = windowDurationMs;
            return this;
        }

        /** Event whose arrival completed the match; defaults to the latest one. */
        public Builder triggerEventId(String triggerEventId) {
            this.triggerEventId = triggerEventId;
            return this;
        }

        public Builder rawConfidence(double rawConfidence) {
            this.rawConfidence = rawConfidence;
            return this;
        }

        /**
         * @return a new {@link Match}
         * @throws NullPointerException     if id, ruleId or timestamp is missing
         * @throws IllegalArgumentException if no event references were given
         */
        public Match build() {
            return new Match(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getRuleId() {
        return ruleId;
    }

    public long getRuleVersion() {
        return ruleVersion;
    }

    /**
     * @return the window id, or {@code null} for single-event rules
     */
    public String getWindowId() {
        return windowId;
    }

    public boolean isWindowMatch() {
        return windowId != null;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public List<String> getCorrelationKey() {
        return correlationKey;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public List<EventRef> getEventRefs() {
        return eventRefs;
    }

    public int getEventCount() {
        return eventRefs.size();
    }

    public List<String> getMatchedConditions() {
        return matchedConditions;
    }

    public int getThreshold() {
        return threshold;
    }

    public long getWindowDurationMs() {
        return windowDurationMs;
    }

    public String getTriggerEventId() {
        return triggerEventId;
    }

    /**
     * @return the reference of the event that completed the match
     */
    @JsonIgnore
    public EventRef getTriggerEvent() {
        for (EventRef ref : eventRefs) {
            if (ref.getEventId().equals(triggerEventId)) {
                return ref;
            }
        }
        return eventRefs.get(eventRefs.size() - 1);
    }

    public double getRawConfidence() {
        return rawConfidence;
    }

    public Instant getFirstEventTime() {
        return eventRefs.get(0).getTimestamp();
    }

    public Instant getLastEventTime() {
        return eventRefs.get(eventRefs.size() - 1).getTimestamp();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Match match))
            return false;
        return id.equals(match.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Match{" +
                "id='" + id + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", windowId='" + windowId + '\'' +
                ", eventCount=" + eventRefs.size() +
                ", rawConfidence=" + rawConfidence +
                '}';
    }
}
