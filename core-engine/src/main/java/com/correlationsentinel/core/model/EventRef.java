package com.correlationsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one event participating in a {@link Match}.
 *
 * <p>
 * Holds the field values that satisfied the rule conditions (for forensic
 * replay) and a copy of the event attributes (for enrichment-aware scoring).
 * Immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventRef implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String eventId;
    private final Instant timestamp;
    private final String sourceIdentifier;
    private final Map<String, Object> matchedFields;
    private final Map<String, Object> attributes;

    public EventRef(String eventId, Instant timestamp, String sourceIdentifier,
            Map<String, Object> matchedFields, Map<String, Object> attributes) {
        this.eventId = Objects.requireNonNull(eventId, "eventId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.sourceIdentifier = sourceIdentifier;
        this.matchedFields = matchedFields != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(matchedFields))
                : Collections.emptyMap();
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap();
    }

    /**
     * Capture an event together with the fields that matched.
     *
     * @param event         the participating event
     * @param matchedFields field values that satisfied the conditions
     * @return a new snapshot
     */
    public static EventRef of(Event event, Map<String, Object> matchedFields) {
        Objects.requireNonNull(event, "Event must not be null");
        return new EventRef(event.getId(), event.getTimestamp(), event.getSourceIdentifier(),
                matchedFields, event.getAttributes());
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSourceIdentifier() {
        return sourceIdentifier;
    }

    public Map<String, Object> getMatchedFields() {
        return matchedFields;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventRef that))
            return false;
        return eventId.equals(that.eventId) && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, timestamp);
    }

    @Override
    public String toString() {
        return "EventRef{eventId='" + eventId + "', timestamp=" + timestamp
                + ", matchedFields=" + matchedFields + '}';
    }
}
