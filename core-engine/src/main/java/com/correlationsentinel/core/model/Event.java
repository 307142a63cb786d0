package com.correlationsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Normalized security event.
 *
 * <p>
 * The four well-known fields ({@code id}, {@code timestamp},
 * {@code organizationId}, {@code sourceIdentifier}) are typed properties;
 * everything else produced by the normalization layer is kept as a free-form
 * attribute map so rule conditions can address arbitrary fields without a
 * rigid schema.
 * </p>
 *
 * <h3>Field addressing</h3>
 * <p>
 * {@link #getField(String)} resolves the well-known names first, then the
 * attribute map. A dotted path ({@code process.parent.name}) walks nested
 * maps when no attribute with the literal dotted name exists.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Events are populated once (by the deserializer or a builder) and are
 * read concurrently by worker lanes afterwards. They must not be mutated
 * after being submitted to the engine.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String FIELD_ID = "id";
    public static final String FIELD_TIMESTAMP = "timestamp";
    public static final String FIELD_ORGANIZATION_ID = "organizationId";
    public static final String FIELD_SOURCE_IDENTIFIER = "sourceIdentifier";

    private String id;
    private Instant timestamp;
    private String organizationId;
    private String sourceIdentifier;

    /** Every other key–value pair of the normalized event. */
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public Event() {
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder, mostly used by tests and adapters.
     */
    public static class Builder {
        private final Event event = new Event();

        public Builder id(String id) {
            event.setId(id);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            event.setTimestamp(timestamp);
            return this;
        }

        public Builder organizationId(String organizationId) {
            event.setOrganizationId(organizationId);
            return this;
        }

        public Builder sourceIdentifier(String sourceIdentifier) {
            event.setSourceIdentifier(sourceIdentifier);
            return this;
        }

        public Builder attribute(String key, Object value) {
            event.setAttribute(key, value);
            return this;
        }

        public Builder attributes(Map<String, ?> values) {
            values.forEach(event::setAttribute);
            return this;
        }

        public Event build() {
            return event;
        }
    }

    // ---------------------------------------------------------------
    // Jackson dynamic-property support
    // ---------------------------------------------------------------

    /**
     * Set an attribute value. Called by Jackson for every unknown JSON property.
     *
     * @param key   the attribute name; must not be {@code null}
     * @param value the value
     * @throws NullPointerException if {@code key} is {@code null}
     */
    @JsonAnySetter
    public void setAttribute(String key, Object value) {
        Objects.requireNonNull(key, "Attribute key must not be null");
        attributes.put(key, value);
    }

    /**
     * Return an <strong>unmodifiable</strong> view of all attributes.
     *
     * @return unmodifiable map of attribute names to values
     */
    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    /**
     * Resolve a field by name or dotted path.
     *
     * @param fieldName well-known field name, attribute name or dotted path
     * @return the value, or empty when the field is absent or {@code null}
     */
    public Optional<Object> getField(String fieldName) {
        if (fieldName == null || fieldName.isEmpty()) {
            return Optional.empty();
        }
        switch (fieldName) {
            case FIELD_ID:
                return Optional.ofNullable(id);
            case FIELD_TIMESTAMP:
                return Optional.ofNullable(timestamp);
            case FIELD_ORGANIZATION_ID:
                return Optional.ofNullable(organizationId);
            case FIELD_SOURCE_IDENTIFIER:
                return Optional.ofNullable(sourceIdentifier);
            default:
                break;
        }
        if (attributes.containsKey(fieldName) || fieldName.indexOf('.') < 0) {
            return Optional.ofNullable(attributes.get(fieldName));
        }
        return resolvePath(fieldName);
    }

    /**
     * Retrieve a numeric field value, coercing common JSON number types.
     *
     * @param fieldName the field name or path
     * @return optional containing the value as a {@code double}
     */
    public Optional<Double> getNumericField(String fieldName) {
        Object raw = getField(fieldName).orElse(null);
        if (raw instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Retrieve a field value rendered as a string, see {@link #render(Object)}.
     *
     * @param fieldName the field name or path
     * @return optional containing the string value
     */
    public Optional<String> getStringField(String fieldName) {
        return getField(fieldName).map(Event::render);
    }

    /**
     * Canonical string form of a field value, shared by condition matching,
     * window keys and dedupe keys: numbers without trailing zeros
     * ({@code 5.0 -> "5"}), everything else via {@code String.valueOf}.
     *
     * @param value field value, may be {@code null}
     * @return rendered value
     */
    public static String render(Object value) {
        if (value instanceof Number n) {
            try {
                return new BigDecimal(n.toString()).stripTrailingZeros().toPlainString();
            } catch (NumberFormatException e) {
                // NaN and infinities
                return n.toString();
            }
        }
        return String.valueOf(value);
    }

    private Optional<Object> resolvePath(String path) {
        Object current = attributes;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    // ---------------------------------------------------------------
    // Ingress normalization
    // ---------------------------------------------------------------

    /**
     * Fill in the id and timestamp when the producer omitted them.
     *
     * <p>
     * The generated id is a name-based UUID over the event content, so
     * replaying the same input yields the same ids.
     * </p>
     *
     * @param now timestamp to use when the event carries none
     */
    public void normalize(Instant now) {
        if (timestamp == null) {
            timestamp = now;
        }
        if (id == null || id.isBlank()) {
            String content = organizationId + "|" + sourceIdentifier + "|"
                    + timestamp.toEpochMilli() + "|" + attributes;
            id = UUID.nameUUIDFromBytes(content.getBytes(StandardCharsets.UTF_8)).toString();
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getSourceIdentifier() {
        return sourceIdentifier;
    }

    public void setSourceIdentifier(String sourceIdentifier) {
        this.sourceIdentifier = sourceIdentifier;
    }

    /**
     * @return epoch millis of the event timestamp, {@code 0} when unset
     */
    @JsonIgnore
    public long getTimestampMillis() {
        return timestamp != null ? timestamp.toEpochMilli() : 0L;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Event that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(organizationId, that.organizationId)
                && Objects.equals(sourceIdentifier, that.sourceIdentifier)
                && Objects.equals(attributes, that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp, organizationId, sourceIdentifier, attributes);
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + id + '\'' +
                ", timestamp=" + timestamp +
                ", organizationId='" + organizationId + '\'' +
                ", sourceIdentifier='" + sourceIdentifier + '\'' +
                ", attributes=" + attributes +
                '}';
    }
}
