package com.correlationsentinel.core.scoring;

import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.model.EventRef;

import java.util.Map;
import java.util.Optional;

/**
 * Field lookup on the event snapshots carried by a match. Mirrors
 * {@link Event#getField(String)}: literal key first, then a dotted path into
 * nested maps.
 */
final class EventFields {

    private EventFields() {
    }

    static Optional<Object> resolve(EventRef ref, String field) {
        if (Event.FIELD_SOURCE_IDENTIFIER.equals(field)) {
            return Optional.ofNullable(ref.getSourceIdentifier());
        }
        if (Event.FIELD_ID.equals(field)) {
            return Optional.of(ref.getEventId());
        }
        Object matched = ref.getMatchedFields().get(field);
        if (matched != null) {
            return Optional.of(matched);
        }
        Map<String, Object> attributes = ref.getAttributes();
        if (attributes.containsKey(field) || field.indexOf('.') < 0) {
            return Optional.ofNullable(attributes.get(field));
        }
        Object current = attributes;
        for (String segment : field.split("\\.")) {
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

    static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return s.equalsIgnoreCase("true") || s.equalsIgnoreCase("yes") || s.equals("1");
        }
        return false;
    }
}
