package com.correlationsentinel.core.rule.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the field values and condition descriptions that satisfied a
 * condition tree. Not thread-safe; one instance per evaluation.
 *
 * @since 1.0.0
 */
public final class MatchCollector {

    private final Map<String, Object> fields = new LinkedHashMap<>();
    private final List<String> descriptions = new ArrayList<>();

    void record(String field, Object value, String description) {
        fields.putIfAbsent(field, value);
        if (!descriptions.contains(description)) {
            descriptions.add(description);
        }
    }

    /**
     * Add another collector's fields and descriptions; values already
     * recorded here win.
     */
    public void absorb(MatchCollector other) {
        other.fields.forEach(fields::putIfAbsent);
        for (String description : other.descriptions) {
            if (!descriptions.contains(description)) {
                descriptions.add(description);
            }
        }
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public List<String> getDescriptions() {
        return Collections.unmodifiableList(descriptions);
    }
}
