package com.correlationsentinel.core.evaluation;

import com.correlationsentinel.core.rule.condition.MatchCollector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of evaluating one rule's condition tree against one event.
 *
 * @since 1.0.0
 */
public final class EvaluationResult {

    private static final EvaluationResult NO_MATCH = new EvaluationResult(false, Collections.emptyMap(),
            Collections.emptyList());

    private final boolean matched;
    private final Map<String, Object> matchedFields;
    private final List<String> matchedConditions;

    private EvaluationResult(boolean matched, Map<String, Object> matchedFields, List<String> matchedConditions) {
        this.matched = matched;
        this.matchedFields = matchedFields;
        this.matchedConditions = matchedConditions;
    }

    static EvaluationResult noMatch() {
        return NO_MATCH;
    }

    static EvaluationResult matched(MatchCollector collector) {
        return new EvaluationResult(true, Collections.unmodifiableMap(new LinkedHashMap<>(collector.getFields())),
                List.copyOf(collector.getDescriptions()));
    }

    static EvaluationResult matched(Map<String, Object> fields, List<String> conditions) {
        return new EvaluationResult(true, Collections.unmodifiableMap(new LinkedHashMap<>(fields)),
                List.copyOf(conditions));
    }

    public boolean isMatched() {
        return matched;
    }

    /** Field values that satisfied the comparisons. */
    public Map<String, Object> getMatchedFields() {
        return matchedFields;
    }

    /** Human-readable descriptions of the satisfied comparisons. */
    public List<String> getMatchedConditions() {
        return matchedConditions;
    }
}
