package com.correlationsentinel.core.registry;

import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.rule.Rule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, indexed view of the rule set at one point in time.
 *
 * <p>
 * Evaluations hold on to the snapshot they started with; rule changes publish
 * a new snapshot instead of modifying this one. Rules are indexed by the
 * event sources they listen to so candidate lookup does not scan every rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleSnapshot {

    private static final RuleSnapshot EMPTY = new RuleSnapshot(Collections.emptyList(), 0);

    private final long generation;
    private final Map<String, Rule> byId;
    private final Map<String, List<Rule>> bySource;
    private final List<Rule> anySource;

    RuleSnapshot(Collection<Rule> rules, long generation) {
        this.generation = generation;
        Map<String, Rule> ids = new LinkedHashMap<>();
        Map<String, List<Rule>> sources = new HashMap<>();
        List<Rule> wildcard = new ArrayList<>();
        for (Rule rule : rules) {
            ids.put(rule.getId(), rule);
            if (!rule.isEnabled()) {
                continue;
            }
            if (rule.getSources().isEmpty()) {
                wildcard.add(rule);
            } else {
                for (String source : rule.getSources()) {
                    sources.computeIfAbsent(source, s -> new ArrayList<>()).add(rule);
                }
            }
        }
        sources.replaceAll((source, list) -> List.copyOf(list));
        this.byId = Collections.unmodifiableMap(ids);
        this.bySource = Map.copyOf(sources);
        this.anySource = List.copyOf(wildcard);
    }

    public static RuleSnapshot empty() {
        return EMPTY;
    }

    /**
     * Rules that may fire for an event: enabled, owned by the event's
     * organization (or global), and listening to its source (or to all).
     *
     * @param event the incoming event
     * @return candidate rules; never {@code null}
     */
    public List<Rule> candidates(Event event) {
        List<Rule> bound = event.getSourceIdentifier() != null
                ? bySource.getOrDefault(event.getSourceIdentifier(), Collections.emptyList())
                : Collections.emptyList();
        if (bound.isEmpty() && anySource.isEmpty()) {
            return Collections.emptyList();
        }
        List<Rule> result = new ArrayList<>(bound.size() + anySource.size());
        for (Rule rule : bound) {
            if (rule.appliesTo(event)) {
                result.add(rule);
            }
        }
        for (Rule rule : anySource) {
            if (rule.appliesTo(event)) {
                result.add(rule);
            }
        }
        return result;
    }

    public Optional<Rule> get(String ruleId) {
        return Optional.ofNullable(byId.get(ruleId));
    }

    public Collection<Rule> rules() {
        return byId.values();
    }

    public int size() {
        return byId.size();
    }

    public long enabledCount() {
        return byId.values().stream().filter(Rule::isEnabled).count();
    }

    /** Incremented on every published change. */
    public long getGeneration() {
        return generation;
    }
}
