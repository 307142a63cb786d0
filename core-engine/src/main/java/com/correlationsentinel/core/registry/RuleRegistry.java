package com.correlationsentinel.core.registry;

import com.correlationsentinel.core.config.RuleCompiler;
import com.correlationsentinel.core.config.RuleDefinition;
import com.correlationsentinel.core.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Owner of the active rule set.
 *
 * <h3>Copy-on-write</h3>
 * <p>
 * Readers call {@link #snapshot()} and get an immutable {@link RuleSnapshot};
 * writers compile the new rule, build a new snapshot and publish it with one
 * atomic reference swap. Mutations are serialized among themselves, reads
 * never block. A change applies to events evaluated after it is published.
 * </p>
 *
 * <h3>Health</h3>
 * <p>
 * Rules that throw during evaluation are {@linkplain #markDegraded marked
 * degraded}. Degraded rules stay active; the flag surfaces in
 * {@link #health(String)} and {@link RuleFilter}. Updating a rule resets
 * its health.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RuleRegistry.class);

    private final AtomicReference<RuleSnapshot> current = new AtomicReference<>(RuleSnapshot.empty());
    private final Map<String, RuleHealth> health = new ConcurrentHashMap<>();
    private final Clock clock;

    public RuleRegistry() {
        this(Clock.systemUTC());
    }

    public RuleRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // Mutations
    // ---------------------------------------------------------------

    /**
     * Replace the whole rule set, e.g. at start-up.
     *
     * @param definitions rule definitions
     * @throws com.correlationsentinel.core.config.InvalidRuleException if one
     *         of them does not compile; the current set is kept
     * @throws IllegalStateException if two definitions share an id
     */
    public synchronized void replaceAll(Collection<RuleDefinition> definitions) {
        Map<String, Rule> compiled = new LinkedHashMap<>();
        for (RuleDefinition definition : definitions) {
            Rule rule = RuleCompiler.compile(definition);
            if (compiled.putIfAbsent(rule.getId(), rule) != null) {
                throw new IllegalStateException("Duplicate rule id '" + rule.getId() + "'");
            }
        }
        health.clear();
        publish(compiled.values());
        LOG.info("Rule set replaced: {} rule(s)", compiled.size());
    }

    /**
     * Compile and activate a new rule.
     *
     * @param definition the rule definition
     * @return the compiled rule (version 1)
     * @throws com.correlationsentinel.core.config.InvalidRuleException if the definition is malformed
     * @throws IllegalStateException if a rule with the same id exists
     */
    public synchronized Rule createRule(RuleDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        Rule rule = RuleCompiler.compile(definition);
        RuleSnapshot snapshot = current.get();
        if (snapshot.get(rule.getId()).isPresent()) {
            throw new IllegalStateException("Rule '" + rule.getId() + "' already exists");
        }
        List<Rule> rules = new ArrayList<>(snapshot.rules());
        rules.add(rule);
        health.remove(rule.getId());
        publish(rules);
        LOG.info("Created rule '{}' ({})", rule.getId(), rule.getType());
        return rule;
    }

    /**
     * Apply a partial update. Produces a new rule instance with the version
     * incremented; windows opened under the old version keep their threshold
     * and end time.
     *
     * @param ruleId id of the rule to update
     * @param patch  fields to change
     * @return the new rule instance
     * @throws NoSuchElementException if no rule has that id
     * @throws com.correlationsentinel.core.config.InvalidRuleException if the patched definition is malformed
     */
    public synchronized Rule updateRule(String ruleId, RulePatch patch) {
        Objects.requireNonNull(patch, "patch must not be null");
        RuleSnapshot snapshot = current.get();
        Rule existing = snapshot.get(ruleId)
                .orElseThrow(() -> new NoSuchElementException("Rule '" + ruleId + "' does not exist"));
        RuleDefinition base = existing.getDefinition();
        if (base == null) {
            throw new IllegalStateException("Rule '" + ruleId + "' has no definition to patch");
        }
        Rule updated = RuleCompiler.compile(patch.applyTo(base), existing.getVersion() + 1);

        List<Rule> rules = new ArrayList<>(snapshot.size());
        for (Rule rule : snapshot.rules()) {
            rules.add(rule.getId().equals(ruleId) ? updated : rule);
        }
        health.remove(ruleId);
        publish(rules);
        LOG.info("Updated rule '{}' to version {}", ruleId, updated.getVersion());
        return updated;
    }

    /**
     * Remove a rule.
     *
     * @param ruleId id of the rule to remove
     * @return {@code true} if the rule existed
     */
    public synchronized boolean deleteRule(String ruleId) {
        RuleSnapshot snapshot = current.get();
        if (snapshot.get(ruleId).isEmpty()) {
            LOG.debug("Delete of unknown rule '{}' ignored", ruleId);
            return false;
        }
        List<Rule> rules = snapshot.rules().stream()
                .filter(rule -> !rule.getId().equals(ruleId))
                .collect(Collectors.toList());
        health.remove(ruleId);
        publish(rules);
        LOG.info("Deleted rule '{}'", ruleId);
        return true;
    }

    private void publish(Collection<Rule> rules) {
        RuleSnapshot previous = current.get();
        current.set(new RuleSnapshot(rules, previous.getGeneration() + 1));
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return the currently published rule set
     */
    public RuleSnapshot snapshot() {
        return current.get();
    }

    public Optional<Rule> getRule(String ruleId) {
        return current.get().get(ruleId);
    }

    /**
     * @param filter selection criteria
     * @return matching rules in creation order
     */
    public List<Rule> listRules(RuleFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return current.get().rules().stream()
                .filter(rule -> filter.matches(rule, health(rule.getId())))
                .collect(Collectors.toList());
    }

    /**
     * @return definitions of every rule, for persisting the rule set
     */
    public List<RuleDefinition> definitions() {
        List<RuleDefinition> result = new ArrayList<>();
        for (Rule rule : current.get().rules()) {
            RuleDefinition definition = rule.getDefinition();
            if (definition != null) {
                result.add(definition);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------

    /**
     * Record an evaluation failure of a rule.
     *
     * @param ruleId the failing rule
     * @param cause  the failure
     */
    public void markDegraded(String ruleId, Throwable cause) {
        String message = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        RuleHealth updated = health.compute(ruleId,
                (id, h) -> (h != null ? h : RuleHealth.healthy()).withError(message, clock.instant()));
        if (updated.getErrorCount() == 1) {
            LOG.warn("Rule '{}' marked degraded: {}", ruleId, message);
        }
    }

    public RuleHealth health(String ruleId) {
        return health.getOrDefault(ruleId, RuleHealth.healthy());
    }
}
