package com.correlationsentinel.core.config;

import com.correlationsentinel.core.rule.Rule;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - id: brute_force_login
 *     type: correlation
 *     severity: high
 *     category: authentication
 *     sources: [auth_failure]
 *     correlationFields: [user]
 *     timeWindowMs: 60000
 *     threshold: 3
 *     conditions:
 *       op: equals
 *       field: outcome
 *       value: failure
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule compiles.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<RuleDefinition> rules = new ArrayList<>();

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of rule definitions
     */
    public List<RuleDefinition> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the rule definitions
     */
    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate every rule in this configuration.
     *
     * <p>
     * Each definition is run through {@link RuleCompiler}; rule ids must be
     * unique. All errors are collected and reported in a single exception.
     * </p>
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        compileAll();
    }

    /**
     * Compile every rule in this configuration.
     *
     * @return compiled rules in declaration order
     * @throws IllegalStateException if one or more rules are invalid
     */
    public List<Rule> compile() {
        return compileAll();
    }

    private List<Rule> compileAll() {
        List<String> errors = new ArrayList<>();
        List<Rule> compiled = new ArrayList<>(rules.size());
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition definition = rules.get(i);
            if (definition == null) {
                errors.add("Rule at index " + i + " is null");
                continue;
            }
            if (definition.getId() != null && !ids.add(definition.getId())) {
                errors.add("Duplicate rule id '" + definition.getId() + "' at index " + i);
                continue;
            }
            try {
                compiled.add(RuleCompiler.compile(definition));
            } catch (InvalidRuleException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
        return compiled;
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + '}';
    }
}
