package com.correlationsentinel.core.registry;

import com.correlationsentinel.core.config.ConditionDefinition;
import com.correlationsentinel.core.config.RuleDefinition;
import com.correlationsentinel.core.config.SequenceStepDefinition;

import java.util.ArrayList;

import java.util.List;

/**
 * Partial rule update. Only the fields that were set are applied; the rule
 * id and type cannot be changed.
 *
 * <pre>
 * registry.updateRule("brute_force_login", RulePatch.builder()
 *         .threshold(10)
 *         .enabled(false)
 *         .build());
 * </pre>
 *
 * @since 1.0.0
 */
public final class RulePatch {

    private final String name;
    private final String description;
    private final Boolean enabled;
    private final String severity;
    private final List<String> tags;
    private final String category;
    private final List<String> sources;
    private final String action;
    private final Integer baseConfidence;
    private final ConditionDefinition conditions;
    private final List<String> correlationFields;
    private final Long timeWindowMs;
    private final Integer threshold;
    private final List<SequenceStepDefinition> steps;
    private final Boolean ordered;
    private final List<String> dedupeFields;
    private final Long suppressionIntervalMs;

    private RulePatch(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.enabled = b.enabled;
        this.severity = b.severity;
        this.tags = b.tags;
        this.category = b.category;
        this.sources = b.sources;
        this.action = b.action;
        this.baseConfidence = b.baseConfidence;
        this.conditions = b.conditions;
        this.correlationFields = b.correlationFields;
        this.timeWindowMs = b.timeWindowMs;
        this.threshold = b.threshold;
        this.steps = b.steps;
        this.ordered = b.ordered;
        this.dedupeFields = b.dedupeFields;
        this.suppressionIntervalMs = b.suppressionIntervalMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param base current definition; left untouched
     * @return a patched copy of {@code base}
     */
    public RuleDefinition applyTo(RuleDefinition base) {
        RuleDefinition patched = base.copy();
        if (name != null) {
            patched.setName(name);
        }
        if (description != null) {
            patched.setDescription(description);
        }
        if (enabled != null) {
            patched.setEnabled(enabled);
        }
        if (severity != null) {
            patched.setSeverity(severity);
        }
        if (tags != null) {
            patched.setTags(tags);
        }
        if (category != null) {
            patched.setCategory(category);
        }
        if (sources != null) {
            patched.setSources(sources);
        }
        if (action != null) {
            patched.setAction(action);
        }
        if (baseConfidence != null) {
            patched.setBaseConfidence(baseConfidence);
        }
        if (conditions != null) {
            patched.setConditions(conditions.copy());
        }
        if (correlationFields != null) {
            patched.setCorrelationFields(correlationFields);
        }
        if (timeWindowMs != null) {
            patched.setTimeWindowMs(timeWindowMs);
        }
        if (threshold != null) {
            patched.setThreshold(threshold);
        }
        if (steps != null) {
            List<SequenceStepDefinition> copies = new ArrayList<>(steps.size());
            for (SequenceStepDefinition step : steps) {
                copies.add(step.copy());
            }
            patched.setSteps(copies);
        }
        if (ordered != null) {
            patched.setOrdered(ordered);
        }
        if (dedupeFields != null) {
            patched.setDedupeFields(dedupeFields);
        }
        if (suppressionIntervalMs != null) {
            patched.setSuppressionIntervalMs(suppressionIntervalMs);
        }
        return patched;
    }

    /**
     * Fluent builder for {@link RulePatch}.
     */
    public static class Builder {
        private String name;
        private String description;
        private Boolean enabled;
        private String severity;
        private List<String> tags;
        private String category;
        private List<String> sources;
        private String action;
        private Integer baseConfidence;
        private ConditionDefinition conditions;
        private List<String> correlationFields;
        private Long timeWindowMs;
        private List<SequenceStepDefinition> steps;
        private Boolean ordered;
        private Integer threshold;
        private List<String> dedupeFields;
        private Long suppressionIntervalMs;

        public Builder name(String v) {
            this.name = v;
            return this;
        }

        public Builder description(String v) {
            this.description = v;
            return this;
        }

        public Builder enabled(boolean v) {
            this.enabled = v;
            return this;
        }

        public Builder severity(String v) {
            this.severity = v;
            return this;
        }

        public Builder tags(List<String> v) {
            this.tags = v;
            return this;
        }

        public Builder category(String v) {
            this.category = v;
            return this;
        }

        public Builder sources(List<String> v) {
            this.sources = v;
            return this;
        }

        public Builder action(String v) {
            this.action = v;
            return this;
        }

        public Builder baseConfidence(int v) {
            this.baseConfidence = v;
            return this;
        }

        public Builder conditions(ConditionDefinition v) {
            this.conditions = v;
            return this;
        }

        public Builder correlationFields(List<String> v) {
            this.correlationFields = v;
            return this;
        }

        public Builder timeWindowMs(long v) {
            this.timeWindowMs = v;
            return this;
        }

        public Builder threshold(int v) {
            this.threshold = v;
            return this;
        }

        public Builder steps(List<SequenceStepDefinition> v) {
            this.steps = v;
            return this;
        }

        public Builder ordered(boolean v) {
            this.ordered = v;
            return this;
        }

        public Builder dedupeFields(List<String> v) {
            this.dedupeFields = v;
            return this;
        }

        public Builder suppressionIntervalMs(long v) {
            this.suppressionIntervalMs = v;
            return this;
        }

        public RulePatch build() {
            return new RulePatch(this);
        }
    }
}
