package com.correlationsentinel.core.registry;

import com.correlationsentinel.core.model.Severity;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.rule.RuleType;

/**
 * Criteria for {@link RuleRegistry#listRules(RuleFilter)}. Every criterion
 * left unset matches all rules.
 *
 * @since 1.0.0
 */
public final class RuleFilter {

    private static final RuleFilter ALL = builder().build();

    private final String organizationId;
    private final Boolean enabled;
    private final RuleType type;
    private final String tag;
    private final Severity severity;
    private final Boolean degraded;

    private RuleFilter(Builder b) {
        this.organizationId = b.organizationId;
        this.enabled = b.enabled;
        this.type = b.type;
        this.tag = b.tag;
        this.severity = b.severity;
        this.degraded = b.degraded;
    }

    public static RuleFilter all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * An organization criterion matches the organization's own rules and the
     * global ones.
     *
     * @param rule   candidate rule
     * @param health the rule's current health
     * @return {@code true} if the rule satisfies every set criterion
     */
    public boolean matches(Rule rule, RuleHealth health) {
        if (organizationId != null && rule.getOrganizationId() != null
                && !organizationId.equals(rule.getOrganizationId())) {
            return false;
        }
        if (enabled != null && rule.isEnabled() != enabled) {
            return false;
        }
        if (type != null && rule.getType() != type) {
            return false;
        }
        if (tag != null && !rule.getTags().contains(tag)) {
            return false;
        }
        if (severity != null && rule.getSeverity() != severity) {
            return false;
        }
        return degraded == null || health.isDegraded() == degraded;
    }

    /**
     * Fluent builder for {@link RuleFilter}.
     */
    public static class Builder {
        private String organizationId;
        private Boolean enabled;
        private RuleType type;
        private String tag;
        private Severity severity;
        private Boolean degraded;

        public Builder organizationId(String v) {
            this.organizationId = v;
            return this;
        }

        public Builder enabled(Boolean v) {
            this.enabled = v;
            return this;
        }

        public Builder type(RuleType v) {
            this.type = v;
            return this;
        }

        public Builder tag(String v) {
            this.tag = v;
            return this;
        }

        public Builder severity(Severity v) {
            this.severity = v;
            return this;
        }

        public Builder degraded(Boolean v) {
            this.degraded = v;
            return this;
        }

        public RuleFilter build() {
            return new RuleFilter(this);
        }
    }
}
