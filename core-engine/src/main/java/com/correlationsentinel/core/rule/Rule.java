package com.correlationsentinel.core.rule;

import com.correlationsentinel.core.config.RuleDefinition;
import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.model.RuleAction;
import com.correlationsentinel.core.model.Severity;
import com.correlationsentinel.core.rule.condition.Condition;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compiled, immutable detection rule.
 *
 * <p>
 * Instances are produced by {@code RuleCompiler} from a {@link RuleDefinition}
 * and published to evaluators through an immutable rule snapshot. Updating a
 * rule creates a new instance with a higher {@link #getVersion() version};
 * evaluations already running keep the instance they started with.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class Rule {

    private final String id;
    private final String name;
    private final String description;
    private final String organizationId;
    private final boolean enabled;
    private final Severity severity;
    private final List<String> tags;
    private final String category;
    private final Set<String> sources;
    private final Condition conditions;
    private final RuleAction action;
    private final int baseConfidence;
    private final List<String> dedupeFields;
    private final Duration suppressionInterval;
    private final long version;
    private final RuleDefinition definition;

    protected Rule(Builder<?> b) {
        this.id = requireText(b.id, "id");
        this.name = b.name != null ? b.name : b.id;
        this.description = b.description;
        this.organizationId = b.organizationId;
        this.enabled = b.enabled;
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.tags = b.tags != null ? List.copyOf(b.tags) : Collections.emptyList();
        this.category = b.category;
        this.sources = b.sources != null ? Set.copyOf(b.sources) : Collections.emptySet();
        this.conditions = Objects.requireNonNull(b.conditions, "conditions must not be null for rule " + b.id);
        this.action = Objects.requireNonNull(b.action, "action must not be null");
        if (b.baseConfidence < 0 || b.baseConfidence > 100) {
            throw new IllegalArgumentException("baseConfidence must be in [0, 100] for rule '"
                    + b.id + "', got: " + b.baseConfidence);
        }
        this.baseConfidence = b.baseConfidence;
        this.dedupeFields = b.dedupeFields != null ? List.copyOf(b.dedupeFields) : Collections.emptyList();
        if (b.suppressionInterval != null && (b.suppressionInterval.isNegative() || b.suppressionInterval.isZero())) {
            throw new IllegalArgumentException("suppressionInterval must be positive for rule '" + b.id + "'");
        }
        this.suppressionInterval = b.suppressionInterval;
        this.version = b.version;
        this.definition = b.definition;
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    /**
     * @return which variant this rule is
     */
    public abstract RuleType getType();

    /**
     * Coarse pre-filter applied before any condition is evaluated.
     *
     * @param event the incoming event
     * @return {@code true} if the rule is enabled, belongs to the event's
     *         organization (or is global) and lists the event's source (or
     *         lists none)
     */
    public boolean appliesTo(Event event) {
        if (!enabled) {
            return false;
        }
        if (organizationId != null && !organizationId.equals(event.getOrganizationId())) {
            return false;
        }
        return sources.isEmpty() || sources.contains(event.getSourceIdentifier());
    }

    /**
     * @return the fields whose values distinguish one alert from another for
     *         deduplication purposes
     */
    public List<String> effectiveDedupeFields() {
        return dedupeFields;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return owning organization, or {@code null} for a rule applying to all
     */
    public String getOrganizationId() {
        return organizationId;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Severity getSeverity() {
        return severity;
    }

    public List<String> getTags() {
        return tags;
    }

    public String getCategory() {
        return category;
    }

    public Set<String> getSources() {
        return sources;
    }

    public Condition getConditions() {
        return conditions;
    }

    public RuleAction getAction() {
        return action;
    }

    public int getBaseConfidence() {
        return baseConfidence;
    }

    public List<String> getDedupeFields() {
        return dedupeFields;
    }

    public Optional<Duration> getSuppressionInterval() {
        return Optional.ofNullable(suppressionInterval);
    }

    public long getVersion() {
        return version;
    }

    /**
     * @return a copy of the definition this rule was compiled from, or
     *         {@code null} when built programmatically
     */
    public RuleDefinition getDefinition() {
        return definition != null ? definition.copy() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Rule rule))
            return false;
        return id.equals(rule.id) && version == rule.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "id='" + id + '\'' +
                ", version=" + version +
                ", enabled=" + enabled +
                ", severity=" + severity +
                ", conditions=" + conditions.describe() +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Shared builder state of both rule variants.
     *
     * @param <B> concrete builder type
     */
    public abstract static class Builder<B extends Builder<B>> {
        private String id;
        private String name;
        private String description;
        private String organizationId;
        private boolean enabled = true;
        private Severity severity = Severity.MEDIUM;
        private List<String> tags;
        private String category;
        private Set<String> sources;
        private Condition conditions;
        private RuleAction action = RuleAction.ALERT;
        private int baseConfidence = 50;
        private List<String> dedupeFields;
        private Duration suppressionInterval;
        private long version = 1;
        private RuleDefinition definition;

        protected abstract B self();

        public abstract Rule build();

        public B id(String id) {
            this.id = id;
            return self();
        }

        public B name(String name) {
            this.name = name;
            return self();
        }

        public B description(String description) {
            this.description = description;
            return self();
        }

        public B organizationId(String organizationId) {
            this.organizationId = organizationId;
            return self();
        }

        public B enabled(boolean enabled) {
            this.enabled = enabled;
            return self();
        }

        public B severity(Severity severity) {
            this.severity = severity;
            return self();
        }

        public B tags(List<String> tags) {
            this.tags = tags;
            return self();
        }

        public B category(String category) {
            this.category = category;
            return self();
        }

        public B sources(Set<String> sources) {
            this.sources = sources;
            return self();
        }

        public B conditions(Condition conditions) {
            this.conditions = conditions;
            return self();
        }

        public B action(RuleAction action) {
            this.action = action;
            return self();
        }

        public B baseConfidence(int baseConfidence) {
            this.baseConfidence = baseConfidence;
            return self();
        }

        public B dedupeFields(List<String> dedupeFields) {
            this.dedupeFields = dedupeFields;
            return self();
        }

        public B suppressionInterval(Duration suppressionInterval) {
            this.suppressionInterval = suppressionInterval;
            return self();
        }

        public B version(long version) {
            this.version = version;
            return self();
        }

        public B definition(RuleDefinition definition) {
            this.definition = definition != null ? definition.copy() : null;
            return self();
        }
    }
}
