package com.correlationsentinel.core.config;

import com.correlationsentinel.core.model.RuleAction;
import com.correlationsentinel.core.model.Severity;
import com.correlationsentinel.core.rule.RuleType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Describes a single detection rule as it appears in configuration or
 * arrives through the rule-management API.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code single} (aliases {@code sigma}, {@code simple}) – condition tree
 * evaluated against each event on its own</li>
 * <li>{@code correlation} (alias {@code threshold}) – at least
 * {@code threshold} matching events with equal {@code correlationFields}
 * values within {@code timeWindowMs} of the first one</li>
 * <li>{@code sequence} – events with equal {@code correlationFields} values
 * (default: the event source) completing every entry of {@code steps},
 * in order unless {@code ordered} is {@code false}, within
 * {@code timeWindowMs} of the first step</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared rule type are present and valid.
 * The condition tree itself is checked by {@link RuleCompiler}.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Unique rule id used in matches, alerts and metrics. */
    private String id;

    private String name;
    private String description;

    /** Owning organization; {@code null} applies the rule to every organization. */
    private String organizationId;

    /** Rule type: "single", "correlation" or "sequence". */
    private String type = "single";

    private boolean enabled = true;
    private String severity = "medium";
    private List<String> tags = new ArrayList<>();

    /** Drives the alert title, e.g. "authentication" or "network". */
    private String category;

    /** Event {@code sourceIdentifier} values the rule listens to; empty = all. */
    private List<String> sources = new ArrayList<>();

    /** "alert" or "suppress". */
    private String action = "alert";

    /** Confidence (0–100) before contextual adjustments. */
    private int baseConfidence = 50;

    private ConditionDefinition conditions;

    // --- Correlation fields ---
    /** Event fields whose values must be equal for events to correlate. */
    private List<String> correlationFields = new ArrayList<>();

    /** Window length, measured from the first event of the window. */
    private long timeWindowMs;

    /** Minimum number of events in a window for the rule to fire. */
    private int threshold;

    // --- Sequence fields ---
    private List<SequenceStepDefinition> steps = new ArrayList<>();

    /** Whether steps must complete in the listed order. */
    private boolean ordered = true;

    // --- Deduplication ---
    /** Fields forming the dedupe key; defaults to the correlation fields. */
    private List<String> dedupeFields = new ArrayList<>();

    /** Per-rule override of the engine-wide suppression interval. */
    private Long suppressionIntervalMs;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared rule type are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = validationErrors();
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid RuleDefinition: " + String.join("; ", errors));
        }
    }

    /**
     * @return every structural problem found, empty when the definition is valid
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        String label = id != null ? id : "<unnamed>";

        RuleType ruleType = null;
        try {
            ruleType = RuleType.parse(type);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + label + "': " + e.getMessage());
        }
        try {
            Severity.parse(severity);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + label + "': " + e.getMessage());
        }
        try {
            RuleAction.parse(action);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + label + "': " + e.getMessage());
        }
        if (baseConfidence < 0 || baseConfidence > 100) {
            errors.add("Rule '" + label + "' requires 'baseConfidence' in [0, 100]");
        }
        if (ruleType == RuleType.SEQUENCE) {
            if (conditions != null) {
                errors.add("Sequence rule '" + label + "' defines its conditions per step, not in 'conditions'");
            }
        } else if (conditions == null) {
            errors.add("Rule '" + label + "' requires 'conditions'");
        }
        if (suppressionIntervalMs != null && suppressionIntervalMs <= 0) {
            errors.add("Rule '" + label + "' requires 'suppressionIntervalMs' > 0 when set");
        }

        if (ruleType == RuleType.CORRELATION) {
            if (correlationFields == null || correlationFields.isEmpty()
                    || correlationFields.stream().anyMatch(f -> f == null || f.isBlank())) {
                errors.add("Correlation rule '" + label + "' requires non-blank 'correlationFields'");
            }
            if (timeWindowMs <= 0) {
                errors.add("Correlation rule '" + label + "' requires 'timeWindowMs' > 0");
            }
            if (threshold < 1) {
                errors.add("Correlation rule '" + label + "' requires 'threshold' >= 1");
            }
        }

        if (ruleType == RuleType.SEQUENCE) {
            if (steps == null || steps.size() < 2) {
                errors.add("Sequence rule '" + label + "' requires at least two 'steps'");
            } else {
                for (int i = 0; i < steps.size(); i++) {
                    SequenceStepDefinition step = steps.get(i);
                    if (step == null || step.getConditions() == null) {
                        errors.add("Sequence rule '" + label + "' step " + i + " requires 'conditions'");
                    } else if (step.getTimeoutMs() != null && step.getTimeoutMs() <= 0) {
                        errors.add("Sequence rule '" + label + "' step " + i + " requires 'timeoutMs' > 0 when set");
                    }
                }
            }
            if (correlationFields != null && correlationFields.stream().anyMatch(f -> f == null || f.isBlank())) {
                errors.add("Sequence rule '" + label + "' has a blank correlation field");
            }
            if (timeWindowMs <= 0) {
                errors.add("Sequence rule '" + label + "' requires 'timeWindowMs' > 0");
            }
        }
        return errors;
    }

    /**
     * @return a deep copy, safe to patch without affecting this instance
     */
    public RuleDefinition copy() {
        RuleDefinition c = new RuleDefinition();
        c.id = id;
        c.name = name;
        c.description = description;
        c.organizationId = organizationId;
        c.type = type;
        c.enabled = enabled;
        c.severity = severity;
        c.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
        c.category = category;
        c.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
        c.action = action;
        c.baseConfidence = baseConfidence;
        c.conditions = conditions != null ? conditions.copy() : null;
        c.correlationFields = correlationFields != null ? new ArrayList<>(correlationFields) : new ArrayList<>();
        c.timeWindowMs = timeWindowMs;
        c.threshold = threshold;
        if (steps != null) {
            c.steps = new ArrayList<>(steps.size());
            for (SequenceStepDefinition step : steps) {
                c.steps.add(step != null ? step.copy() : null);
            }
        }
        c.ordered = ordered;
        c.dedupeFields = dedupeFields != null ? new ArrayList<>(dedupeFields) : new ArrayList<>();
        c.suppressionIntervalMs = suppressionIntervalMs;
        return c;
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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public int getBaseConfidence() {
        return baseConfidence;
    }

    public void setBaseConfidence(int baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    public ConditionDefinition getConditions() {
        return conditions;
    }

    public void setConditions(ConditionDefinition conditions) {
        this.conditions = conditions;
    }

    public List<String> getCorrelationFields() {
        return correlationFields;
    }

    public void setCorrelationFields(List<String> correlationFields) {
        this.correlationFields = correlationFields != null ? new ArrayList<>(correlationFields) : new ArrayList<>();
    }

    public long getTimeWindowMs() {
        return timeWindowMs;
    }

    public void setTimeWindowMs(long timeWindowMs) {
        this.timeWindowMs = timeWindowMs;
    }

    public int getThreshold() {
        return threshold;
    }

    public void setThreshold(int threshold) {
        this.threshold = threshold;
    }

    public List<SequenceStepDefinition> getSteps() {
        return steps;
    }

    public void setSteps(List<SequenceStepDefinition> steps) {
        this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>();
    }

    public boolean isOrdered() {
        return ordered;
    }

    public void setOrdered(boolean ordered) {
        this.ordered = ordered;
    }

    public List<String> getDedupeFields() {
        return dedupeFields;
    }

    public void setDedupeFields(List<String> dedupeFields) {
        this.dedupeFields = dedupeFields != null ? new ArrayList<>(dedupeFields) : new ArrayList<>();
    }

    public Long getSuppressionIntervalMs() {
        return suppressionIntervalMs;
    }

    public void setSuppressionIntervalMs(Long suppressionIntervalMs) {
        this.suppressionIntervalMs = suppressionIntervalMs;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleDefinition that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", enabled=" + enabled +
                ", severity='" + severity + '\'' +
                ", sources=" + sources +
                ", correlationFields=" + correlationFields +
                ", timeWindowMs=" + timeWindowMs +
                ", threshold=" + threshold +
                ", steps=" + (steps != null ? steps.size() : 0) +
                '}';
    }
}
