package com.correlationsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Alert emitted when a rule match survives scoring and deduplication.
 *
 * <p>
 * Handed to the configured {@code AlertSink} (and, in the Flink job,
 * serialized to JSON for the alerts topic). Every alert references exactly
 * one {@link Match}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code match}, {@code severity},
 * {@code dedupeKey} and {@code createdAt} are required; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * <h3>Status</h3>
 * <p>
 * All fields are immutable except {@link #getStatus() status}, which only the
 * incident-management side moves forward via {@link #transitionTo(AlertStatus)}.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final Match match;
    private final String ruleName;
    private final String organizationId;
    private final Severity severity;
    /** 0–100. */
    private final int confidence;
    private final String dedupeKey;
    private final String title;
    private final String description;
    private final List<String> affectedAssets;
    private final List<String> tags;
    private final Instant createdAt;

    private volatile AlertStatus status = AlertStatus.NEW;

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.match = Objects.requireNonNull(builder.match, "match must not be null");
        this.ruleName = builder.ruleName;
        this.organizationId = builder.organizationId;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        if (builder.confidence < 0 || builder.confidence > 100) {
            throw new IllegalArgumentException("confidence must be in [0, 100], got: " + builder.confidence);
        }
        this.confidence = builder.confidence;
        this.dedupeKey = Objects.requireNonNull(builder.dedupeKey, "dedupeKey must not be null");
        this.title = builder.title;
        this.description = builder.description;
        this.affectedAssets = builder.affectedAssets != null
                ? List.copyOf(builder.affectedAssets)
                : Collections.emptyList();
        this.tags = builder.tags != null ? List.copyOf(builder.tags) : Collections.emptyList();
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private Match match;
        private String ruleName;
        private String organizationId;
        private Severity severity;
        private int confidence;
        private String dedupeKey;
        private String title;
        private String description;
        private List<String> affectedAssets;
        private List<String> tags;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder match(Match match) {
            this.match = match;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(int confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder dedupeKey(String dedupeKey) {
            this.dedupeKey = dedupeKey;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder affectedAssets(List<String> affectedAssets) {
            this.affectedAssets = affectedAssets;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if {@code confidence} is outside [0, 100]
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Status transitions (incident-management side only)
    // ---------------------------------------------------------------

    /**
     * Move the alert to a new status.
     *
     * @param target the next status
     * @throws IllegalStateException if the transition is not allowed
     */
    public synchronized void transitionTo(AlertStatus target) {
        Objects.requireNonNull(target, "target status must not be null");
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Alert " + id + " cannot move from "
                    + status + " to " + target);
        }
        status = target;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getMatchId() {
        return match.getId();
    }

    public Match getMatch() {
        return match;
    }

    public String getRuleId() {
        return match.getRuleId();
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getConfidence() {
        return confidence;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public String getDedupeKey() {
        return dedupeKey;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public int getEventCount() {
        return match.getEventCount();
    }

    public List<String> getAffectedAssets() {
        return affectedAssets;
    }

    public List<String> getTags() {
        return tags;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return id.equals(alert.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", ruleId='" + getRuleId() + '\'' +
                ", severity=" + severity +
                ", confidence=" + confidence +
                ", status=" + status +
                ", dedupeKey='" + dedupeKey + '\'' +
                ", eventCount=" + getEventCount() +
                '}';
    }
}
