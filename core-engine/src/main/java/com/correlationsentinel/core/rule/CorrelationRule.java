package com.correlationsentinel.core.rule;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Rule that fires when at least {@link #getThreshold() threshold} events
 * satisfying its conditions and sharing the same values for every
 * {@link #getCorrelationFields() correlation field} arrive within
 * {@link #getTimeWindowMs() timeWindowMs} of the first such event.
 *
 * @since 1.0.0
 */
public final class CorrelationRule extends Rule implements WindowedRule {

    private final List<String> correlationFields;
    private final long timeWindowMs;
    private final int threshold;

    private CorrelationRule(Builder b) {
        super(b);
        Objects.requireNonNull(b.correlationFields, "correlationFields must not be null for rule " + getId());
        if (b.correlationFields.isEmpty()) {
            throw new IllegalArgumentException("Correlation rule '" + getId()
                    + "' requires at least one correlation field");
        }
        if (b.timeWindowMs <= 0) {
            throw new IllegalArgumentException("timeWindowMs must be > 0 for rule '" + getId()
                    + "', got: " + b.timeWindowMs);
        }
        if (b.threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1 for rule '" + getId()
                    + "', got: " + b.threshold);
        }
        this.correlationFields = List.copyOf(b.correlationFields);
        this.timeWindowMs = b.timeWindowMs;
        this.threshold = b.threshold;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public RuleType getType() {
        return RuleType.CORRELATION;
    }

    /**
     * Correlation rules deduplicate on their correlation fields unless
     * explicit dedupe fields are configured.
     */
    @Override
    public List<String> effectiveDedupeFields() {
        return getDedupeFields().isEmpty() ? correlationFields : getDedupeFields();
    }

    @Override
    public List<String> getCorrelationFields() {
        return correlationFields;
    }

    @Override
    public long getTimeWindowMs() {
        return timeWindowMs;
    }

    public Duration getTimeWindow() {
        return Duration.ofMillis(timeWindowMs);
    }

    public int getThreshold() {
        return threshold;
    }

    /**
     * Builder for {@link CorrelationRule}.
     */
    public static final class Builder extends Rule.Builder<Builder> {
        private List<String> correlationFields;
        private long timeWindowMs;
        private int threshold;

        @Override
        protected Builder self() {
            return this;
        }

        public Builder correlationFields(List<String> correlationFields) {
            this.correlationFields = correlationFields;
            return this;
        }

        public Builder timeWindowMs(long timeWindowMs) {
            this.timeWindowMs = timeWindowMs;
            return this;
        }

        public Builder threshold(int threshold) {
            this.threshold = threshold;
            return this;
        }

        @Override
        public CorrelationRule build() {
            return new CorrelationRule(this);
        }
    }
}
