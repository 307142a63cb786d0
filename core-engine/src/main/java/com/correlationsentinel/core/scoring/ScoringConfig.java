package com.correlationsentinel.core.scoring;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Weights of the confidence formula applied by {@link ConfidenceScorer}.
 *
 * @since 1.0.0
 */
public final class ScoringConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Attributes that mark an event as matching threat intelligence. */
    public static final List<String> DEFAULT_THREAT_INTEL_FIELDS = List.of("threat_intel.matched", "threatIntelHit");

    private final double compressionWeight;
    private final double maxCompressionBonus;
    private final double threatIntelBonus;
    private final double rawConfidenceWeight;
    private final List<String> threatIntelFields;

    private ScoringConfig(Builder b) {
        this.compressionWeight = b.compressionWeight;
        this.maxCompressionBonus = b.maxCompressionBonus;
        this.threatIntelBonus = b.threatIntelBonus;
        this.rawConfidenceWeight = b.rawConfidenceWeight;
        this.threatIntelFields = List.copyOf(b.threatIntelFields);
    }

    public static ScoringConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Points per unit of {@code timeWindow / span} above 1. */
    public double getCompressionWeight() {
        return compressionWeight;
    }

    public double getMaxCompressionBonus() {
        return maxCompressionBonus;
    }

    public double getThreatIntelBonus() {
        return threatIntelBonus;
    }

    /** Points per unit of raw match confidence above 0.5. */
    public double getRawConfidenceWeight() {
        return rawConfidenceWeight;
    }

    public List<String> getThreatIntelFields() {
        return threatIntelFields;
    }

    /**
     * Fluent builder for {@link ScoringConfig}.
     */
    public static class Builder {
        private double compressionWeight = 10;
        private double maxCompressionBonus = 20;
        private double threatIntelBonus = 15;
        private double rawConfidenceWeight = 20;
        private List<String> threatIntelFields = DEFAULT_THREAT_INTEL_FIELDS;

        public Builder compressionWeight(double v) {
            this.compressionWeight = v;
            return this;
        }

        public Builder maxCompressionBonus(double v) {
            this.maxCompressionBonus = v;
            return this;
        }

        public Builder threatIntelBonus(double v) {
            this.threatIntelBonus = v;
            return this;
        }

        public Builder rawConfidenceWeight(double v) {
            this.rawConfidenceWeight = v;
            return this;
        }

        public Builder threatIntelFields(List<String> v) {
            this.threatIntelFields = v;
            return this;
        }

        /**
         * @return a validated {@link ScoringConfig}
         * @throws IllegalArgumentException if a weight is negative
         */
        public ScoringConfig build() {
            Objects.requireNonNull(threatIntelFields, "threatIntelFields required");
            if (compressionWeight < 0 || maxCompressionBonus < 0 || threatIntelBonus < 0 || rawConfidenceWeight < 0) {
                throw new IllegalArgumentException("scoring weights must be >= 0");
            }
            return new ScoringConfig(this);
        }
    }

    @Override
    public String toString() {
        return "ScoringConfig{" +
                "compressionWeight=" + compressionWeight +
                ", maxCompressionBonus=" + maxCompressionBonus +
                ", threatIntelBonus=" + threatIntelBonus +
                ", rawConfidenceWeight=" + rawConfidenceWeight +
                ", threatIntelFields=" + threatIntelFields +
                '}';
    }
}
