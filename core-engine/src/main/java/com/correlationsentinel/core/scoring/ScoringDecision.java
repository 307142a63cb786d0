package com.correlationsentinel.core.scoring;

import com.correlationsentinel.core.model.Alert;

import java.util.Optional;

/**
 * What {@link ScoringService} decided for one match.
 *
 * @since 1.0.0
 */
public final class ScoringDecision {

    /**
     * Disposition of the match.
     */
    public enum Disposition {
        /** An alert was built and should be delivered. */
        EMIT,
        /** An alert with the same dedupe key is still active. */
        DUPLICATE,
        /** The rule's action is {@code SUPPRESS}; the match is only counted. */
        SUPPRESSED_BY_RULE
    }

    private final Disposition disposition;
    private final int confidence;
    private final String dedupeKey;
    private final Alert alert;

    ScoringDecision(Disposition disposition, int confidence, String dedupeKey, Alert alert) {
        this.disposition = disposition;
        this.confidence = confidence;
        this.dedupeKey = dedupeKey;
        this.alert = alert;
    }

    public Disposition getDisposition() {
        return disposition;
    }

    public int getConfidence() {
        return confidence;
    }

    public String getDedupeKey() {
        return dedupeKey;
    }

    /**
     * @return the alert when the disposition is {@link Disposition#EMIT}
     */
    public Optional<Alert> getAlert() {
        return Optional.ofNullable(alert);
    }

    @Override
    public String toString() {
        return "ScoringDecision{" +
                "disposition=" + disposition +
                ", confidence=" + confidence +
                ", dedupeKey='" + dedupeKey + '\'' +
                '}';
    }
}
