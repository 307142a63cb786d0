package com.correlationsentinel.core.scoring;

import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.model.Match;
import com.correlationsentinel.core.rule.Rule;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes the 0–100 confidence of an alert.
 *
 * <pre>
 * confidence = baseConfidence
 *            + min((timeWindow / span - 1) * compressionWeight, maxCompressionBonus)   // window matches
 *            + threatIntelBonus                                                      // any enriched hit
 *            + (rawConfidence - 0.5) * rawConfidenceWeight
 * </pre>
 *
 * <p>
 * The result is clamped to [0, 100] and rounded.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfidenceScorer {

    private final ScoringConfig config;

    public ConfidenceScorer(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * @param rule  the rule that produced the match
     * @param match the match to score
     * @return confidence in [0, 100]
     */
    public int score(Rule rule, Match match) {
        double score = rule.getBaseConfidence();
        score += compressionBonus(match);
        if (hasThreatIntelHit(match)) {
            score += config.getThreatIntelBonus();
        }
        score += (match.getRawConfidence() - 0.5) * config.getRawConfidenceWeight();
        return (int) Math.round(Math.max(0, Math.min(100, score)));
    }

    /**
     * Bonus for windows that reached their threshold in a fraction of the
     * allowed time. {@code span} is the time between the first and the last
     * participating event, at least 1 ms; a span of the full window or more
     * earns nothing.
     */
    double compressionBonus(Match match) {
        if (!match.isWindowMatch() || match.getWindowDurationMs() <= 0) {
            return 0;
        }
        long span = Duration.between(match.getFirstEventTime(), match.getLastEventTime()).toMillis();
        double compression = (double) match.getWindowDurationMs() / Math.max(span, 1L);
        return Math.max(0, Math.min((compression - 1) * config.getCompressionWeight(),
                config.getMaxCompressionBonus()));
    }

    boolean hasThreatIntelHit(Match match) {
        for (EventRef ref : match.getEventRefs()) {
            for (String field : config.getThreatIntelFields()) {
                if (EventFields.resolve(ref, field).map(EventFields::isTruthy).orElse(false)) {
                    return true;
                }
            }
        }
        return false;
    }
}
