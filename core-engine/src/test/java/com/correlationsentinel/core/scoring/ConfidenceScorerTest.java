package com.correlationsentinel.core.scoring;

import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.model.Match;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.rule.SingleEventRule;
import com.correlationsentinel.core.rule.condition.FieldEquals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConfidenceScorer}.
 */
class ConfidenceScorerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private ConfidenceScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new ConfidenceScorer(ScoringConfig.defaults());
    }

    @Test
    @DisplayName("Single-event match should score base plus raw confidence adjustment")
    void shouldScoreSingleEventMatch() {
        Match match = match(null, 0, 1, 0.6, Map.of());

        assertThat(scorer.score(rule(50), match)).isEqualTo(52);
    }

    @Test
    @DisplayName("Window filled in half the allowed time should earn half the maximum bonus")
    void shouldAddCompressionBonus() {
        Match match = match("w-1", 4_000, 3, 0.7, Map.of());

        assertThat(scorer.compressionBonus(match)).isEqualTo(10.0);
        assertThat(scorer.score(rule(50), match)).isEqualTo(64);
    }

    @Test
    @DisplayName("Compression bonus should be capped")
    void shouldCapCompressionBonus() {
        Match match = match("w-1", 60_000, 3, 0.5, Map.of());

        assertThat(scorer.compressionBonus(match)).isEqualTo(20.0);
        assertThat(scorer.score(rule(50), match)).isEqualTo(70);
    }

    @Test
    @DisplayName("Events spread over the whole window should earn no compression bonus")
    void shouldNotRewardSpreadOutWindow() {
        Match spread = match("w-1", 2_000, 3, 0.5, Map.of());
        Match single = match(null, 0, 1, 0.5, Map.of());

        assertThat(scorer.compressionBonus(spread)).isZero();
        assertThat(scorer.compressionBonus(single)).isZero();
    }

    @Test
    @DisplayName("Threat intelligence hits on any event should add the bonus")
    void shouldAddThreatIntelBonus() {
        Match nested = match(null, 0, 1, 0.5, Map.of("threat_intel", Map.of("matched", true)));
        Match flat = match(null, 0, 1, 0.5, Map.of("threatIntelHit", "yes"));
        Match negative = match(null, 0, 1, 0.5, Map.of("threatIntelHit", false));

        assertThat(scorer.score(rule(50), nested)).isEqualTo(65);
        assertThat(scorer.score(rule(50), flat)).isEqualTo(65);
        assertThat(scorer.score(rule(50), negative)).isEqualTo(50);
    }

    @Test
    @DisplayName("Score should be clamped to the 0-100 range")
    void shouldClamp() {
        Match strong = match("w-1", 60_000, 3, 1.0, Map.of("threatIntelHit", true));
        Match weak = match(null, 0, 1, 0.0, Map.of());
        ConfidenceScorer harsh = new ConfidenceScorer(ScoringConfig.builder().rawConfidenceWeight(100).build());

        assertThat(scorer.score(rule(95), strong)).isEqualTo(100);
        assertThat(harsh.score(rule(0), weak)).isZero();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Rule rule(int baseConfidence) {
        return SingleEventRule.builder()
                .id("r")
                .conditions(new FieldEquals("outcome", "failure", true))
                .baseConfidence(baseConfidence)
                .build();
    }

    private static Match match(String windowId, long windowMs, int events, double raw,
            Map<String, Object> attributes) {
        List<EventRef> refs = new ArrayList<>();
        for (int i = 0; i < events; i++) {
            refs.add(new EventRef("e" + i, T0.plusSeconds(i), "auth_failure", Map.of(), attributes));
        }
        return Match.builder()
                .id("m")
                .ruleId("r")
                .windowId(windowId)
                .organizationId("org-1")
                .timestamp(T0)
                .eventRefs(refs)
                .threshold(events)
                .windowDurationMs(windowMs)
                .rawConfidence(raw)
                .build();
    }
}
