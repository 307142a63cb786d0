package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.MutableClock;
import com.correlationsentinel.core.config.EngineConfig;
import com.correlationsentinel.core.config.RulesLoader;
import com.correlationsentinel.core.metrics.EngineMetrics;
import com.correlationsentinel.core.model.Alert;
import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.registry.RulePatch;
import com.correlationsentinel.core.registry.RuleRegistry;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.rule.SingleEventRule;
import com.correlationsentinel.core.rule.condition.Condition;
import com.correlationsentinel.core.rule.condition.MatchCollector;
import com.correlationsentinel.core.window.SweepResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CorrelationPipeline}.
 */
class CorrelationPipelineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private RuleRegistry registry;
    private EngineMetrics metrics;
    private CorrelationPipeline pipeline;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        registry = new RuleRegistry(clock);
        registry.replaceAll(RulesLoader.fromClasspath("test-rules.yml").getRules());
        metrics = new EngineMetrics(new SimpleMeterRegistry());
        pipeline = new CorrelationPipeline(registry, EngineConfig.defaults(), metrics, clock);
    }

    @Test
    @DisplayName("Three failed logins within a minute should raise exactly one alert")
    void shouldAlertOnBruteForce() {
        assertThat(pipeline.process(failure("e1", "alice", 0))).isEmpty();
        assertThat(pipeline.process(failure("e2", "alice", 10))).isEmpty();

        List<Alert> alerts = pipeline.process(failure("e3", "alice", 30));

        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertThat(alert.getRuleId()).isEqualTo("failed-logins");
        assertThat(alert.getEventCount()).isEqualTo(3);
        assertThat(alert.getTitle()).isEqualTo("Authentication Alert: Failed Logins");
        assertThat(alert.getMatch().getCorrelationKey()).containsExactly("alice");
        assertThat(metrics.alertsEmitted()).isEqualTo(1);
        assertThat(metrics.eventsProcessed()).isEqualTo(3);
    }

    @Test
    @DisplayName("Confidence should reward a window that filled in half its allowed time")
    void shouldScoreCompressedWindow() {
        pipeline.process(failure("e1", "alice", 0));
        pipeline.process(failure("e2", "alice", 10));

        Alert alert = pipeline.process(failure("e3", "alice", 30)).get(0);

        // base 50 + compression (60s / 30s - 1) * 10 + raw (0.7 - 0.5) * 20
        assertThat(alert.getMatch().getWindowDurationMs()).isEqualTo(60_000L);
        assertThat(alert.getConfidence()).isEqualTo(64);
        assertThat(alert.getDescription()).contains("- Event ID: e3\n");
    }

    @Test
    @DisplayName("Raising a threshold should leave live windows on their original threshold")
    void shouldKeepLiveWindowThresholdOnUpdate() {
        pipeline.process(failure("a0", "alice", 0));
        pipeline.process(failure("a1", "alice", 10));

        Rule updated = registry.updateRule("failed-logins", RulePatch.builder().threshold(10).build());

        assertThat(updated.getVersion()).isEqualTo(2);
        assertThat(pipeline.process(failure("a2", "alice", 20)))
                .extracting(Alert::getRuleId).containsExactly("failed-logins");

        int alerts = 0;
        for (int i = 0; i < 9; i++) {
            alerts += pipeline.process(failure("b" + i, "bob", 20 + i)).size();
        }
        assertThat(alerts).isZero();
        assertThat(pipeline.process(failure("b9", "bob", 29))).hasSize(1);
    }

    @Test
    @DisplayName("An event after the window end should start a new window instead of alerting")
    void shouldStartNewWindowAfterEnd() {
        pipeline.process(failure("e1", "alice", 0));
        pipeline.process(failure("e2", "alice", 10));

        List<Alert> alerts = pipeline.process(failure("e3", "alice", 70));

        assertThat(alerts).isEmpty();
        assertThat(pipeline.activeWindowCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A second window for the same user should be suppressed as duplicate")
    void shouldSuppressDuplicateAcrossWindows() {
        for (int i = 0; i < 3; i++) {
            pipeline.process(failure("a" + i, "alice", i));
        }
        int duplicates = 0;
        for (int i = 0; i < 3; i++) {
            duplicates += pipeline.process(failure("b" + i, "alice", 100 + i)).size();
        }

        assertThat(duplicates).isZero();
        assertThat(metrics.alertsEmitted()).isEqualTo(1);
        assertThat(metrics.alertsSuppressed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Resolving the alert should let the next window alert again")
    void shouldAlertAgainAfterResolve() {
        Alert first = null;
        for (int i = 0; i < 3; i++) {
            List<Alert> alerts = pipeline.process(failure("a" + i, "alice", i));
            if (!alerts.isEmpty()) {
                first = alerts.get(0);
            }
        }
        assertThat(first).isNotNull();

        assertThat(pipeline.alertResolved(first.getDedupeKey())).isTrue();
        int alerts = 0;
        for (int i = 0; i < 3; i++) {
            alerts += pipeline.process(failure("b" + i, "alice", 100 + i)).size();
        }

        assertThat(alerts).isEqualTo(1);
    }

    @Test
    @DisplayName("Events from other sources should not feed source-bound rules")
    void shouldRespectSources() {
        for (int i = 0; i < 3; i++) {
            Event event = failure("d" + i, "alice", i);
            event.setSourceIdentifier("dns");
            assertThat(pipeline.process(event)).isEmpty();
        }
        assertThat(pipeline.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("Single-event rule should alert immediately")
    void shouldAlertOnSingleEventRule() {
        List<Alert> alerts = pipeline.process(failure("e1", "root", 0));

        assertThat(alerts).extracting(Alert::getRuleId).containsExactly("admin-login");
    }

    @Test
    @DisplayName("A failing rule should be isolated, counted and marked degraded")
    void shouldIsolateFailingRule() {
        Rule broken = SingleEventRule.builder()
                .id("broken")
                .conditions(new ExplodingCondition())
                .build();
        Event event = failure("e1", "root", 0);
        event.normalize(clock.instant());

        assertThat(pipeline.evaluate(broken, event)).isEmpty();

        assertThat(metrics.ruleErrors()).isEqualTo(1);
        assertThat(registry.health("broken").isDegraded()).isTrue();
        assertThat(registry.health("broken").getLastError()).contains("evaluation failed");
        assertThat(pipeline.process(failure("e2", "admin", 1))).hasSize(1);
    }

    @Test
    @DisplayName("Tick should expire unmatched windows and finalize matched ones")
    void shouldTick() {
        for (int i = 0; i < 3; i++) {
            pipeline.process(failure("a" + i, "alice", i));
        }
        pipeline.process(failure("b0", "bob", 0));
        clock.advance(Duration.ofMinutes(2));

        SweepResult result = pipeline.tick();

        assertThat(result.getExpired()).isEqualTo(1);
        assertThat(result.getFinalized()).isEqualTo(1);
        assertThat(pipeline.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("Deleting a rule should drop its windows")
    void shouldDiscardWindowsOfRule() {
        pipeline.process(failure("a0", "alice", 0));
        pipeline.process(failure("b0", "bob", 0));

        assertThat(pipeline.discardRule("failed-logins")).isEqualTo(2);
        assertThat(pipeline.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("Completing a sequence should raise one alert and restart tracking")
    void shouldAlertOnCompletedSequence() {
        registry.replaceAll(RulesLoader.fromClasspath("sequence-rules.yml").getRules());

        assertThat(pipeline.process(vpn("v1", "sudo", 0))).isEmpty();
        assertThat(pipeline.process(vpn("v2", "login", 10))).isEmpty();
        List<Alert> alerts = pipeline.process(vpn("v3", "sudo", 40));

        assertThat(alerts).hasSize(1);
        Alert alert = alerts.get(0);
        assertThat(alert.getRuleId()).isEqualTo("login-sudo");
        assertThat(alert.getMatch().getEventRefs()).extracting(EventRef::getEventId).containsExactly("v2", "v3");
        assertThat(alert.getMatch().getCorrelationKey()).containsExactly("vpn");
        assertThat(alert.getMatch().getMatchedConditions()).contains("Sequence completed: login -> sudo");
        assertThat(pipeline.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("A sequence step arriving after its predecessor timed out should not alert")
    void shouldNotAlertOnTimedOutSequence() {
        registry.replaceAll(RulesLoader.fromClasspath("sequence-rules.yml").getRules());

        pipeline.process(vpn("v1", "login", 0));

        assertThat(pipeline.process(vpn("v2", "sudo", 121))).isEmpty();
        assertThat(metrics.getRegistry().get("correlation.windows.expired").counter().count()).isEqualTo(1.0);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Event failure(String id, String user, int offsetSeconds) {
        return Event.builder()
                .id(id)
                .timestamp(T0.plusSeconds(offsetSeconds))
                .organizationId("org-1")
                .sourceIdentifier("auth_failure")
                .attribute("user", user)
                .attribute("outcome", "failure")
                .build();
    }

    private static Event vpn(String id, String action, int offsetSeconds) {
        return Event.builder()
                .id(id)
                .timestamp(T0.plusSeconds(offsetSeconds))
                .organizationId("org-1")
                .sourceIdentifier("vpn")
                .attribute("action", action)
                .build();
    }

    private static final class ExplodingCondition implements Condition {

        @Override
        public boolean evaluate(Event event, MatchCollector collector) {
            throw new IllegalStateException("exploded");
        }

        @Override
        public String describe() {
            return "explodes";
        }

        @Override
        public Set<String> referencedFields() {
            return Set.of();
        }
    }
}
