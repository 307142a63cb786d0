package com.correlationsentinel.core.delivery;

import com.correlationsentinel.core.metrics.EngineMetrics;
import com.correlationsentinel.core.model.Alert;
import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.model.Match;
import com.correlationsentinel.core.model.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertEmitter}.
 */
class AlertEmitterTest {

    private SimpleMeterRegistry registry;
    private EngineMetrics metrics;
    private AlertEmitter emitter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EngineMetrics(registry);
    }

    @AfterEach
    void tearDown() {
        if (emitter != null) {
            emitter.close(Duration.ofSeconds(5));
        }
    }

    @Test
    @DisplayName("Should deliver queued alerts to the sink")
    void shouldDeliver() {
        List<Alert> received = new CopyOnWriteArrayList<>();
        emitter = new AlertEmitter(received::add, null, metrics, 2, 10, 3, 1, 1.5);

        emitter.emit(alert("a1"));
        emitter.emit(alert("a2"));

        assertThat(emitter.close(Duration.ofSeconds(5))).isTrue();
        assertThat(received).extracting(Alert::getId).containsExactlyInAnyOrder("a1", "a2");
        assertThat(count("correlation.alerts.delivered")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should retry a failing sink until it succeeds")
    void shouldRetryTransientFailures() {
        AtomicInteger attempts = new AtomicInteger();
        List<Alert> received = new CopyOnWriteArrayList<>();
        emitter = new AlertEmitter(alert -> {
            if (attempts.incrementAndGet() < 3) {
                throw new AlertDeliveryException("downstream unavailable");
            }
            received.add(alert);
        }, null, metrics, 1, 10, 3, 1, 1.5);

        emitter.deliver(alert("a1"));

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(received).hasSize(1);
        assertThat(count("correlation.alerts.dropped")).isZero();
    }

    @Test
    @DisplayName("Should write to the overflow store once attempts are exhausted")
    void shouldOverflowAfterExhaustedRetries() {
        AtomicInteger attempts = new AtomicInteger();
        List<Alert> overflow = new CopyOnWriteArrayList<>();
        emitter = new AlertEmitter(alert -> {
            attempts.incrementAndGet();
            throw new AlertDeliveryException("downstream unavailable");
        }, (alert, cause) -> overflow.add(alert), metrics, 1, 10, 3, 1, 1.5);

        emitter.deliver(alert("a1"));

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(overflow).extracting(Alert::getId).containsExactly("a1");
        assertThat(count("correlation.alerts.overflowed")).isEqualTo(1.0);
        assertThat(count("correlation.alerts.delivered")).isZero();
    }

    @Test
    @DisplayName("Should drop and count alerts when no overflow store is attached")
    void shouldDropWithoutOverflowStore() {
        emitter = new AlertEmitter(alert -> {
            throw new AlertDeliveryException("downstream unavailable");
        }, null, metrics, 1, 10, 2, 1, 1.5);

        emitter.deliver(alert("a1"));

        assertThat(metrics.alertsDropped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop the alert when the overflow store fails too")
    void shouldDropWhenOverflowFails() {
        emitter = new AlertEmitter(alert -> {
            throw new AlertDeliveryException("downstream unavailable");
        }, (alert, cause) -> {
            throw new IllegalStateException("disk full");
        }, metrics, 1, 10, 1, 1, 1.5);

        emitter.deliver(alert("a1"));

        assertThat(metrics.alertsDropped()).isEqualTo(1);
        assertThat(count("correlation.alerts.overflowed")).isZero();
    }

    @Test
    @DisplayName("Should reject alerts after close")
    void shouldRejectAfterClose() {
        emitter = new AlertEmitter(alert -> { }, null, metrics, 1, 10, 1, 1, 1.5);
        emitter.close(Duration.ofSeconds(1));

        assertThatThrownBy(() -> emitter.emit(alert("late")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private double count(String name) {
        return registry.get(name).counter().count();
    }

    private static Alert alert(String id) {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        Match match = Match.builder()
                .id("m-" + id)
                .ruleId("rule-1")
                .organizationId("org-1")
                .timestamp(now)
                .eventRefs(List.of(new EventRef("e-" + id, now, "auth", Map.of(), Map.of())))
                .threshold(1)
                .rawConfidence(0.6)
                .build();
        return Alert.builder()
                .id(id)
                .match(match)
                .ruleName("Rule One")
                .organizationId("org-1")
                .severity(Severity.HIGH)
                .confidence(60)
                .dedupeKey("key-" + id)
                .title("Security Alert: Rule One")
                .createdAt(now)
                .build();
    }
}
