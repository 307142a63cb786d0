package com.correlationsentinel.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EngineMetrics}.
 */
class EngineMetricsTest {

    private SimpleMeterRegistry registry;
    private EngineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EngineMetrics(registry);
    }

    @Test
    @DisplayName("Should tag per-rule counters with the rule id")
    void shouldTagPerRuleCounters() {
        metrics.recordEvaluation("brute");
        metrics.recordEvaluation("brute");
        metrics.recordEvaluation("scan");
        metrics.recordMatch("brute");
        metrics.recordRuleError("scan");

        assertThat(registry.get("correlation.rule.evaluations").tag("rule", "brute").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("correlation.rule.matches").tag("rule", "brute").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("correlation.rule.errors").tag("rule", "scan").counter().count())
                .isEqualTo(1.0);
        assertThat(metrics.ruleErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Suppressed total should combine duplicates and suppression rules")
    void shouldSplitSuppressionReasons() {
        metrics.recordDuplicateSuppressed();
        metrics.recordDuplicateSuppressed();
        metrics.recordSuppressedByRule();

        assertThat(metrics.alertsSuppressed()).isEqualTo(3);
        assertThat(registry.get("correlation.alerts.suppressed").tag("reason", "duplicate").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should record window counters, latency and gauges")
    void shouldRecordWindowsLatencyAndGauges() {
        AtomicInteger active = new AtomicInteger(7);
        metrics.gauge("correlation.windows.active", "Live windows", active::get);
        metrics.recordWindowsEvicted(3);
        metrics.recordWindowsExpired(2);
        metrics.recordWindowSkipped();
        metrics.recordLatency(TimeUnit.MILLISECONDS.toNanos(5));

        assertThat(registry.get("correlation.windows.evicted").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("correlation.windows.expired").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("correlation.windows.skipped").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("correlation.event.latency").timer().count()).isEqualTo(1);
        assertThat(registry.get("correlation.windows.active").gauge().value()).isEqualTo(7.0);
    }
}
