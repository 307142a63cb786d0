package com.correlationsentinel.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer meters of the correlation engine.
 *
 * <p>
 * Counters:
 * </p>
 * <ul>
 * <li>{@code correlation.events.processed} – events taken from ingress</li>
 * <li>{@code correlation.rule.evaluations}, {@code correlation.rule.matches},
 * {@code correlation.rule.errors} – tagged with {@code rule}</li>
 * <li>{@code correlation.alerts.emitted}, {@code correlation.alerts.suppressed}
 * (tagged {@code reason=duplicate|rule}), {@code correlation.alerts.delivered},
 * {@code correlation.alerts.overflowed}, {@code correlation.alerts.dropped}</li>
 * <li>{@code correlation.windows.evicted}, {@code correlation.windows.expired},
 * {@code correlation.windows.skipped} (missing correlation field)</li>
 * </ul>
 * <p>
 * Gauges ({@code correlation.windows.active}, {@code correlation.rules.active},
 * {@code correlation.queue.pending}) are bound by the engine through
 * {@link #gauge(String, String, Supplier)}. Totals are also readable directly
 * for {@code EngineStats}.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineMetrics {

    private static final String RULE_TAG = "rule";

    private final MeterRegistry registry;

    private final Counter eventsProcessed;
    private final Counter alertsEmitted;
    private final Counter alertsDuplicate;
    private final Counter alertsSuppressedByRule;
    private final Counter alertsDelivered;
    private final Counter alertsOverflowed;
    private final Counter alertsDropped;
    private final Counter windowsEvicted;
    private final Counter windowsExpired;
    private final Counter windowsSkipped;
    private final Counter ruleErrorsTotal;
    private final Timer eventLatency;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");

        this.eventsProcessed = Counter.builder("correlation.events.processed")
                .description("Events taken from the ingress queue")
                .register(registry);

        this.alertsEmitted = Counter.builder("correlation.alerts.emitted")
                .description("Alerts handed to the emitter")
                .register(registry);

        this.alertsDuplicate = Counter.builder("correlation.alerts.suppressed")
                .description("Matches that did not produce an alert")
                .tag("reason", "duplicate")
                .register(registry);

        this.alertsSuppressedByRule = Counter.builder("correlation.alerts.suppressed")
                .description("Matches that did not produce an alert")
                .tag("reason", "rule")
                .register(registry);

        this.alertsDelivered = Counter.builder("correlation.alerts.delivered")
                .description("Alerts accepted by the sink")
                .register(registry);

        this.alertsOverflowed = Counter.builder("correlation.alerts.overflowed")
                .description("Alerts written to the overflow store after delivery failed")
                .register(registry);

        this.alertsDropped = Counter.builder("correlation.alerts.dropped")
                .description("Alerts lost after delivery failed without an overflow store")
                .register(registry);

        this.windowsEvicted = Counter.builder("correlation.windows.evicted")
                .description("Unmatched windows evicted by the per-rule capacity bound")
                .register(registry);

        this.windowsExpired = Counter.builder("correlation.windows.expired")
                .description("Windows that ended without reaching their threshold or completing their sequence")
                .register(registry);

        this.windowsSkipped = Counter.builder("correlation.windows.skipped")
                .description("Matching events ignored because a correlation field was missing")
                .register(registry);

        this.ruleErrorsTotal = Counter.builder("correlation.rule.errors.total")
                .description("Rule evaluation failures across all rules")
                .register(registry);

        this.eventLatency = Timer.builder("correlation.event.latency")
                .description("Time to evaluate one event against one rule, including scoring")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Register a gauge backed by a supplier.
     *
     * @param name        meter name
     * @param description meter description
     * @param value       current value
     */
    public void gauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value)
                .description(description)
                .register(registry);
    }

    public void recordEventProcessed() {
        eventsProcessed.increment();
    }

    public void recordEvaluation(String ruleId) {
        registry.counter("correlation.rule.evaluations", RULE_TAG, ruleId).increment();
    }

    public void recordMatch(String ruleId) {
        registry.counter("correlation.rule.matches", RULE_TAG, ruleId).increment();
    }

    public void recordRuleError(String ruleId) {
        registry.counter("correlation.rule.errors", RULE_TAG, ruleId).increment();
        ruleErrorsTotal.increment();
    }

    public void recordAlertEmitted() {
        alertsEmitted.increment();
    }

    public void recordDuplicateSuppressed() {
        alertsDuplicate.increment();
    }

    public void recordSuppressedByRule() {
        alertsSuppressedByRule.increment();
    }

    public void recordAlertDelivered() {
        alertsDelivered.increment();
    }

    public void recordAlertOverflowed() {
        alertsOverflowed.increment();
    }

    public void recordAlertDropped() {
        alertsDropped.increment();
    }

    public void recordWindowsEvicted(int count) {
        windowsEvicted.increment(count);
    }

    public void recordWindowsExpired(int count) {
        windowsExpired.increment(count);
    }

    public void recordWindowSkipped() {
        windowsSkipped.increment();
    }

    public void recordLatency(long nanos) {
        eventLatency.record(nanos, TimeUnit.NANOSECONDS);
    }

    // ---------------------------------------------------------------
    // Totals
    // ---------------------------------------------------------------

    public long eventsProcessed() {
        return (long) eventsProcessed.count();
    }

    public long alertsEmitted() {
        return (long) alertsEmitted.count();
    }

    public long alertsSuppressed() {
        return (long) (alertsDuplicate.count() + alertsSuppressedByRule.count());
    }

    public long alertsDropped() {
        return (long) alertsDropped.count();
    }

    public long ruleErrors() {
        return (long) ruleErrorsTotal.count();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
