package com.correlationsentinel.flink;

import com.correlationsentinel.core.config.EngineConfig;
import com.correlationsentinel.core.config.RuleDefinition;
import com.correlationsentinel.core.engine.CorrelationPipeline;
import com.correlationsentinel.core.metrics.EngineMetrics;
import com.correlationsentinel.core.model.Alert;
import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.registry.RuleRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Keyed operator running the {@link CorrelationPipeline} for every event.
 *
 * <p>
 * The stream is keyed by organization, so all events of one organization (and
 * therefore every event of any one correlation window) reach the same
 * subtask in order. Each subtask owns one pipeline built in
 * {@link #open(Configuration)}; window and deduplication state live in that
 * pipeline, not in Flink managed state.
 * </p>
 *
 * <h3>Sweeps</h3>
 * <p>
 * The pipeline's {@code tick()} runs when a processing-time timer fires, at
 * most once per sweep interval. Timers are aligned to the interval so keys
 * share them.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationProcessFunction extends KeyedProcessFunction<String, Event, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CorrelationProcessFunction.class);

    /** Key used for events without an organization. */
    static final String GLOBAL_KEY = "__global__";

    private final List<RuleDefinition> rules;
    private final EngineConfig engineConfig;

    private transient CorrelationPipeline pipeline;
    private transient CorrelationMetrics metrics;
    private transient long nextTickAt;

    /**
     * @param rules        rule definitions; must not be {@code null} or empty
     * @param engineConfig engine tuning
     */
    public CorrelationProcessFunction(List<RuleDefinition> rules, EngineConfig engineConfig) {
        Objects.requireNonNull(rules, "Rule definitions must not be null");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Rule definitions must not be empty");
        }
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig must not be null");
    }

    /**
     * @param event an incoming event
     * @return the key routing the event
     */
    static String keyOf(Event event) {
        String org = event.getOrganizationId();
        return org != null && !org.isBlank() ? org : GLOBAL_KEY;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        RuleRegistry registry = new RuleRegistry();
        registry.replaceAll(rules);
        pipeline = new CorrelationPipeline(registry, engineConfig,
                new EngineMetrics(new SimpleMeterRegistry()), Clock.systemUTC());

        metrics = new CorrelationMetrics(getRuntimeContext().getMetricGroup());
        metrics.bindActiveWindows(pipeline::activeWindowCount);
        LOG.info("CorrelationProcessFunction opened with {} rule(s)", rules.size());
    }

    @Override
    public void close() {
        if (pipeline != null) {
            int discarded = pipeline.clearWindows();
            LOG.info("CorrelationProcessFunction closing, {} unmatched window(s) discarded", discarded);
        }
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(Event event,
            KeyedProcessFunction<String, Event, Alert>.Context ctx,
            Collector<Alert> out) {
        long startNanos = System.nanoTime();

        List<Alert> alerts = pipeline.process(event);
        for (Alert alert : alerts) {
            out.collect(alert);
        }

        long now = ctx.timerService().currentProcessingTime();
        long interval = engineConfig.getSweepIntervalMs();
        ctx.timerService().registerProcessingTimeTimer((now / interval + 1) * interval);

        metrics.incrementEventsProcessed();
        metrics.incrementAlertsEmitted(alerts.size());
        metrics.recordLatency((System.nanoTime() - startNanos) / 1_000_000);
    }

    @Override
    public void onTimer(long timestamp,
            KeyedProcessFunction<String, Event, Alert>.OnTimerContext ctx,
            Collector<Alert> out) {
        if (timestamp >= nextTickAt) {
            nextTickAt = timestamp + engineConfig.getSweepIntervalMs();
            pipeline.tick();
        }
    }
}
