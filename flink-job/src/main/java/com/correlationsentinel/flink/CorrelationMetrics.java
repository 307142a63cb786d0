package com.correlationsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Gauge;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

import java.util.function.IntSupplier;

/**
 * Flink metrics of the correlation operator.
 * <p>
 * Exposed through the cluster's metric reporters; the job only defines them.
 * </p>
 *
 * <ul>
 *   <li>{@code events_processed_total}</li>
 *   <li>{@code alerts_emitted_total}</li>
 *   <li>{@code active_windows} – live correlation windows of this subtask</li>
 *   <li>{@code processing_latency_ms} – per-event latency histogram</li>
 * </ul>
 */
public class CorrelationMetrics {

    private final Counter eventsProcessed;
    private final Counter alertsEmitted;
    private final Histogram processingLatency;
    private final MetricGroup group;

    public CorrelationMetrics(MetricGroup metricGroup) {
        this.group = metricGroup.addGroup("correlation_sentinel");
        this.eventsProcessed = group.counter("events_processed_total");
        this.alertsEmitted = group.counter("alerts_emitted_total");
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void bindActiveWindows(IntSupplier activeWindows) {
        group.gauge("active_windows", (Gauge<Integer>) activeWindows::getAsInt);
    }

    public void incrementEventsProcessed() {
        eventsProcessed.inc();
    }

    public void incrementAlertsEmitted(int count) {
        alertsEmitted.inc(count);
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
