package com.correlationsentinel.core.delivery;

import com.correlationsentinel.core.metrics.EngineMetrics;
import com.correlationsentinel.core.model.Alert;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers alerts to an {@link AlertSink} off the evaluation path.
 *
 * <p>
 * Deliveries run on a fixed pool of daemon threads fed by a bounded queue.
 * When the queue is full the submitting thread delivers the alert itself,
 * which slows evaluation down instead of losing alerts. Each delivery is
 * retried with exponential backoff; once attempts are exhausted the alert is
 * written to the {@link OverflowStore}, or dropped and counted when none is
 * attached.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEmitter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEmitter.class);

    private final AlertSink sink;
    private final OverflowStore overflowStore;
    private final EngineMetrics metrics;
    private final Retry retry;
    private final ThreadPoolExecutor executor;

    /**
     * @param sink               downstream consumer
     * @param overflowStore      fallback for exhausted deliveries; may be {@code null}
     * @param metrics            engine metrics
     * @param threads            delivery threads
     * @param queueCapacity      pending alerts before callers deliver inline
     * @param maxAttempts        delivery attempts per alert, including the first
     * @param initialBackoffMs   wait before the first retry
     * @param backoffMultiplier  growth factor of the wait between retries
     */
    public AlertEmitter(AlertSink sink, OverflowStore overflowStore, EngineMetrics metrics,
            int threads, int queueCapacity, int maxAttempts,
            long initialBackoffMs, double backoffMultiplier) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.overflowStore = overflowStore;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMs, backoffMultiplier))
                .build();
        this.retry = Retry.of("alert-delivery", config);
        this.retry.getEventPublisher()
                .onRetry(event -> LOG.warn("Alert delivery attempt {} failed, retrying in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "alert-emitter-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                (r, ex) -> {
                    if (ex.isShutdown()) {
                        throw new IllegalStateException("Alert emitter is closed");
                    }
                    r.run();
                });
    }

    /**
     * Queue an alert for delivery.
     *
     * @param alert the alert
     * @throws IllegalStateException if the emitter has been closed
     */
    public void emit(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        executor.execute(() -> deliver(alert));
    }

    /**
     * @return alerts queued and not yet picked up by a delivery thread
     */
    public int pending() {
        return executor.getQueue().size();
    }

    void deliver(Alert alert) {
        try {
            retry.executeRunnable(() -> sink.onAlert(alert));
            metrics.recordAlertDelivered();
            LOG.debug("Delivered alert {} for rule '{}'", alert.getId(), alert.getRuleId());
        } catch (RuntimeException e) {
            divert(alert, e);
        }
    }

    private void divert(Alert alert, RuntimeException cause) {
        if (overflowStore == null) {
            metrics.recordAlertDropped();
            LOG.error("Dropping alert {} for rule '{}' after {} failed delivery attempt(s)",
                    alert.getId(), alert.getRuleId(), retry.getRetryConfig().getMaxAttempts(), cause);
            return;
        }
        try {
            overflowStore.store(alert, cause);
            metrics.recordAlertOverflowed();
            LOG.warn("Alert {} for rule '{}' written to overflow store after delivery failed: {}",
                    alert.getId(), alert.getRuleId(), cause.getMessage());
        } catch (RuntimeException e) {
            metrics.recordAlertDropped();
            LOG.error("Dropping alert {}: delivery and overflow store both failed", alert.getId(), e);
        }
    }

    /**
     * Stop accepting alerts and wait for queued deliveries.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if every queued alert was handled in time
     */
    public boolean close(Duration timeout) {
        executor.shutdown();
        try {
            boolean drained = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!drained) {
                LOG.warn("Alert emitter did not drain within {}, {} alert(s) still queued",
                        timeout, executor.getQueue().size());
            }
            return drained;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while draining the alert emitter");
            return false;
        }
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(30));
    }
}
