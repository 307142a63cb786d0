package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.config.EngineConfig;
import com.correlationsentinel.core.config.RuleDefinition;
import com.correlationsentinel.core.delivery.AlertEmitter;
import com.correlationsentinel.core.delivery.AlertSink;
import com.correlationsentinel.core.delivery.OverflowStore;
import com.correlationsentinel.core.metrics.EngineMetrics;
import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.registry.RuleFilter;
import com.correlationsentinel.core.registry.RulePatch;
import com.correlationsentinel.core.registry.RuleRegistry;
import com.correlationsentinel.core.rule.Rule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Standalone correlation engine: bounded ingress queue, one dispatching
 * ingress thread, a pool of worker lanes running the
 * {@link CorrelationPipeline}, an asynchronous {@link AlertEmitter} and a
 * periodic window sweep.
 *
 * <h3>Lifecycle</h3>
 * <ol>
 * <li>{@link #start()} loads rules from the {@link RuleStore} (if attached;
 * failure is fatal) and starts all threads.</li>
 * <li>{@link #submit(Event)} / {@link #offer(Event, Duration)} feed events.
 * Both block while the ingress queue is full.</li>
 * <li>{@link #shutdown()} stops intake, drains ingress, lanes and emitter,
 * saves rules and discards unmatched windows.</li>
 * </ol>
 *
 * <h3>Threads</h3>
 * <ul>
 * <li>{@code correlation-ingress} – normalizes and dispatches events</li>
 * <li>{@code correlation-worker-N} – one per lane</li>
 * <li>{@code alert-emitter-N} – alert delivery</li>
 * <li>{@code correlation-sweeper} – window expiry and purges</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class CorrelationEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationEngine.class);

    private static final long INGRESS_POLL_MS = 100;

    enum State {
        NEW, RUNNING, STOPPING, STOPPED
    }

    private final EngineConfig config;
    private final Clock clock;
    private final RuleStore ruleStore;
    private final EngineMetrics metrics;
    private final RuleRegistry registry;
    private final CorrelationPipeline pipeline;
    private final AlertEmitter emitter;
    private final WorkerPool workers;
    private final Dispatcher dispatcher;
    private final BlockingQueue<Event> ingress;
    private final Thread ingressThread;
    private final ScheduledExecutorService sweeper;
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);

    private CorrelationEngine(Builder b) {
        this.config = b.config;
        this.clock = b.clock;
        this.ruleStore = b.ruleStore;
        this.metrics = new EngineMetrics(b.meterRegistry);
        this.registry = new RuleRegistry(clock);
        if (!b.rules.isEmpty()) {
            registry.replaceAll(b.rules);
        }
        this.pipeline = new CorrelationPipeline(registry, config, metrics, clock);
        this.emitter = new AlertEmitter(b.sink, b.overflowStore, metrics,
                config.getEmitterThreads(), config.getEmitterQueueCapacity(),
                config.getDeliveryMaxAttempts(), config.getDeliveryInitialBackoffMs(),
                config.getDeliveryBackoffMultiplier());
        this.workers = new WorkerPool(config.getWorkerThreads(), config.getLaneQueueCapacity(),
                "correlation-worker");
        this.dispatcher = new Dispatcher(registry, workers,
                (rule, event) -> pipeline.evaluate(rule, event).ifPresent(emitter::emit));
        this.ingress = new ArrayBlockingQueue<>(config.getIngressQueueCapacity());
        this.ingressThread = new Thread(this::runIngress, "correlation-ingress");
        this.ingressThread.setDaemon(true);
        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "correlation-sweeper");
            t.setDaemon(true);
            return t;
        });

        metrics.gauge("correlation.windows.active", "Live correlation windows",
                pipeline::activeWindowCount);
        metrics.gauge("correlation.rules.active", "Enabled rules in the current snapshot",
                () -> registry.snapshot().enabledCount());
        metrics.gauge("correlation.queue.pending", "Events and work items not yet processed",
                this::pendingWork);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Load rules and start processing.
     *
     * @throws IllegalStateException if already started, or if the rule store cannot be loaded
     */
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Engine cannot start from state " + state.get());
        }
        if (ruleStore != null) {
            try {
                registry.replaceAll(ruleStore.load());
            } catch (RuntimeException e) {
                state.set(State.STOPPED);
                throw new IllegalStateException("Failed to load rules from rule store", e);
            }
        }
        workers.start();
        ingressThread.start();
        sweeper.scheduleAtFixedRate(this::tick, config.getSweepIntervalMs(), config.getSweepIntervalMs(),
                TimeUnit.MILLISECONDS);
        LOG.info("Correlation engine started with {} rule(s), {} worker lane(s), sweep every {} ms",
                registry.snapshot().size(), workers.size(), config.getSweepIntervalMs());
    }

    /**
     * Stop intake and drain all in-flight work.
     *
     * @return {@code true} if every stage drained within the shutdown timeout
     */
    public boolean shutdown() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPING)) {
            LOG.debug("Shutdown requested in state {}, nothing to do", state.get());
            return true;
        }
        Duration timeout = Duration.ofMillis(config.getShutdownTimeoutMs());
        LOG.info("Shutting down correlation engine, {} event(s) queued", ingress.size());

        boolean drained = true;
        try {
            ingressThread.join(timeout.toMillis());
            if (ingressThread.isAlive()) {
                LOG.warn("Ingress did not drain within {}", timeout);
                drained = false;
            }
            // events that raced past the running check
            List<Event> leftover = new ArrayList<>();
            ingress.drainTo(leftover);
            for (Event event : leftover) {
                ingest(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while draining ingress");
            drained = false;
        }

        drained &= workers.shutdown(timeout);
        drained &= emitter.close(timeout);
        sweeper.shutdownNow();

        if (ruleStore != null) {
            try {
                ruleStore.save(registry.definitions());
            } catch (RuntimeException e) {
                LOG.error("Failed to save rules to rule store", e);
                drained = false;
            }
        }
        int discarded = pipeline.clearWindows();
        state.set(State.STOPPED);
        LOG.info("Correlation engine stopped, {} unmatched window(s) discarded. {}", discarded, stats());
        return drained;
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    // ---------------------------------------------------------------
    // Ingress
    // ---------------------------------------------------------------

    /**
     * Enqueue an event, waiting while the ingress queue is full.
     *
     * @param event the normalized event
     * @throws InterruptedException  if interrupted while waiting
     * @throws IllegalStateException if the engine is not running
     */
    public void submit(Event event) throws InterruptedException {
        Objects.requireNonNull(event, "event must not be null");
        requireRunning();
        ingress.put(event);
    }

    /**
     * Enqueue an event, waiting at most {@code timeout} for space.
     *
     * @return {@code false} if the queue stayed full
     * @throws InterruptedException  if interrupted while waiting
     * @throws IllegalStateException if the engine is not running
     */
    public boolean offer(Event event, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(event, "event must not be null");
        requireRunning();
        return ingress.offer(event, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void requireRunning() {
        if (state.get() != State.RUNNING) {
            throw new IllegalStateException("Engine is not running (state=" + state.get() + ")");
        }
    }

    private void runIngress() {
        while (state.get() == State.RUNNING || !ingress.isEmpty()) {
            try {
                Event event = ingress.poll(INGRESS_POLL_MS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    ingest(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Ingress thread interrupted, {} event(s) left queued", ingress.size());
                return;
            }
        }
    }

    private void ingest(Event event) throws InterruptedException {
        try {
            event.normalize(clock.instant());
        } catch (RuntimeException e) {
            LOG.error("Dropping event that could not be normalized: {}", event, e);
            return;
        }
        metrics.recordEventProcessed();
        int routed = dispatcher.dispatch(event);
        LOG.trace("Event {} routed to {} rule(s)", event.getId(), routed);
    }

    private void tick() {
        try {
            pipeline.tick();
        } catch (RuntimeException e) {
            LOG.error("Window sweep failed", e);
        }
    }

    // ---------------------------------------------------------------
    // Rule management
    // ---------------------------------------------------------------

    public Rule createRule(RuleDefinition definition) {
        return registry.createRule(definition);
    }

    public Rule updateRule(String ruleId, RulePatch patch) {
        return registry.updateRule(ruleId, patch);
    }

    /**
     * Delete a rule and drop its windows.
     *
     * @return {@code false} if no such rule existed
     */
    public boolean deleteRule(String ruleId) {
        boolean deleted = registry.deleteRule(ruleId);
        if (deleted) {
            pipeline.discardRule(ruleId);
        }
        return deleted;
    }

    public List<Rule> listRules(RuleFilter filter) {
        return registry.listRules(filter);
    }

    /**
     * Notification from incident management that the alert with this dedupe
     * key was resolved; the next match alerts again.
     */
    public boolean alertResolved(String dedupeKey) {
        return pipeline.alertResolved(dedupeKey);
    }

    // ---------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------

    public EngineStats stats() {
        return new EngineStats(
                metrics.eventsProcessed(),
                pipeline.activeWindowCount(),
                registry.snapshot().enabledCount(),
                metrics.alertsEmitted(),
                metrics.alertsSuppressed(),
                metrics.ruleErrors(),
                pendingWork());
    }

    private int pendingWork() {
        return ingress.size() + workers.pending() + emitter.pending();
    }

    long routedCount(String ruleId) {
        return dispatcher.routedCount(ruleId);
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    public MeterRegistry getMeterRegistry() {
        return metrics.getRegistry();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private AlertSink sink;
        private OverflowStore overflowStore;
        private RuleStore ruleStore;
        private MeterRegistry meterRegistry;
        private Clock clock = Clock.systemUTC();
        private final List<RuleDefinition> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder sink(AlertSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder overflowStore(OverflowStore overflowStore) {
            this.overflowStore = overflowStore;
            return this;
        }

        public Builder ruleStore(RuleStore ruleStore) {
            this.ruleStore = ruleStore;
            return this;
        }

        /** Initial rules; replaced by the rule store's contents at start if one is attached. */
        public Builder rules(Collection<RuleDefinition> rules) {
            this.rules.addAll(rules);
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CorrelationEngine build() {
            Objects.requireNonNull(config, "config required");
            Objects.requireNonNull(sink, "sink required");
            Objects.requireNonNull(clock, "clock required");
            if (meterRegistry == null) {
                meterRegistry = new SimpleMeterRegistry();
            }
            return new CorrelationEngine(this);
        }
    }
}
