package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.assembly.MatchAssembler;
import com.correlationsentinel.core.config.EngineConfig;
import com.correlationsentinel.core.evaluation.RuleEvaluationException;
import com.correlationsentinel.core.evaluation.RuleEvaluator;
import com.correlationsentinel.core.evaluation.Trigger;
import com.correlationsentinel.core.metrics.EngineMetrics;
import com.correlationsentinel.core.model.Alert;
import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.model.Match;
import com.correlationsentinel.core.registry.RuleRegistry;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.scoring.ConfidenceScorer;
import com.correlationsentinel.core.scoring.Deduplicator;
import com.correlationsentinel.core.scoring.ScoringDecision;
import com.correlationsentinel.core.scoring.ScoringService;
import com.correlationsentinel.core.window.AppendResult;
import com.correlationsentinel.core.window.SweepResult;
import com.correlationsentinel.core.window.WindowManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Synchronous evaluate → assemble → score chain for one (rule, event) pair.
 *
 * <p>
 * Used by the worker lanes of {@link CorrelationEngine} and directly by the
 * Flink operator. Callers must make sure the events of one window key reach
 * {@link #evaluate(Rule, Event)} from one thread at a time to keep arrival
 * order; the components themselves are thread-safe.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A rule that throws during evaluation is logged at ERROR, counted and marked
 * degraded in the registry. The event is still evaluated against every other
 * rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationPipeline.class);

    private final RuleRegistry registry;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final WindowManager windows;
    private final RuleEvaluator evaluator;
    private final MatchAssembler assembler;
    private final ScoringService scoring;

    public CorrelationPipeline(RuleRegistry registry, EngineConfig config, EngineMetrics metrics, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        this.windows = new WindowManager(config.getWindowShards(), config.getMaxWindowsPerRule(), clock);
        this.evaluator = new RuleEvaluator(windows, this::onAppend);
        this.assembler = new MatchAssembler(clock, config.getIdempotencyRetentionMs());
        this.scoring = new ScoringService(new ConfidenceScorer(config.getScoring()), new Deduplicator(clock),
                config.getSuppressionInterval(), clock);
    }

    /**
     * Normalize an event and run it through every candidate rule.
     *
     * @param event the incoming event
     * @return alerts raised by the event, in rule order
     */
    public List<Alert> process(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        event.normalize(clock.instant());
        metrics.recordEventProcessed();
        List<Alert> alerts = new ArrayList<>();
        for (Rule rule : registry.snapshot().candidates(event)) {
            evaluate(rule, event).ifPresent(alerts::add);
        }
        return alerts;
    }

    /**
     * Evaluate one rule against one normalized event, isolating failures.
     *
     * @param rule  candidate rule
     * @param event normalized event
     * @return the alert to emit, if any
     */
    public Optional<Alert> evaluate(Rule rule, Event event) {
        long start = System.nanoTime();
        try {
            return evaluateUnchecked(rule, event);
        } catch (RuntimeException e) {
            RuleEvaluationException failure = e instanceof RuleEvaluationException ree
                    ? ree
                    : new RuleEvaluationException(rule.getId(), "evaluation failed for event " + event.getId(), e);
            LOG.error("Rule '{}' failed on event {}", rule.getId(), event.getId(), failure);
            metrics.recordRuleError(rule.getId());
            registry.markDegraded(rule.getId(), failure);
            return Optional.empty();
        } finally {
            metrics.recordLatency(System.nanoTime() - start);
        }
    }

    private Optional<Alert> evaluateUnchecked(Rule rule, Event event) {
        metrics.recordEvaluation(rule.getId());
        Optional<Trigger> trigger = evaluator.evaluate(rule, event);
        if (trigger.isEmpty()) {
            return Optional.empty();
        }
        Optional<Match> match = assembler.assemble(trigger.get());
        if (match.isEmpty()) {
            return Optional.empty();
        }
        metrics.recordMatch(rule.getId());

        ScoringDecision decision = scoring.process(rule, match.get());
        switch (decision.getDisposition()) {
            case EMIT:
                metrics.recordAlertEmitted();
                return decision.getAlert();
            case DUPLICATE:
                metrics.recordDuplicateSuppressed();
                LOG.debug("Match {} of rule '{}' suppressed as duplicate of {}", match.get().getId(),
                        rule.getId(), decision.getDedupeKey());
                return Optional.empty();
            default:
                metrics.recordSuppressedByRule();
                return Optional.empty();
        }
    }

    private void onAppend(AppendResult result) {
        if (result.getOutcome() == AppendResult.Outcome.SKIPPED_MISSING_FIELD) {
            metrics.recordWindowSkipped();
            return;
        }
        if (result.getEvicted() > 0) {
            metrics.recordWindowsEvicted(result.getEvicted());
        }
        if (result.isReplacedExpired()) {
            metrics.recordWindowsExpired(1);
        }
    }

    /**
     * Periodic housekeeping: expire windows, forget stale dedupe entries and
     * idempotency keys.
     *
     * @return the window sweep outcome
     */
    public SweepResult tick() {
        SweepResult sweep = windows.sweep();
        if (sweep.getExpired() > 0) {
            metrics.recordWindowsExpired(sweep.getExpired());
        }
        int dedupe = scoring.getDeduplicator().purgeExpired();
        int keys = assembler.purgeExpired();
        if (sweep.getRemoved() + dedupe + keys > 0) {
            LOG.debug("Tick: {}, purged {} dedupe entr(ies) and {} match key(s)", sweep, dedupe, keys);
        }
        return sweep;
    }

    /**
     * Mark the alert with this dedupe key as resolved so the next match
     * alerts again, regardless of the suppression interval.
     *
     * @param dedupeKey dedupe key of the resolved alert
     * @return {@code true} if an active entry was resolved
     */
    public boolean alertResolved(String dedupeKey) {
        return scoring.getDeduplicator().markResolved(dedupeKey);
    }

    /**
     * Drop the windows of a rule that no longer exists.
     */
    public int discardRule(String ruleId) {
        int dropped = windows.discardRule(ruleId);
        if (dropped > 0) {
            LOG.info("Discarded {} window(s) of rule '{}'", dropped, ruleId);
        }
        return dropped;
    }

    /**
     * Discard every live window.
     *
     * @return number of unmatched windows lost
     */
    public int clearWindows() {
        return windows.clear();
    }

    public int activeWindowCount() {
        return windows.activeWindowCount();
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    public WindowManager getWindows() {
        return windows;
    }

    public Deduplicator getDeduplicator() {
        return scoring.getDeduplicator();
    }
}
