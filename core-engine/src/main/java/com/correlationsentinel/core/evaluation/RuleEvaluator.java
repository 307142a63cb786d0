package com.correlationsentinel.core.evaluation;

import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.rule.CorrelationRule;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.rule.SequenceRule;
import com.correlationsentinel.core.rule.SequenceStep;
import com.correlationsentinel.core.rule.condition.MatchCollector;
import com.correlationsentinel.core.window.AppendResult;
import com.correlationsentinel.core.window.WindowManager;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Evaluates rules against events.
 *
 * <p>
 * Condition evaluation is pure: absent fields and type mismatches evaluate to
 * {@code false}. A matching single-event rule fires immediately; a matching
 * correlation rule appends the event to its window and fires only on the
 * append that reaches the window's threshold; a sequence rule fires on the
 * event that completes its last open step.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleEvaluator {

    private final WindowManager windows;
    private final Consumer<AppendResult> appendObserver;

    /**
     * @param windows        window store for correlation rules
     * @param appendObserver notified of every window append, e.g. for metrics
     */
    public RuleEvaluator(WindowManager windows, Consumer<AppendResult> appendObserver) {
        this.windows = Objects.requireNonNull(windows, "windows must not be null");
        this.appendObserver = Objects.requireNonNull(appendObserver, "appendObserver must not be null");
    }

    /**
     * Evaluate only the condition tree of a rule.
     *
     * @param rule  the rule
     * @param event the event
     * @return whether it matched, with the satisfying field values
     */
    public EvaluationResult evaluateConditions(Rule rule, Event event) {
        MatchCollector collector = new MatchCollector();
        return rule.getConditions().evaluate(event, collector)
                ? EvaluationResult.matched(collector)
                : EvaluationResult.noMatch();
    }

    /**
     * Evaluate a rule against an event.
     *
     * @param rule  the rule; callers have already checked {@link Rule#appliesTo(Event)}
     * @param event the event
     * @return a trigger if the rule fires on this event
     */
    public Optional<Trigger> evaluate(Rule rule, Event event) {
        if (rule instanceof SequenceRule sequence) {
            return evaluateSequence(sequence, event);
        }
        EvaluationResult result = evaluateConditions(rule, event);
        if (!result.isMatched()) {
            return Optional.empty();
        }
        if (!(rule instanceof CorrelationRule correlation)) {
            return Optional.of(Trigger.singleEvent(rule, event, result));
        }
        AppendResult append = windows.append(correlation, event, result.getMatchedFields());
        appendObserver.accept(append);
        if (!append.isMatched()) {
            return Optional.empty();
        }
        return Optional.of(Trigger.window(rule, event, result, append.getWindow().orElseThrow()));
    }

    private Optional<Trigger> evaluateSequence(SequenceRule rule, Event event) {
        BitSet matching = new BitSet();
        MatchCollector collector = new MatchCollector();
        List<SequenceStep> steps = rule.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            MatchCollector stepCollector = new MatchCollector();
            if (steps.get(i).getCondition().evaluate(event, stepCollector)) {
                matching.set(i);
                collector.absorb(stepCollector);
            }
        }
        if (matching.isEmpty()) {
            return Optional.empty();
        }
        AppendResult advance = windows.advance(rule, event, matching, collector.getFields());
        appendObserver.accept(advance);
        if (!advance.isMatched()) {
            return Optional.empty();
        }
        List<String> conditions = new ArrayList<>(collector.getDescriptions());
        conditions.add(0, rule.describeCompletion());
        EvaluationResult result = EvaluationResult.matched(collector.getFields(), conditions);
        return Optional.of(Trigger.window(rule, event, result, advance.getWindow().orElseThrow()));
    }
}
