package com.correlationsentinel.core.evaluation;

import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.window.WindowSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A rule firing, handed from the evaluator to match assembly: either one
 * event satisfying a single-event rule, or a window reaching its threshold.
 *
 * @since 1.0.0
 */
public final class Trigger {

    private final Rule rule;
    private final Event event;
    private final EvaluationResult evaluation;
    private final WindowSnapshot window;

    private Trigger(Rule rule, Event event, EvaluationResult evaluation, WindowSnapshot window) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.evaluation = Objects.requireNonNull(evaluation, "evaluation must not be null");
        this.window = window;
    }

    public static Trigger singleEvent(Rule rule, Event event, EvaluationResult evaluation) {
        return new Trigger(rule, event, evaluation, null);
    }

    public static Trigger window(Rule rule, Event event, EvaluationResult evaluation, WindowSnapshot window) {
        return new Trigger(rule, event, evaluation, Objects.requireNonNull(window, "window must not be null"));
    }

    public Rule getRule() {
        return rule;
    }

    /** The event that caused the firing (the last one added, for windows). */
    public Event getEvent() {
        return event;
    }

    public boolean isWindowTrigger() {
        return window != null;
    }

    public Optional<WindowSnapshot> getWindow() {
        return Optional.ofNullable(window);
    }

    public Map<String, Object> getMatchedFields() {
        return evaluation.getMatchedFields();
    }

    public List<String> getMatchedConditions() {
        return evaluation.getMatchedConditions();
    }

    @Override
    public String toString() {
        return "Trigger{" +
                "ruleId='" + rule.getId() + '\'' +
                ", eventId='" + event.getId() + '\'' +
                (window != null ? ", window=" + window.getWindowId() : "") +
                '}';
    }
}
