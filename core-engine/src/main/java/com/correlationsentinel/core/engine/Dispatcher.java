package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.registry.RuleRegistry;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.rule.WindowedRule;
import com.correlationsentinel.core.window.WindowKey;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.BiConsumer;

/**
 * Routes each event to the worker lanes of its candidate rules.
 *
 * <p>
 * A correlation rule's work goes to the lane owning its window key, so every
 * event of one window is evaluated by a single thread in arrival order.
 * Single-event work is spread by rule and event id. Nothing is evaluated on
 * the calling thread.
 * </p>
 */
final class Dispatcher {

    private final RuleRegistry registry;
    private final WorkerPool pool;
    private final BiConsumer<Rule, Event> evaluation;
    private final Map<String, LongAdder> routed = new ConcurrentHashMap<>();

    Dispatcher(RuleRegistry registry, WorkerPool pool, BiConsumer<Rule, Event> evaluation) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        this.evaluation = Objects.requireNonNull(evaluation, "evaluation must not be null");
    }

    /**
     * @param event a normalized event
     * @return number of work items submitted
     * @throws InterruptedException if interrupted while a lane was full
     */
    int dispatch(Event event) throws InterruptedException {
        int submitted = 0;
        for (Rule rule : registry.snapshot().candidates(event)) {
            int lane = pool.laneFor(routingHash(rule, event));
            pool.submit(lane, () -> evaluation.accept(rule, event));
            routed.computeIfAbsent(rule.getId(), id -> new LongAdder()).increment();
            submitted++;
        }
        return submitted;
    }

    static int routingHash(Rule rule, Event event) {
        if (rule instanceof WindowedRule windowed) {
            return WindowKey.of(windowed, event)
                    .map(WindowKey::hashCode)
                    .orElseGet(() -> Objects.hash(rule.getId(), event.getOrganizationId()));
        }
        return Objects.hash(rule.getId(), event.getId());
    }

    /**
     * @param ruleId rule id
     * @return events routed to the rule since start
     */
    long routedCount(String ruleId) {
        LongAdder count = routed.get(ruleId);
        return count != null ? count.sum() : 0L;
    }
}
