package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.MutableClock;
import com.correlationsentinel.core.config.ConditionDefinition;
import com.correlationsentinel.core.config.EngineConfig;
import com.correlationsentinel.core.config.RuleDefinition;
import com.correlationsentinel.core.config.RulesLoader;
import com.correlationsentinel.core.model.Alert;
import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.registry.RuleFilter;
import com.correlationsentinel.core.registry.RulePatch;
import com.correlationsentinel.core.rule.Rule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CorrelationEngine}.
 */
class CorrelationEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private EngineConfig config;
    private List<Alert> delivered;
    private CorrelationEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        config = new EngineConfig.Builder()
                .workerThreads(4)
                .laneQueueCapacity(16)
                .ingressQueueCapacity(64)
                .sweepIntervalMs(50)
                .deliveryInitialBackoffMs(1)
                .shutdownTimeoutMs(5_000)
                .build();
        delivered = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    @DisplayName("Should raise one alert for a burst of failed logins and drain on shutdown")
    void shouldCorrelateAndDrain() throws InterruptedException {
        engine = engineWith(RulesLoader.fromClasspath("test-rules.yml").getRules());
        engine.start();

        for (int i = 0; i < 3; i++) {
            engine.submit(failure("a" + i, "alice", i * 10));
        }
        engine.submit(failure("b0", "bob", 0));

        assertThat(engine.shutdown()).isTrue();
        assertThat(delivered).hasSize(1);
        assertThat(delivered.get(0).getRuleId()).isEqualTo("failed-logins");
        assertThat(delivered.get(0).getEventCount()).isEqualTo(3);
        EngineStats stats = engine.stats();
        assertThat(stats.getEventsProcessed()).isEqualTo(4);
        assertThat(stats.getAlertsEmitted()).isEqualTo(1);
        assertThat(stats.getActiveWindows()).isZero();
        assertThat(stats.getPendingWork()).isZero();
        assertThat(engine.routedCount("failed-logins")).isEqualTo(4);
    }

    @Test
    @DisplayName("Events of one window should be evaluated in arrival order across many keys")
    void shouldCorrelateManyKeysConcurrently() throws InterruptedException {
        engine = engineWith(RulesLoader.fromClasspath("test-rules.yml").getRules());
        engine.start();

        for (int u = 0; u < 20; u++) {
            for (int i = 0; i < 4; i++) {
                engine.submit(failure("u" + u + "-" + i, "user" + u, i));
            }
        }

        assertThat(engine.shutdown()).isTrue();
        assertThat(delivered).hasSize(20);
        assertThat(delivered).allSatisfy(alert -> assertThat(alert.getEventCount()).isEqualTo(3));
    }

    @Test
    @DisplayName("Should reject events when not running")
    void shouldRejectWhenNotRunning() throws InterruptedException {
        engine = engineWith(List.of());

        assertThatThrownBy(() -> engine.submit(failure("x", "alice", 0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not running");

        engine.start();
        assertThat(engine.offer(failure("y", "alice", 0), Duration.ofMillis(100))).isTrue();
        engine.shutdown();

        assertThat(engine.isRunning()).isFalse();
        assertThatThrownBy(() -> engine.offer(failure("z", "alice", 0), Duration.ofMillis(10)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(engine::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should load rules from the store at start and save them at shutdown")
    void shouldUseRuleStore() {
        InMemoryRuleStore store = new InMemoryRuleStore(RulesLoader.fromClasspath("test-rules.yml").getRules());
        engine = CorrelationEngine.builder()
                .config(config)
                .sink(delivered::add)
                .clock(clock)
                .ruleStore(store)
                .build();

        engine.start();
        assertThat(engine.listRules(RuleFilter.all())).hasSize(2);
        engine.createRule(single("new-rule"));
        engine.updateRule("admin-login", RulePatch.builder().severity("critical").build());
        engine.shutdown();

        assertThat(store.saved).extracting(RuleDefinition::getId)
                .containsExactly("failed-logins", "admin-login", "new-rule");
        assertThat(store.saved.get(1).getSeverity()).isEqualTo("critical");
    }

    @Test
    @DisplayName("A failing rule store should abort start")
    void shouldFailStartWhenStoreFails() {
        engine = CorrelationEngine.builder()
                .config(config)
                .sink(delivered::add)
                .clock(clock)
                .ruleStore(new RuleStore() {
                    @Override
                    public List<RuleDefinition> load() {
                        throw new IllegalStateException("database down");
                    }

                    @Override
                    public void save(List<RuleDefinition> rules) {
                    }
                })
                .build();

        assertThatThrownBy(engine::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to load rules")
                .hasRootCauseMessage("database down");
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Deleting a rule should drop its live windows")
    void shouldDropWindowsOfDeletedRule() throws InterruptedException {
        engine = engineWith(RulesLoader.fromClasspath("test-rules.yml").getRules());
        engine.start();
        engine.submit(failure("a0", "alice", 0));
        awaitCondition(() -> engine.stats().getActiveWindows() == 1);

        assertThat(engine.deleteRule("failed-logins")).isTrue();
        assertThat(engine.deleteRule("failed-logins")).isFalse();

        assertThat(engine.stats().getActiveWindows()).isZero();
        assertThat(engine.stats().getActiveRules()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should register engine gauges on the meter registry")
    void shouldExposeGauges() {
        engine = engineWith(RulesLoader.fromClasspath("test-rules.yml").getRules());

        assertThat(engine.getMeterRegistry().get("correlation.rules.active").gauge().value()).isEqualTo(2.0);
        assertThat(engine.getMeterRegistry().get("correlation.windows.active").gauge().value()).isZero();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private CorrelationEngine engineWith(List<RuleDefinition> rules) {
        return CorrelationEngine.builder()
                .config(config)
                .sink(delivered::add)
                .clock(clock)
                .rules(rules)
                .build();
    }

    private static Event failure(String id, String user, int offsetSeconds) {
        return Event.builder()
                .id(id)
                .timestamp(T0.plusSeconds(offsetSeconds))
                .organizationId("org-1")
                .sourceIdentifier("auth_failure")
                .attribute("user", user)
                .attribute("outcome", "failure")
                .build();
    }

    private static RuleDefinition single(String id) {
        RuleDefinition def = new RuleDefinition();
        def.setId(id);
        def.setConditions(ConditionDefinition.leaf("contains", "cmd", "mimikatz"));
        return def;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private static final class InMemoryRuleStore implements RuleStore {
        private final List<RuleDefinition> initial;
        private List<RuleDefinition> saved = new ArrayList<>();

        InMemoryRuleStore(List<RuleDefinition> initial) {
            this.initial = initial;
        }

        @Override
        public List<RuleDefinition> load() {
            return initial;
        }

        @Override
        public void save(List<RuleDefinition> rules) {
            saved = new ArrayList<>(rules);
        }
    }
}
