package com.correlationsentinel.core.engine;

import com.correlationsentinel.core.config.RulesLoader;
import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.registry.RuleRegistry;
import com.correlationsentinel.core.rule.Rule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Dispatcher}.
 */
class DispatcherTest {

    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RuleRegistry();
        registry.replaceAll(RulesLoader.fromClasspath("test-rules.yml").getRules());
    }

    @Test
    @DisplayName("Events of one window key should share a routing hash")
    void shouldRouteWindowKeyConsistently() {
        Rule rule = registry.getRule("failed-logins").orElseThrow();

        int first = Dispatcher.routingHash(rule, event("e1", "alice", "org-1"));
        int second = Dispatcher.routingHash(rule, event("e2", "alice", "org-1"));
        int otherOrg = Dispatcher.routingHash(rule, event("e3", "alice", "org-2"));

        assertThat(first).isEqualTo(second);
        assertThat(first).isNotEqualTo(otherOrg);
    }

    @Test
    @DisplayName("Should submit one work item per candidate rule")
    void shouldDispatchToCandidates() throws InterruptedException {
        WorkerPool pool = new WorkerPool(2, 8, "dispatch-test");
        List<String> evaluated = new CopyOnWriteArrayList<>();
        Dispatcher dispatcher = new Dispatcher(registry, pool, (rule, event) -> evaluated.add(rule.getId()));
        pool.start();

        int submitted = dispatcher.dispatch(event("e1", "root", "org-1"));
        pool.shutdown(Duration.ofSeconds(5));

        assertThat(submitted).isEqualTo(2);
        assertThat(evaluated).containsExactlyInAnyOrder("failed-logins", "admin-login");
        assertThat(dispatcher.routedCount("admin-login")).isEqualTo(1);
        assertThat(dispatcher.routedCount("unknown")).isZero();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Event event(String id, String user, String org) {
        return Event.builder()
                .id(id)
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .organizationId(org)
                .sourceIdentifier("auth_failure")
                .attribute("user", user)
                .build();
    }
}
