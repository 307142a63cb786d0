package com.correlationsentinel.core.window;

import com.correlationsentinel.core.MutableClock;
import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.rule.CorrelationRule;
import com.correlationsentinel.core.rule.SequenceRule;
import com.correlationsentinel.core.rule.SequenceStep;
import com.correlationsentinel.core.rule.condition.FieldEquals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WindowManager}.
 */
class WindowManagerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private WindowManager windows;
    private CorrelationRule rule;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        windows = new WindowManager(8, 100, clock);
        rule = bruteForce(3);
    }

    @Test
    @DisplayName("Should match exactly when the threshold is reached")
    void shouldMatchAtThreshold() {
        AppendResult first = windows.append(rule, failure("alice", 0), Map.of());
        AppendResult second = windows.append(rule, failure("alice", 10), Map.of());
        AppendResult third = windows.append(rule, failure("alice", 30), Map.of());

        assertThat(first.isNewWindow()).isTrue();
        assertThat(first.getOutcome()).isEqualTo(AppendResult.Outcome.APPENDED);
        assertThat(second.getOutcome()).isEqualTo(AppendResult.Outcome.APPENDED);
        assertThat(third.getOutcome()).isEqualTo(AppendResult.Outcome.MATCHED);
        WindowSnapshot snapshot = third.getWindow().orElseThrow();
        assertThat(snapshot.getEventCount()).isEqualTo(3);
        assertThat(snapshot.getStartTime()).isEqualTo(T0);
        assertThat(snapshot.getEndTime()).isEqualTo(T0.plusSeconds(60));
        assertThat(snapshot.getEntries()).extracting(EventRef::getEventId)
                .containsExactly("alice-0", "alice-10", "alice-30");
    }

    @Test
    @DisplayName("Should report the match only once per window")
    void shouldMatchOnce() {
        for (int i = 0; i < 3; i++) {
            windows.append(rule, failure("alice", i), Map.of());
        }

        AppendResult fourth = windows.append(rule, failure("alice", 5), Map.of());

        assertThat(fourth.getOutcome()).isEqualTo(AppendResult.Outcome.APPENDED);
        assertThat(fourth.getWindow().orElseThrow().isMatched()).isTrue();
        assertThat(fourth.getWindow().orElseThrow().getEventCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should keep separate windows per correlation key")
    void shouldPartitionByKey() {
        windows.append(rule, failure("alice", 0), Map.of());
        windows.append(rule, failure("bob", 1), Map.of());
        windows.append(rule, failure("alice", 2), Map.of());

        assertThat(windows.activeWindowCount()).isEqualTo(2);
        assertThat(windows.find(new WindowKey("brute", "org-1", List.of("alice"))))
                .hasValueSatisfying(w -> assertThat(w.getEventCount()).isEqualTo(2));
        assertThat(windows.find(new WindowKey("brute", "org-1", List.of("bob"))))
                .hasValueSatisfying(w -> assertThat(w.getEventCount()).isEqualTo(1));
    }

    @Test
    @DisplayName("Numerically equal key values should share a window")
    void shouldRenderNumericKeysCanonically() {
        CorrelationRule byPort = CorrelationRule.builder()
                .id("port-scan")
                .conditions(new FieldEquals("outcome", "failure", true))
                .correlationFields(List.of("port"))
                .timeWindowMs(60_000)
                .threshold(2)
                .build();

        AppendResult first = windows.append(byPort, onPort("e1", 0, 5), Map.of());
        AppendResult second = windows.append(byPort, onPort("e2", 1, 5.0), Map.of());

        assertThat(first.isNewWindow()).isTrue();
        assertThat(second.isNewWindow()).isFalse();
        assertThat(second.getOutcome()).isEqualTo(AppendResult.Outcome.MATCHED);
        assertThat(second.getWindow().orElseThrow().getKey().getValues()).containsExactly("5");
    }

    @Test
    @DisplayName("An event after the end time should open a new window")
    void shouldTumble() {
        windows.append(rule, failure("alice", 0), Map.of());
        windows.append(rule, failure("alice", 60), Map.of());

        AppendResult late = windows.append(rule, failure("alice", 70), Map.of());

        assertThat(late.isNewWindow()).isTrue();
        assertThat(late.isReplacedExpired()).isTrue();
        assertThat(late.getWindow().orElseThrow().getEventCount()).isEqualTo(1);
        assertThat(late.getWindow().orElseThrow().getStartTime()).isEqualTo(T0.plusSeconds(70));
        assertThat(windows.activeWindowCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("An event earlier than the window start still joins the live window")
    void shouldAcceptLateEvents() {
        windows.append(rule, failure("alice", 30), Map.of());

        AppendResult late = windows.append(rule, failure("alice", 5), Map.of());

        assertThat(late.isNewWindow()).isFalse();
        assertThat(late.getWindow().orElseThrow().getEventCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should skip events lacking a correlation field")
    void shouldSkipMissingField() {
        Event anonymous = Event.builder()
                .id("anon")
                .timestamp(T0)
                .organizationId("org-1")
                .attribute("outcome", "failure")
                .build();

        AppendResult result = windows.append(rule, anonymous, Map.of());

        assertThat(result.getOutcome()).isEqualTo(AppendResult.Outcome.SKIPPED_MISSING_FIELD);
        assertThat(result.getWindow()).isEmpty();
        assertThat(windows.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("Windows of different organizations never mix")
    void shouldIsolateOrganizations() {
        windows.append(rule, failure("alice", 0), Map.of());
        Event otherOrg = Event.builder()
                .id("x")
                .timestamp(T0)
                .organizationId("org-2")
                .attribute("user", "alice")
                .build();

        AppendResult result = windows.append(rule, otherOrg, Map.of());

        assertThat(result.isNewWindow()).isTrue();
        assertThat(windows.activeWindowCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should evict the oldest unmatched window past the per-rule cap")
    void shouldEvictOldestUnmatched() {
        CorrelationRule capped = bruteForce(2);
        WindowManager small = new WindowManager(4, 2, clock);
        small.append(capped, failure("alice", 0), Map.of());
        small.append(capped, failure("alice", 1), Map.of());
        small.append(capped, failure("bob", 2), Map.of());

        AppendResult third = small.append(capped, failure("carol", 3), Map.of());

        assertThat(third.getEvicted()).isEqualTo(1);
        assertThat(small.activeWindowCount("brute")).isEqualTo(2);
        assertThat(small.find(new WindowKey("brute", "org-1", List.of("alice")))).isPresent();
        assertThat(small.find(new WindowKey("brute", "org-1", List.of("bob")))).isEmpty();
    }

    @Test
    @DisplayName("Sweep should separate expired from finalized windows")
    void shouldSweep() {
        for (int i = 0; i < 3; i++) {
            windows.append(rule, failure("alice", i), Map.of());
        }
        windows.append(rule, failure("bob", 0), Map.of());
        windows.append(rule, failure("carol", 120), Map.of());

        clock.set(T0.plusSeconds(90));
        SweepResult result = windows.sweep();

        assertThat(result.getExpired()).isEqualTo(1);
        assertThat(result.getFinalized()).isEqualTo(1);
        assertThat(result.getRemoved()).isEqualTo(2);
        assertThat(windows.activeWindowCount()).isEqualTo(1);
        assertThat(windows.activeWindowCount("brute")).isEqualTo(1);
    }

    @Test
    @DisplayName("Sweep should keep windows whose end time has not passed")
    void shouldNotSweepLiveWindows() {
        windows.append(rule, failure("alice", 0), Map.of());
        clock.advance(Duration.ofSeconds(60));

        assertThat(windows.sweep().getRemoved()).isZero();
        assertThat(windows.activeWindowCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should discard every window of a rule")
    void shouldDiscardRule() {
        CorrelationRule other = CorrelationRule.builder()
                .id("other")
                .conditions(new FieldEquals("outcome", "failure", true))
                .correlationFields(List.of("user"))
                .timeWindowMs(60_000)
                .threshold(3)
                .build();
        windows.append(rule, failure("alice", 0), Map.of());
        windows.append(rule, failure("bob", 0), Map.of());
        windows.append(other, failure("alice", 0), Map.of());

        assertThat(windows.discardRule("brute")).isEqualTo(2);
        assertThat(windows.activeWindowCount()).isEqualTo(1);
        assertThat(windows.activeWindowCount("brute")).isZero();
        assertThat(windows.clear()).isEqualTo(1);
        assertThat(windows.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("Concurrent appends to one key should report exactly one match")
    void shouldMatchOnceUnderContention() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger matches = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        if (windows.append(rule, failure("alice", 1), Map.of()).isMatched()) {
                            matches.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(matches.get()).isEqualTo(1);
        assertThat(windows.find(new WindowKey("brute", "org-1", List.of("alice"))))
                .hasValueSatisfying(w -> assertThat(w.getEventCount()).isEqualTo(threads * perThread));
    }

    // ---------------------------------------------------------------
    // Sequences
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Ordered sequence should complete when every step arrives in order")
    void shouldCompleteOrderedSequence() {
        SequenceRule sequence = loginThenSudo(true);

        AppendResult login = windows.advance(sequence, step("e1", "login", 0), steps(0), Map.of());
        AppendResult sudo = windows.advance(sequence, step("e2", "sudo", 30), steps(1), Map.of());

        assertThat(login.getOutcome()).isEqualTo(AppendResult.Outcome.APPENDED);
        assertThat(login.isNewWindow()).isTrue();
        assertThat(sudo.getOutcome()).isEqualTo(AppendResult.Outcome.MATCHED);
        WindowSnapshot snapshot = sudo.getWindow().orElseThrow();
        assertThat(snapshot.getThreshold()).isEqualTo(2);
        assertThat(snapshot.getKey().getValues()).containsExactly("vpn");
        assertThat(snapshot.getEntries()).extracting(EventRef::getEventId).containsExactly("e1", "e2");
        // completed sequences start over
        assertThat(windows.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("Ordered sequence should ignore a step that arrives before its predecessor")
    void shouldRejectOutOfOrderStep() {
        SequenceRule sequence = loginThenSudo(true);

        AppendResult early = windows.advance(sequence, step("e1", "sudo", 0), steps(1), Map.of());
        windows.advance(sequence, step("e2", "login", 10), steps(0), Map.of());
        AppendResult repeated = windows.advance(sequence, step("e3", "login", 20), steps(0), Map.of());

        assertThat(early.getOutcome()).isEqualTo(AppendResult.Outcome.SKIPPED_OUT_OF_ORDER);
        assertThat(early.getWindow()).isEmpty();
        assertThat(repeated.getOutcome()).isEqualTo(AppendResult.Outcome.SKIPPED_OUT_OF_ORDER);
        assertThat(repeated.getWindow().orElseThrow().getEntries()).extracting(EventRef::getEventId)
                .containsExactly("e2");
        assertThat(windows.advance(sequence, step("e4", "sudo", 30), steps(1), Map.of()).isMatched()).isTrue();
    }

    @Test
    @DisplayName("A step arriving after the previous step's timeout should restart the sequence")
    void shouldRestartAfterStepTimeout() {
        SequenceRule sequence = loginThenSudo(true);

        windows.advance(sequence, step("e1", "login", 0), steps(0), Map.of());
        AppendResult late = windows.advance(sequence, step("e2", "sudo", 121), steps(1), Map.of());
        AppendResult relogin = windows.advance(sequence, step("e3", "login", 130), steps(0), Map.of());

        assertThat(late.getOutcome()).isEqualTo(AppendResult.Outcome.SKIPPED_OUT_OF_ORDER);
        assertThat(late.isReplacedExpired()).isTrue();
        assertThat(relogin.isNewWindow()).isTrue();
        assertThat(relogin.getWindow().orElseThrow().getStartTime()).isEqualTo(T0.plusSeconds(130));
    }

    @Test
    @DisplayName("Sweep should drop a sequence whose pending step timed out")
    void shouldSweepTimedOutSequence() {
        SequenceRule sequence = loginThenSudo(true);
        windows.advance(sequence, step("e1", "login", 0), steps(0), Map.of());

        clock.advance(Duration.ofSeconds(121));

        assertThat(windows.sweep().getExpired()).isEqualTo(1);
        assertThat(windows.activeWindowCount()).isZero();
    }

    @Test
    @DisplayName("Unordered sequence should complete once every step was seen, in any order")
    void shouldCompleteUnorderedSequence() {
        SequenceRule sequence = loginThenSudo(false);

        AppendResult sudo = windows.advance(sequence, step("e1", "sudo", 0), steps(1), Map.of());
        AppendResult again = windows.advance(sequence, step("e2", "sudo", 5), steps(1), Map.of());
        AppendResult login = windows.advance(sequence, step("e3", "login", 10), steps(0), Map.of());

        assertThat(sudo.getOutcome()).isEqualTo(AppendResult.Outcome.APPENDED);
        assertThat(again.getOutcome()).isEqualTo(AppendResult.Outcome.SKIPPED_OUT_OF_ORDER);
        assertThat(login.isMatched()).isTrue();
        assertThat(login.getWindow().orElseThrow().getEntries()).extracting(EventRef::getEventId)
                .containsExactly("e1", "e3");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static CorrelationRule bruteForce(int threshold) {
        return CorrelationRule.builder()
                .id("brute")
                .conditions(new FieldEquals("outcome", "failure", true))
                .correlationFields(List.of("user"))
                .timeWindowMs(60_000)
                .threshold(threshold)
                .build();
    }

    private static Event failure(String user, int offsetSeconds) {
        return Event.builder()
                .id(user + "-" + offsetSeconds)
                .timestamp(T0.plusSeconds(offsetSeconds))
                .organizationId("org-1")
                .sourceIdentifier("auth_failure")
                .attribute("user", user)
                .attribute("outcome", "failure")
                .build();
    }

    private static Event onPort(String id, int offsetSeconds, Object port) {
        return Event.builder()
                .id(id)
                .timestamp(T0.plusSeconds(offsetSeconds))
                .organizationId("org-1")
                .attribute("outcome", "failure")
                .attribute("port", port)
                .build();
    }

    private static SequenceRule loginThenSudo(boolean ordered) {
        return SequenceRule.builder()
                .id("login-sudo")
                .step(new SequenceStep("login", new FieldEquals("action", "login", true), 120_000))
                .step(new SequenceStep("sudo", new FieldEquals("action", "sudo", true)))
                .ordered(ordered)
                .timeWindowMs(600_000)
                .build();
    }

    private static Event step(String id, String action, int offsetSeconds) {
        return Event.builder()
                .id(id)
                .timestamp(T0.plusSeconds(offsetSeconds))
                .organizationId("org-1")
                .sourceIdentifier("vpn")
                .attribute("action", action)
                .build();
    }

    private static BitSet steps(int... indexes) {
        BitSet set = new BitSet();
        for (int index : indexes) {
            set.set(index);
        }
        return set;
    }
}
