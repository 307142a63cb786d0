package com.correlationsentinel.core.assembly;

import com.correlationsentinel.core.evaluation.Trigger;
import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.model.Match;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.window.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns triggers into immutable {@link Match}es.
 *
 * <p>
 * Assembly is exactly-once per idempotency key {@code (ruleId, windowId)} for
 * window triggers and {@code (ruleId, eventId)} for single-event triggers: a
 * second trigger with the same key (a replayed event, a re-delivered window)
 * yields nothing. Match ids are name-based UUIDs of that key, so replaying the
 * same input produces the same ids. Keys are forgotten after the configured
 * retention by {@link #purgeExpired()}.
 * </p>
 *
 * <p>
 * Raw confidence:
 * {@code min(0.5 + min(0.1 * distinctMatchedConditions, 0.4) + (window ? 0.1 : 0), 1.0)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MatchAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(MatchAssembler.class);

    private final Clock clock;
    private final long retentionMs;
    private final Map<String, Long> assembled = new ConcurrentHashMap<>();

    /**
     * @param clock       processing-time clock for key retention
     * @param retentionMs how long an idempotency key is remembered
     */
    public MatchAssembler(Clock clock, long retentionMs) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (retentionMs < 1) {
            throw new IllegalArgumentException("retentionMs must be >= 1, got: " + retentionMs);
        }
        this.retentionMs = retentionMs;
    }

    /**
     * @param trigger a rule firing
     * @return the match, or empty if this idempotency key was already assembled
     */
    public Optional<Match> assemble(Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        Rule rule = trigger.getRule();
        Optional<WindowSnapshot> window = trigger.getWindow();
        String key = rule.getId() + "|" + window.map(WindowSnapshot::getWindowId)
                .orElseGet(() -> trigger.getEvent().getId());

        if (assembled.putIfAbsent(key, clock.millis()) != null) {
            LOG.debug("Match for {} already assembled, skipping", key);
            return Optional.empty();
        }

        List<EventRef> refs = window.map(WindowSnapshot::getEntries)
                .orElseGet(() -> List.of(EventRef.of(trigger.getEvent(), trigger.getMatchedFields())));
        Instant timestamp = refs.stream()
                .map(EventRef::getTimestamp)
                .max(Comparator.naturalOrder())
                .orElse(trigger.getEvent().getTimestamp());

        Match match = Match.builder()
                .id(UUID.nameUUIDFromBytes(("match|" + key).getBytes(StandardCharsets.UTF_8)).toString())
                .ruleId(rule.getId())
                .ruleVersion(window.map(WindowSnapshot::getRuleVersion).orElse(rule.getVersion()))
                .windowId(window.map(WindowSnapshot::getWindowId).orElse(null))
                .organizationId(trigger.getEvent().getOrganizationId())
                .correlationKey(window.map(w -> w.getKey().getValues()).orElse(Collections.emptyList()))
                .timestamp(timestamp)
                .eventRefs(refs)
                .matchedConditions(trigger.getMatchedConditions())
                .threshold(window.map(WindowSnapshot::getThreshold).orElse(1))
                .windowDurationMs(window.map(w -> w.getEndTime().toEpochMilli() - w.getStartTime().toEpochMilli())
                        .orElse(0L))
                .triggerEventId(trigger.getEvent().getId())
                .rawConfidence(rawConfidence(trigger.getMatchedConditions().size(), window.isPresent()))
                .build();
        LOG.debug("Assembled match {} for rule '{}' with {} event(s)", match.getId(), rule.getId(),
                match.getEventCount());
        return Optional.of(match);
    }

    static double rawConfidence(int distinctMatchedConditions, boolean windowMatch) {
        double confidence = 0.5 + Math.min(0.1 * distinctMatchedConditions, 0.4) + (windowMatch ? 0.1 : 0.0);
        return Math.min(confidence, 1.0);
    }

    /**
     * Forget idempotency keys older than the retention.
     *
     * @return number of keys purged
     */
    public int purgeExpired() {
        long cutoff = clock.millis() - retentionMs;
        int before = assembled.size();
        assembled.values().removeIf(at -> at < cutoff);
        return before - assembled.size();
    }

    /** Number of remembered idempotency keys. */
    public int trackedKeys() {
        return assembled.size();
    }
}
