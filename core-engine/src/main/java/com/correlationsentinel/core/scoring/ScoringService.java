package com.correlationsentinel.core.scoring;

import com.correlationsentinel.core.model.Alert;
import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.model.Match;
import com.correlationsentinel.core.model.RuleAction;
import com.correlationsentinel.core.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Scores matches, applies deduplication and builds alerts.
 *
 * <ol>
 * <li>Rules with action {@code SUPPRESS} never produce alerts.</li>
 * <li>The dedupe key is checked against the {@link Deduplicator}; an active
 * key suppresses the match.</li>
 * <li>Otherwise an {@link Alert} is built with the {@link ConfidenceScorer}
 * confidence, a title derived from the rule category, a description of the
 * triggering event, and the hosts, users and addresses involved.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class ScoringService {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringService.class);

    private static final Map<String, String> TITLE_PREFIXES = Map.of(
            "authentication", "Authentication Alert",
            "network", "Network Security",
            "malware", "Malware Detection",
            "data_exfiltration", "Data Exfiltration");
    private static final String DEFAULT_TITLE_PREFIX = "Security Alert";
    private static final String DEFAULT_DESCRIPTION = "Security incident detected based on correlation rule.";

    private final ConfidenceScorer scorer;
    private final Deduplicator deduplicator;
    private final Duration defaultSuppression;
    private final Clock clock;

    /**
     * @param scorer             confidence scorer
     * @param deduplicator       dedupe state
     * @param defaultSuppression interval used when a rule does not override it
     * @param clock              clock for {@code createdAt}
     */
    public ScoringService(ConfidenceScorer scorer, Deduplicator deduplicator, Duration defaultSuppression,
            Clock clock) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator must not be null");
        this.defaultSuppression = Objects.requireNonNull(defaultSuppression, "defaultSuppression must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param rule  the rule that produced the match
     * @param match the match
     * @return the decision, carrying the alert when one should be emitted
     */
    public ScoringDecision process(Rule rule, Match match) {
        int confidence = scorer.score(rule, match);
        String dedupeKey = DedupeKeys.compute(rule, match);

        if (rule.getAction() == RuleAction.SUPPRESS) {
            LOG.debug("Rule '{}' is a suppression rule; match {} not alerted", rule.getId(), match.getId());
            return new ScoringDecision(ScoringDecision.Disposition.SUPPRESSED_BY_RULE, confidence, dedupeKey, null);
        }
        Duration interval = rule.getSuppressionInterval().orElse(defaultSuppression);
        if (!deduplicator.offer(dedupeKey, interval)) {
            return new ScoringDecision(ScoringDecision.Disposition.DUPLICATE, confidence, dedupeKey, null);
        }

        Alert alert = Alert.builder()
                .id(UUID.nameUUIDFromBytes(("alert|" + match.getId()).getBytes(StandardCharsets.UTF_8)).toString())
                .match(match)
                .ruleName(rule.getName())
                .organizationId(match.getOrganizationId())
                .severity(rule.getSeverity())
                .confidence(confidence)
                .dedupeKey(dedupeKey)
                .title(title(rule))
                .description(description(rule, match))
                .affectedAssets(affectedAssets(match))
                .tags(rule.getTags())
                .createdAt(clock.instant())
                .build();
        LOG.info("Alert {} raised by rule '{}' (severity={}, confidence={}, events={})",
                alert.getId(), rule.getId(), alert.getSeverity(), confidence, match.getEventCount());
        return new ScoringDecision(ScoringDecision.Disposition.EMIT, confidence, dedupeKey, alert);
    }

    static String title(Rule rule) {
        String category = rule.getCategory() != null ? rule.getCategory().toLowerCase(Locale.ROOT) : "";
        return TITLE_PREFIXES.getOrDefault(category, DEFAULT_TITLE_PREFIX) + ": " + rule.getName();
    }

    static String description(Rule rule, Match match) {
        EventRef trigger = match.getTriggerEvent();
        StringBuilder sb = new StringBuilder(rule.getDescription() != null ? rule.getDescription() : DEFAULT_DESCRIPTION);
        sb.append("\n\nTriggering Event:")
                .append("\n- Event ID: ").append(trigger.getEventId())
                .append("\n- Source: ").append(trigger.getSourceIdentifier())
                .append("\n- Time: ").append(trigger.getTimestamp());
        if (match.isWindowMatch()) {
            sb.append("\n\nCorrelation:")
                    .append("\n- Events: ").append(match.getEventCount())
                    .append(" (threshold ").append(match.getThreshold()).append(')')
                    .append("\n- Key: ").append(String.join(", ", match.getCorrelationKey()))
                    .append("\n- First event: ").append(match.getFirstEventTime())
                    .append("\n- Last event: ").append(match.getLastEventTime());
        }
        if (!match.getMatchedConditions().isEmpty()) {
            sb.append("\n\nMatched Conditions:");
            for (String condition : match.getMatchedConditions()) {
                sb.append("\n- ").append(condition);
            }
        }
        return sb.toString();
    }

    static List<String> affectedAssets(Match match) {
        Set<String> assets = new LinkedHashSet<>();
        for (EventRef ref : match.getEventRefs()) {
            first(ref, "host", "computer_name").ifPresent(assets::add);
            first(ref, "user", "user_name").ifPresent(v -> assets.add("user:" + v));
            first(ref, "ip", "ip_address", "source_ip").ifPresent(v -> assets.add("ip:" + v));
            EventFields.resolve(ref, "metadata.target_host").map(String::valueOf).ifPresent(assets::add);
        }
        return new ArrayList<>(assets);
    }

    private static Optional<String> first(EventRef ref, String... fields) {
        for (String field : fields) {
            Optional<Object> value = EventFields.resolve(ref, field);
            if (value.isPresent() && !String.valueOf(value.get()).isBlank()) {
                return value.map(String::valueOf);
            }
        }
        return Optional.empty();
    }

    public Deduplicator getDeduplicator() {
        return deduplicator;
    }
}
