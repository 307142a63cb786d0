package com.correlationsentinel.core.scoring;

import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.model.EventRef;
import com.correlationsentinel.core.model.Match;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.rule.WindowedRule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives deduplication keys.
 *
 * <p>
 * {@code key = sha256(ruleId | organizationId | normalized)} where
 * {@code normalized} is the sorted list of {@code field=value} pairs, trimmed
 * and lower-cased, of the rule's {@link Rule#effectiveDedupeFields() dedupe
 * fields}. Values come from the window's correlation key when the field is a
 * correlation field, otherwise from the most recent participating event. A
 * rule without dedupe fields uses the fields that satisfied its conditions.
 * </p>
 *
 * @since 1.0.0
 */
public final class DedupeKeys {

    private DedupeKeys() {
        // utility class, not instantiable
    }

    /**
     * @param rule  the rule that produced the match
     * @param match the match
     * @return hex-encoded SHA-256 key
     */
    public static String compute(Rule rule, Match match) {
        return hash(rule.getId() + "|" + match.getOrganizationId() + "|" + normalizedKey(rule, match));
    }

    static String normalizedKey(Rule rule, Match match) {
        List<EventRef> refs = match.getEventRefs();
        EventRef latest = refs.get(refs.size() - 1);
        List<String> pairs = new ArrayList<>();

        List<String> fields = rule.effectiveDedupeFields();
        if (fields.isEmpty()) {
            for (Map.Entry<String, Object> e : latest.getMatchedFields().entrySet()) {
                pairs.add(pair(e.getKey(), Event.render(e.getValue())));
            }
        } else {
            for (String field : fields) {
                pairs.add(pair(field, valueOf(rule, match, latest, field)));
            }
        }
        pairs.sort(null);
        return String.join(",", pairs);
    }

    private static String valueOf(Rule rule, Match match, EventRef latest, String field) {
        if (rule instanceof WindowedRule windowed && match.isWindowMatch()) {
            int index = windowed.getCorrelationFields().indexOf(field);
            if (index >= 0 && index < match.getCorrelationKey().size()) {
                return match.getCorrelationKey().get(index);
            }
        }
        return EventFields.resolve(latest, field).map(Event::render).orElse("");
    }

    private static String pair(String field, String value) {
        return field.trim().toLowerCase(Locale.ROOT) + "=" + value.trim().toLowerCase(Locale.ROOT);
    }

    private static String hash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
