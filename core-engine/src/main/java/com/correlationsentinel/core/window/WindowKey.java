package com.correlationsentinel.core.window;

import com.correlationsentinel.core.model.Event;
import com.correlationsentinel.core.rule.WindowedRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Identity of a correlation window: rule, organization and the values of the
 * rule's correlation fields, rendered by {@link Event#render(Object)}.
 *
 * <p>
 * {@link #hashCode()} only depends on string content, so it is stable across
 * processes and is used both for shard selection and for worker-lane routing.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowKey {

    private final String ruleId;
    private final String organizationId;
    private final List<String> values;
    private final int hash;

    public WindowKey(String ruleId, String organizationId, List<String> values) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.organizationId = organizationId;
        this.values = List.copyOf(values);
        this.hash = Objects.hash(ruleId, organizationId, this.values);
    }

    /**
     * Derive the key of the window an event belongs to.
     *
     * @param rule  correlation or sequence rule
     * @param event candidate event
     * @return the key, or empty when any correlation field is absent or null
     */
    public static Optional<WindowKey> of(WindowedRule rule, Event event) {
        List<String> values = new ArrayList<>(rule.getCorrelationFields().size());
        for (String field : rule.getCorrelationFields()) {
            Optional<String> value = event.getStringField(field);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            values.add(value.get());
        }
        return Optional.of(new WindowKey(rule.getId(), event.getOrganizationId(), values));
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    /** Correlation field values, in the rule's field order. */
    public List<String> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowKey that))
            return false;
        return ruleId.equals(that.ruleId)
                && Objects.equals(organizationId, that.organizationId)
                && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return ruleId + "|" + organizationId + "|" + String.join(",", values);
    }
}
