package com.correlationsentinel.core.rule;

import java.util.List;

/**
 * A rule whose state lives in windows keyed by the values of its
 * correlation fields.
 *
 * @since 1.0.0
 */
public interface WindowedRule {

    String getId();

    long getVersion();

    /** Fields whose values, in this order, form the window key. */
    List<String> getCorrelationFields();

    /** Window length, measured from the first event of the window. */
    long getTimeWindowMs();
}
