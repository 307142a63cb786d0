package com.correlationsentinel.core.config;

import com.correlationsentinel.core.model.RuleAction;
import com.correlationsentinel.core.model.Severity;
import com.correlationsentinel.core.rule.CorrelationRule;
import com.correlationsentinel.core.rule.Rule;
import com.correlationsentinel.core.rule.RuleType;
import com.correlationsentinel.core.rule.SequenceRule;
import com.correlationsentinel.core.rule.SequenceStep;
import com.correlationsentinel.core.rule.SingleEventRule;
import com.correlationsentinel.core.rule.condition.AndCondition;
import com.correlationsentinel.core.rule.condition.Condition;
import com.correlationsentinel.core.rule.condition.FieldContains;
import com.correlationsentinel.core.rule.condition.FieldEquals;
import com.correlationsentinel.core.rule.condition.FieldInSet;
import com.correlationsentinel.core.rule.condition.FieldNumericComparison;
import com.correlationsentinel.core.rule.condition.FieldRegexMatches;
import com.correlationsentinel.core.rule.condition.NotCondition;
import com.correlationsentinel.core.rule.condition.OrCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles {@link RuleDefinition}s into immutable, executable {@link Rule}s.
 *
 * <p>
 * Compilation happens once, when a rule is loaded or changed through the
 * registry. Every problem in the definition (structural fields as well as the
 * condition tree) is collected and reported in one
 * {@link InvalidRuleException}; condition errors carry the path of the
 * offending node, e.g. {@code conditions.and[1].regex}.
 * </p>
 *
 * <p>
 * Case handling of leaf operators when {@code caseSensitive} is not given:
 * {@code contains} and {@code regex} ignore case, {@code equals}, {@code in}
 * and {@code not_in} compare exactly.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(RuleCompiler.class);

    private RuleCompiler() {
        // utility class, not instantiable
    }

    /**
     * Compile a definition as version 1.
     *
     * @param definition rule definition; must not be {@code null}
     * @return the compiled rule
     * @throws InvalidRuleException if the definition is malformed
     */
    public static Rule compile(RuleDefinition definition) {
        return compile(definition, 1L);
    }

    /**
     * Compile a definition.
     *
     * @param definition rule definition; must not be {@code null}
     * @param version    version number given to the compiled rule
     * @return the compiled rule
     * @throws InvalidRuleException if the definition is malformed
     */
    public static Rule compile(RuleDefinition definition, long version) {
        Objects.requireNonNull(definition, "Rule definition must not be null");
        String ruleId = definition.getId() != null ? definition.getId() : "<unnamed>";

        List<String> errors = new ArrayList<>(definition.validationErrors());
        Condition condition = null;
        if (definition.getConditions() != null) {
            condition = compileCondition(definition.getConditions(), "conditions", errors);
        }
        List<SequenceStep> steps = new ArrayList<>();
        if (errors.isEmpty() && RuleType.parse(definition.getType()) == RuleType.SEQUENCE) {
            for (int i = 0; i < definition.getSteps().size(); i++) {
                SequenceStepDefinition step = definition.getSteps().get(i);
                Condition stepCondition = compileCondition(step.getConditions(), "steps[" + i + "].conditions", errors);
                if (stepCondition != null) {
                    String name = step.getName() != null && !step.getName().isBlank() ? step.getName() : "step" + (i + 1);
                    steps.add(new SequenceStep(name, stepCondition,
                            step.getTimeoutMs() != null ? step.getTimeoutMs() : SequenceStep.DEFAULT_TIMEOUT_MS));
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new InvalidRuleException(ruleId, errors);
        }

        RuleType type = RuleType.parse(definition.getType());
        Rule.Builder<?> builder;
        if (type == RuleType.CORRELATION) {
            builder = CorrelationRule.builder()
                    .correlationFields(definition.getCorrelationFields())
                    .timeWindowMs(definition.getTimeWindowMs())
                    .threshold(definition.getThreshold());
        } else if (type == RuleType.SEQUENCE) {
            builder = SequenceRule.builder()
                    .steps(steps)
                    .ordered(definition.isOrdered())
                    .correlationFields(definition.getCorrelationFields())
                    .timeWindowMs(definition.getTimeWindowMs());
        } else {
            builder = SingleEventRule.builder();
        }

        builder.id(definition.getId())
                .name(definition.getName())
                .description(definition.getDescription())
                .organizationId(blankToNull(definition.getOrganizationId()))
                .enabled(definition.isEnabled())
                .severity(Severity.parse(definition.getSeverity()))
                .tags(definition.getTags())
                .category(definition.getCategory())
                .sources(new LinkedHashSet<>(definition.getSources()))
                .action(RuleAction.parse(definition.getAction()))
                .baseConfidence(definition.getBaseConfidence())
                .dedupeFields(definition.getDedupeFields())
                .suppressionInterval(definition.getSuppressionIntervalMs() != null
                        ? Duration.ofMillis(definition.getSuppressionIntervalMs())
                        : null)
                .version(version)
                .definition(definition);

        if (condition != null) {
            builder.conditions(condition);
        }
        Rule rule = builder.build();
        LOG.debug("Compiled rule '{}' v{}: {}", rule.getId(), version, rule.getConditions().describe());
        return rule;
    }

    // ---------------------------------------------------------------
    // Condition tree
    // ---------------------------------------------------------------

    private static Condition compileCondition(ConditionDefinition def, String path, List<String> errors) {
        if (def == null) {
            errors.add(path + ": condition must not be null");
            return null;
        }
        String op = def.getOp() != null ? def.getOp().trim().toLowerCase(Locale.ROOT) : null;
        if (op == null || op.isEmpty()) {
            errors.add(path + ": 'op' is required");
            return null;
        }
        String nodePath = path + "." + op;

        switch (op) {
            case "and":
            case "or": {
                List<Condition> children = compileChildren(def, nodePath, errors);
                if (children == null) {
                    return null;
                }
                return op.equals("and") ? new AndCondition(children) : new OrCondition(children);
            }
            case "not": {
                List<ConditionDefinition> raw = def.getConditions();
                if (raw == null || raw.size() != 1) {
                    errors.add(nodePath + ": 'not' requires exactly one child condition, got "
                            + (raw == null ? 0 : raw.size()));
                    return null;
                }
                Condition child = compileCondition(raw.get(0), nodePath + "[0]", errors);
                return child != null ? new NotCondition(child) : null;
            }
            case "equals":
            case "contains":
            case "regex":
            case "gt":
            case "lt":
                return compileComparison(op, def, nodePath, errors);
            case "in":
            case "not_in":
                return compileSet(op, def, nodePath, errors);
            default:
                errors.add(path + ": unknown operator '" + def.getOp() + "'");
                return null;
        }
    }

    private static List<Condition> compileChildren(ConditionDefinition def, String path, List<String> errors) {
        List<ConditionDefinition> raw = def.getConditions();
        if (raw == null || raw.isEmpty()) {
            errors.add(path + ": combinator requires at least one child condition");
            return null;
        }
        List<Condition> children = new ArrayList<>(raw.size());
        boolean failed = false;
        for (int i = 0; i < raw.size(); i++) {
            Condition child = compileCondition(raw.get(i), path + "[" + i + "]", errors);
            if (child == null) {
                failed = true;
            } else {
                children.add(child);
            }
        }
        return failed ? null : children;
    }

    private static Condition compileComparison(String op, ConditionDefinition def, String path, List<String> errors) {
        String field = def.getField();
        Object value = def.getValue();
        boolean ok = true;
        if (field == null || field.isBlank()) {
            errors.add(path + ": 'field' is required");
            ok = false;
        }
        if (value == null) {
            errors.add(path + ": 'value' is required");
            ok = false;
        }
        if (!ok) {
            return null;
        }

        switch (op) {
            case "equals":
                return new FieldEquals(field, value, caseSensitive(def, true));
            case "contains":
                return new FieldContains(field, String.valueOf(value), caseSensitive(def, false));
            case "regex":
                try {
                    return new FieldRegexMatches(field, String.valueOf(value), caseSensitive(def, false));
                } catch (PatternSyntaxException e) {
                    errors.add(path + ": invalid regex '" + value + "': " + e.getDescription());
                    return null;
                }
            default:
                Double bound = numeric(value);
                if (bound == null) {
                    errors.add(path + ": '" + op + "' requires a numeric value, got '" + value + "'");
                    return null;
                }
                return new FieldNumericComparison(field,
                        op.equals("gt") ? FieldNumericComparison.Operator.GREATER_THAN
                                : FieldNumericComparison.Operator.LESS_THAN,
                        bound);
        }
    }

    private static Condition compileSet(String op, ConditionDefinition def, String path, List<String> errors) {
        String field = def.getField();
        List<Object> values = def.getValues();
        if (values == null && def.getValue() instanceof List<?> list) {
            values = new ArrayList<>(list);
        }
        boolean ok = true;
        if (field == null || field.isBlank()) {
            errors.add(path + ": 'field' is required");
            ok = false;
        }
        if (values == null || values.isEmpty()) {
            errors.add(path + ": 'values' must contain at least one entry");
            ok = false;
        }
        if (!ok) {
            return null;
        }
        return new FieldInSet(field, values, caseSensitive(def, true), op.equals("not_in"));
    }

    private static boolean caseSensitive(ConditionDefinition def, boolean defaultValue) {
        return def.getCaseSensitive() != null ? def.getCaseSensitive() : defaultValue;
    }

    private static Double numeric(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
