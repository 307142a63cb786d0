package com.correlationsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates Sigma detection rules into {@link RuleDefinition}s.
 *
 * <p>
 * Example Sigma rule:
 * </p>
 *
 * <pre>
 * title: Brute Force Attack
 * id: 5f1c...
 * level: high
 * logsource:
 *   category: authentication
 *   service: auth_failure
 * detection:
 *   selection:
 *     outcome: failure
 *     user|contains: admin
 *   filter:
 *     src_ip|startswith: '10.'
 *   condition: selection and not filter | count() by user &gt; 5
 *   timeframe: 5m
 * </pre>
 *
 * <h3>Mapping</h3>
 * <ul>
 * <li>{@code title} → name, {@code id} → id (the title in snake case when
 * absent), {@code level} → severity, {@code tags}, {@code description}</li>
 * <li>{@code logsource.category} → category, {@code logsource.service} →
 * sources</li>
 * <li>a selection map is an AND of its entries; a list of maps is an OR of
 * such ANDs; a list of plain strings is an OR of keyword searches on
 * {@value #KEYWORD_FIELD}</li>
 * <li>field modifiers {@code contains}, {@code startswith}, {@code endswith},
 * {@code re} and {@code all}; list values are OR-ed unless {@code all} is
 * given; plain values with {@code *}/{@code ?} wildcards become anchored
 * regexes. Matching is case-insensitive, as in Sigma.</li>
 * <li>{@code condition}: {@code and}, {@code or}, {@code not}, parentheses,
 * {@code 1 of pattern*}, {@code all of pattern*}, {@code them}</li>
 * <li>an aggregation suffix {@code | count() by field > N} with a
 * {@code timeframe} yields a correlation rule with threshold {@code N + 1}
 * ({@code N} for {@code >=} and {@code ==})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SigmaRuleParser {

    private static final Logger LOG = LoggerFactory.getLogger(SigmaRuleParser.class);

    /** Field searched by Sigma keyword lists. */
    public static final String KEYWORD_FIELD = "message";

    private static final Pattern AGGREGATION = Pattern.compile(
            "count\\(\\s*([\\w.]*)\\s*\\)\\s*(?:by\\s+([\\w.]+(?:\\s*,\\s*[\\w.]+)*))?\\s*(>=|>|==|=)\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TIMEFRAME = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)?", Pattern.CASE_INSENSITIVE);

    private SigmaRuleParser() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Parse a Sigma rule from its YAML text.
     *
     * @param yaml Sigma document
     * @return the equivalent rule definition
     * @throws InvalidRuleException if the document is not a usable Sigma rule
     */
    public static RuleDefinition parse(String yaml) {
        Objects.requireNonNull(yaml, "Sigma YAML must not be null");
        return translate(load(yaml));
    }

    /**
     * Parse a Sigma rule from a classpath resource.
     *
     * @param resource classpath resource name
     * @return the equivalent rule definition
     * @throws IllegalArgumentException if the resource does not exist or is invalid
     * @throws IllegalStateException    if reading fails
     */
    public static RuleDefinition fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = SigmaRuleParser.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return translate(load(is));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse a Sigma rule from a file.
     *
     * @param path path to the Sigma YAML file
     * @return the equivalent rule definition
     * @throws IllegalArgumentException if the file does not exist or is invalid
     * @throws IllegalStateException    if reading fails
     */
    public static RuleDefinition fromFile(String path) {
        Objects.requireNonNull(path, "Sigma file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            LOG.info("Loading Sigma rule from {}", path);
            return translate(load(is));
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Sigma file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read Sigma file: " + path, e);
        }
    }

    // ---------------------------------------------------------------
    // Document level
    // ---------------------------------------------------------------

    private static Object load(Object source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        try {
            return source instanceof String s ? yaml.load(s) : yaml.load((InputStream) source);
        } catch (YAMLException e) {
            throw new InvalidRuleException("<sigma>", List.of("Malformed Sigma YAML: " + e.getMessage()));
        }
    }

    private static RuleDefinition translate(Object document) {
        if (!(document instanceof Map<?, ?> doc)) {
            throw new InvalidRuleException("<sigma>", List.of("Sigma document must be a mapping"));
        }
        String title = text(doc.get("title"));
        String id = text(doc.get("id"));
        if (id == null && title != null) {
            id = title.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_|_$", "");
        }
        String label = id != null ? id : "<sigma>";

        List<String> errors = new ArrayList<>();
        if (title == null) {
            errors.add("Sigma rule must have a title");
        }
        if (!(doc.get("detection") instanceof Map<?, ?> detection) || detection.isEmpty()) {
            errors.add("Sigma rule must have a detection section");
            throw new InvalidRuleException(label, errors);
        }

        RuleDefinition def = new RuleDefinition();
        def.setId(id);
        def.setName(title);
        def.setDescription(text(doc.get("description")));
        def.setSeverity(doc.get("level") != null ? text(doc.get("level")) : "medium");
        def.setTags(stringList(doc.get("tags")));

        if (doc.get("logsource") instanceof Map<?, ?> logsource) {
            def.setCategory(text(logsource.get("category")));
            String service = text(logsource.get("service"));
            if (service != null) {
                def.setSources(List.of(service));
            }
        }

        Map<String, ConditionDefinition> selections = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : detection.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (name.equals("condition") || name.equals("timeframe")) {
                continue;
            }
            ConditionDefinition selection = selection(name, entry.getValue(), errors);
            if (selection != null) {
                selections.put(name, selection);
            }
        }

        List<String> expressions = detection.get("condition") instanceof List<?> list
                ? stringList(list)
                : detection.get("condition") != null ? List.of(text(detection.get("condition"))) : List.of();
        if (expressions.isEmpty()) {
            errors.add("detection.condition is required");
        }

        List<ConditionDefinition> branches = new ArrayList<>();
        Aggregation aggregation = null;
        for (String expression : expressions) {
            String[] parts = expression.split("\\|", 2);
            try {
                branches.add(new ExpressionParser(parts[0], selections).parse());
            } catch (IllegalArgumentException e) {
                errors.add("detection.condition '" + expression + "': " + e.getMessage());
            }
            if (parts.length == 2) {
                Aggregation parsed = aggregation(parts[1], errors);
                if (parsed != null) {
                    aggregation = parsed;
                }
            }
        }

        if (aggregation != null) {
            Object timeframe = detection.get("timeframe");
            if (timeframe == null) {
                errors.add("detection.timeframe is required for count() aggregations");
            } else {
                try {
                    def.setTimeWindowMs(parseTimeframe(timeframe));
                } catch (IllegalArgumentException e) {
                    errors.add("detection.timeframe: " + e.getMessage());
                }
            }
            def.setType("correlation");
            def.setCorrelationFields(aggregation.groupBy);
            def.setThreshold(aggregation.threshold);
        }

        if (!errors.isEmpty()) {
            throw new InvalidRuleException(label, errors);
        }

        def.setConditions(branches.size() == 1
                ? branches.get(0)
                : ConditionDefinition.composite("or", branches.toArray(new ConditionDefinition[0])));
        LOG.info("Translated Sigma rule '{}' into {} rule '{}'", title, def.getType(), def.getId());
        return def;
    }

    // ---------------------------------------------------------------
    // Selections
    // ---------------------------------------------------------------

    private static ConditionDefinition selection(String name, Object body, List<String> errors) {
        if (body instanceof Map<?, ?> map) {
            return fieldMap(name, map, errors);
        }
        if (body instanceof List<?> list && !list.isEmpty()) {
            List<ConditionDefinition> alternatives = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    ConditionDefinition c = fieldMap(name, map, errors);
                    if (c != null) {
                        alternatives.add(c);
                    }
                } else if (item != null) {
                    alternatives.add(keyword(String.valueOf(item)));
                }
            }
            return alternatives.isEmpty() ? null : anyOf(alternatives);
        }
        errors.add("detection." + name + ": selection must be a map or a list");
        return null;
    }

    private static ConditionDefinition fieldMap(String selection, Map<?, ?> map, List<String> errors) {
        List<ConditionDefinition> clauses = new ArrayList<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String[] key = String.valueOf(entry.getKey()).split("\\|");
            String field = key[0];
            List<String> modifiers = Arrays.asList(key).subList(1, key.length);
            ConditionDefinition clause = fieldClause(selection, field, modifiers, entry.getValue(), errors);
            if (clause != null) {
                clauses.add(clause);
            }
        }
        if (clauses.isEmpty()) {
            errors.add("detection." + selection + ": selection has no usable field");
            return null;
        }
        return clauses.size() == 1
                ? clauses.get(0)
                : ConditionDefinition.composite("and", clauses.toArray(new ConditionDefinition[0]));
    }

    private static ConditionDefinition fieldClause(String selection, String field, List<String> modifiers,
            Object value, List<String> errors) {
        boolean all = modifiers.contains("all");
        String mode = null;
        for (String modifier : modifiers) {
            switch (modifier) {
                case "contains", "startswith", "endswith", "re" -> mode = modifier;
                case "all" -> {
                }
                default -> {
                    errors.add("detection." + selection + "." + field + ": unsupported modifier '" + modifier + "'");
                    return null;
                }
            }
        }
        if (value == null) {
            errors.add("detection." + selection + "." + field + ": null values are not supported");
            return null;
        }

        List<Object> values = value instanceof List<?> list ? new ArrayList<>(list) : List.of(value);
        if (mode == null && !all && values.size() > 1 && values.stream().noneMatch(SigmaRuleParser::hasWildcard)) {
            ConditionDefinition in = ConditionDefinition.set("in", field, values);
            in.setCaseSensitive(false);
            return in;
        }

        List<ConditionDefinition> leaves = new ArrayList<>();
        for (Object v : values) {
            leaves.add(leaf(field, mode, v));
        }
        if (leaves.size() == 1) {
            return leaves.get(0);
        }
        return ConditionDefinition.composite(all ? "and" : "or", leaves.toArray(new ConditionDefinition[0]));
    }

    private static ConditionDefinition leaf(String field, String mode, Object value) {
        String text = String.valueOf(value);
        ConditionDefinition leaf;
        if (mode == null) {
            leaf = hasWildcard(value)
                    ? ConditionDefinition.leaf("regex", field, wildcardToRegex(text))
                    : ConditionDefinition.leaf("equals", field, value);
        } else {
            leaf = switch (mode) {
                case "contains" -> ConditionDefinition.leaf("contains", field, text);
                case "startswith" -> ConditionDefinition.leaf("regex", field, "^" + Pattern.quote(text));
                case "endswith" -> ConditionDefinition.leaf("regex", field, Pattern.quote(text) + "$");
                default -> ConditionDefinition.leaf("regex", field, text);
            };
        }
        leaf.setCaseSensitive(false);
        return leaf;
    }

    private static ConditionDefinition keyword(String keyword) {
        ConditionDefinition leaf = ConditionDefinition.leaf("contains", KEYWORD_FIELD, keyword);
        leaf.setCaseSensitive(false);
        return leaf;
    }

    private static boolean hasWildcard(Object value) {
        return value instanceof String s && (s.indexOf('*') >= 0 || s.indexOf('?') >= 0);
    }

    static String wildcardToRegex(String value) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.append('$').toString();
    }

    private static ConditionDefinition anyOf(List<ConditionDefinition> alternatives) {
        return alternatives.size() == 1
                ? alternatives.get(0)
                : ConditionDefinition.composite("or", alternatives.toArray(new ConditionDefinition[0]));
    }

    // ---------------------------------------------------------------
    // Aggregation & timeframe
    // ---------------------------------------------------------------

    private static final class Aggregation {
        private final List<String> groupBy;
        private final int threshold;

        private Aggregation(List<String> groupBy, int threshold) {
            this.groupBy = groupBy;
            this.threshold = threshold;
        }
    }

    private static Aggregation aggregation(String text, List<String> errors) {
        Matcher m = AGGREGATION.matcher(text.trim());
        if (!m.matches()) {
            errors.add("unsupported aggregation '" + text.trim() + "', expected 'count() by field > N'");
            return null;
        }
        if (!m.group(1).isEmpty()) {
            errors.add("aggregation 'count(" + m.group(1) + ")' is not supported, only 'count()' of matching events");
            return null;
        }
        List<String> groupBy = new ArrayList<>();
        if (m.group(2) != null) {
            for (String field : m.group(2).split(",")) {
                groupBy.add(field.trim());
            }
        } else {
            // no grouping: one window per organization
            groupBy.add("organizationId");
        }
        long threshold;
        try {
            long bound = Long.parseLong(m.group(4));
            threshold = m.group(3).equals(">") ? Math.addExact(bound, 1) : bound;
        } catch (NumberFormatException | ArithmeticException e) {
            // wider than a long
            threshold = Long.MAX_VALUE;
        }
        if (threshold > Integer.MAX_VALUE) {
            errors.add("aggregation threshold '" + m.group(4) + "' is out of range, at most " + Integer.MAX_VALUE);
            return null;
        }
        if (threshold < 1) {
            errors.add("aggregation threshold must be at least 1");
            return null;
        }
        return new Aggregation(groupBy, (int) threshold);
    }

    /**
     * Convert a Sigma timeframe ({@code 30s}, {@code 5m}, {@code 1h},
     * {@code 2d}; a bare number counts as seconds) to milliseconds.
     *
     * @param timeframe timeframe value
     * @return duration in milliseconds
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    static long parseTimeframe(Object timeframe) {
        if (timeframe instanceof Number n) {
            return n.longValue() * 1000L;
        }
        Matcher m = TIMEFRAME.matcher(String.valueOf(timeframe).trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("cannot parse timeframe '" + timeframe + "'");
        }
        String unit = m.group(2) != null ? m.group(2).toLowerCase(Locale.ROOT) : "s";
        long factor = switch (unit) {
            case "ms" -> 1L;
            case "m" -> 60_000L;
            case "h" -> 3_600_000L;
            case "d" -> 86_400_000L;
            default -> 1000L;
        };
        try {
            return Math.multiplyExact(Long.parseLong(m.group(1)), factor);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("timeframe '" + timeframe + "' is out of range", e);
        }
    }

    // ---------------------------------------------------------------
    // Condition expressions
    // ---------------------------------------------------------------

    /**
     * Recursive-descent parser for Sigma condition expressions.
     *
     * <pre>
     * expr    := and ('or' and)*
     * and     := not ('and' not)*
     * not     := 'not' not | primary
     * primary := '(' expr ')' | ('1' | 'all') 'of' pattern | selection
     * </pre>
     */
    private static final class ExpressionParser {

        private final List<String> tokens;
        private final Map<String, ConditionDefinition> selections;
        private int pos;

        ExpressionParser(String expression, Map<String, ConditionDefinition> selections) {
            this.tokens = tokenize(expression);
            this.selections = selections;
        }

        ConditionDefinition parse() {
            if (tokens.isEmpty()) {
                throw new IllegalArgumentException("empty condition");
            }
            ConditionDefinition result = or();
            if (pos < tokens.size()) {
                throw new IllegalArgumentException("unexpected token '" + tokens.get(pos) + "'");
            }
            return result;
        }

        private ConditionDefinition or() {
            List<ConditionDefinition> terms = new ArrayList<>();
            terms.add(and());
            while (accept("or")) {
                terms.add(and());
            }
            return combine("or", terms);
        }

        private ConditionDefinition and() {
            List<ConditionDefinition> terms = new ArrayList<>();
            terms.add(not());
            while (accept("and")) {
                terms.add(not());
            }
            return combine("and", terms);
        }

        private ConditionDefinition not() {
            if (accept("not")) {
                return ConditionDefinition.composite("not", not());
            }
            return primary();
        }

        private ConditionDefinition primary() {
            String token = next();
            if (token.equals("(")) {
                ConditionDefinition inner = or();
                if (!accept(")")) {
                    throw new IllegalArgumentException("missing ')'");
                }
                return inner.copy();
            }
            if ((token.equals("1") || token.equalsIgnoreCase("all")) && accept("of")) {
                List<ConditionDefinition> matched = selectionsMatching(next());
                return combine(token.equals("1") ? "or" : "and", matched);
            }
            ConditionDefinition selection = selections.get(token);
            if (selection == null) {
                throw new IllegalArgumentException("unknown selection '" + token + "'");
            }
            return selection.copy();
        }

        private List<ConditionDefinition> selectionsMatching(String pattern) {
            List<ConditionDefinition> matched = new ArrayList<>();
            for (Map.Entry<String, ConditionDefinition> entry : selections.entrySet()) {
                boolean hit = pattern.equals("them")
                        || (pattern.endsWith("*") && entry.getKey().startsWith(pattern.substring(0, pattern.length() - 1)))
                        || entry.getKey().equals(pattern);
                if (hit) {
                    matched.add(entry.getValue().copy());
                }
            }
            if (matched.isEmpty()) {
                throw new IllegalArgumentException("no selection matches '" + pattern + "'");
            }
            return matched;
        }

        private static ConditionDefinition combine(String op, List<ConditionDefinition> terms) {
            return terms.size() == 1
                    ? terms.get(0)
                    : ConditionDefinition.composite(op, terms.toArray(new ConditionDefinition[0]));
        }

        private boolean accept(String keyword) {
            if (pos < tokens.size() && tokens.get(pos).equalsIgnoreCase(keyword)) {
                pos++;
                return true;
            }
            return false;
        }

        private String next() {
            if (pos >= tokens.size()) {
                throw new IllegalArgumentException("unexpected end of condition");
            }
            return tokens.get(pos++);
        }

        private static List<String> tokenize(String expression) {
            List<String> tokens = new ArrayList<>();
            Matcher m = Pattern.compile("\\(|\\)|[^\\s()]+").matcher(expression);
            while (m.find()) {
                tokens.add(m.group());
            }
            return tokens;
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String s = String.valueOf(value).trim();
        return s.isEmpty() ? null : s;
    }

    private static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
        }
        return result;
    }
}
