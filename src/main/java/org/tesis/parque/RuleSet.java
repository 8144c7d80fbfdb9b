package org.tesis.parque;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Ordered, immutable table of rules. Loaded once per run from JSON:
 * <pre>
 * {"rules": [{"id": "...", "quantity": "SALABLE_FRACTION", "operator": "LE",
 *             "threshold": 0.85, "severity": "HARD", "message": "...", "weight": 1.0}]}
 * </pre>
 */
public final class RuleSet {

    public static final String DEFAULT_RESOURCE = "rules/default-rules.json";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final List<Rule> rules;

    public RuleSet(List<Rule> rules) {
        Set<String> ids = new HashSet<>();
        for (Rule r : rules) {
            if (!ids.add(r.getId())) throw new IllegalArgumentException("duplicate rule id " + r.getId());
        }
        this.rules = List.copyOf(rules);
    }

    /** Bundled default table. */
    public static RuleSet defaults() {
        try (InputStream in = RuleSet.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IllegalStateException("missing classpath resource " + DEFAULT_RESOURCE);
            return fromJson(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    public static RuleSet fromJson(InputStream in) throws IOException {
        return fromTree(objectMapper.readTree(in));
    }

    public static RuleSet fromJson(String json) throws IOException {
        return fromTree(objectMapper.readTree(json));
    }

    private static RuleSet fromTree(JsonNode root) {
        JsonNode array = root == null ? null : root.get("rules");
        if (array == null || !array.isArray()) throw new IllegalArgumentException("rule table needs a \"rules\" array");
        List<Rule> out = new ArrayList<>();
        for (JsonNode n : array) {
            String id = text(n, "id", null);
            try {
                Quantity q = Quantity.valueOf(text(n, "quantity", id).toUpperCase(Locale.ROOT));
                Operator op = Operator.valueOf(text(n, "operator", id).toUpperCase(Locale.ROOT));
                Severity sev = Severity.valueOf(text(n, "severity", id).toUpperCase(Locale.ROOT));
                JsonNode t = n.get("threshold");
                if (t == null || !t.isNumber()) throw new IllegalArgumentException("rule " + id + " needs a numeric threshold");
                JsonNode w = n.get("weight");
                JsonNode m = n.get("message");
                out.add(new Rule(id, q, op, t.asDouble(), sev, m == null ? null : m.asText(),
                        w == null ? 1.0 : w.asDouble()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid rule " + id + ": " + e.getMessage(), e);
            }
        }
        return new RuleSet(out);
    }

    private static String text(JsonNode n, String field, String ruleId) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull() || v.asText().isBlank())
            throw new IllegalArgumentException((ruleId == null ? "rule" : "rule " + ruleId) + " lacks \"" + field + "\"");
        return v.asText();
    }

    public List<Rule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
