package org.tesis.parque;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a layout against a rule table. Holds no mutable state: the same
 * layout and rules always give an equal report.
 */
public final class ComplianceValidator {

    private final RuleSet rules;

    public ComplianceValidator(RuleSet rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public RuleSet getRules() {
        return rules;
    }

    public ViolationReport validate(CandidateLayout layout, ParameterSet params) {
        return validate(LayoutMetrics.of(layout, params));
    }

    public ViolationReport validate(LayoutMetrics metrics) {
        Map<String, Violation> violations = new LinkedHashMap<>();
        Map<String, Double> measured = new LinkedHashMap<>();
        double penalty = 0;
        for (Rule r : rules.getRules()) {
            double m = metrics.measure(r.getQuantity());
            if (Double.isNaN(m)) continue;
            measured.put(r.getId(), m);
            if (r.getOperator().holds(m, r.getThreshold())) continue;
            double magnitude = r.magnitude(m);
            violations.put(r.getId(), new Violation(r.getId(), r.getSeverity(), magnitude, m, r.getThreshold(), r.getMessage()));
            if (r.getSeverity() == Severity.SOFT) penalty += r.getWeight() * magnitude;
        }
        return new ViolationReport(violations, measured, penalty);
    }
}
