package org.tesis.parque;

import java.util.Objects;

/**
 * One constraint as data: quantity, comparison, threshold and severity. The
 * weight scales the penalty a soft violation adds.
 */
public final class Rule {

    private final String id;
    private final Quantity quantity;
    private final Operator operator;
    private final double threshold;
    private final Severity severity;
    private final String message;
    private final double weight;

    public Rule(String id, Quantity quantity, Operator operator, double threshold, Severity severity,
                String message, double weight) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("rule id is required");
        this.id = id;
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.operator = Objects.requireNonNull(operator, "operator");
        if (!Double.isFinite(threshold)) throw new IllegalArgumentException("threshold of " + id + " must be finite");
        if (!(weight >= 0) || !Double.isFinite(weight)) throw new IllegalArgumentException("weight of " + id + " must be non-negative");
        this.threshold = threshold;
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = message == null ? id : message;
        this.weight = weight;
    }

    public Rule(String id, Quantity quantity, Operator operator, double threshold, Severity severity, String message) {
        this(id, quantity, operator, threshold, severity, message, 1.0);
    }

    /** Normalized distance from the threshold: |measured - threshold| / max(|threshold|, 1). */
    double magnitude(double measured) {
        return Math.abs(measured - threshold) / Math.max(Math.abs(threshold), 1.0);
    }

    public String getId() {
        return id;
    }

    public Quantity getQuantity() {
        return quantity;
    }

    public Operator getOperator() {
        return operator;
    }

    public double getThreshold() {
        return threshold;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return id + ": " + quantity + " " + operator.symbol() + " " + threshold + " (" + severity + ")";
    }
}
