package org.tesis.parque;

import java.util.Objects;

/**
 * A rule that failed for one layout, with what was measured.
 */
public final class Violation {

    private final String ruleId;
    private final Severity severity;
    private final double magnitude;
    private final double measured;
    private final double threshold;
    private final String message;

    public Violation(String ruleId, Severity severity, double magnitude, double measured, double threshold, String message) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.magnitude = magnitude;
        this.measured = measured;
        this.threshold = threshold;
        this.message = Objects.requireNonNull(message, "message");
    }

    public String getRuleId() {
        return ruleId;
    }

    public Severity getSeverity() {
        return severity;
    }

    /** Normalized distance from the threshold. */
    public double getMagnitude() {
        return magnitude;
    }

    public double getMeasured() {
        return measured;
    }

    public double getThreshold() {
        return threshold;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Violation that)) return false;
        return Double.compare(magnitude, that.magnitude) == 0
                && Double.compare(measured, that.measured) == 0
                && Double.compare(threshold, that.threshold) == 0
                && ruleId.equals(that.ruleId) && severity == that.severity && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, severity, magnitude, measured, threshold, message);
    }

    @Override
    public String toString() {
        return ruleId + "[" + severity + "] measured=" + measured + " threshold=" + threshold + ": " + message;
    }
}
