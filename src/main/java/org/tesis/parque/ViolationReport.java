package org.tesis.parque;

import java.util.*;

/**
 * Outcome of validating one layout: violations keyed by rule id, the
 * measured value of every applicable rule, and the derived hard count and
 * soft penalty.
 */
public final class ViolationReport {

    private final SortedMap<String, Violation> violations;
    private final SortedMap<String, Double> measurements;
    private final int hardCount;
    private final double softPenalty;

    ViolationReport(Map<String, Violation> violations, Map<String, Double> measurements, double softPenalty) {
        this.violations = Collections.unmodifiableSortedMap(new TreeMap<>(violations));
        this.measurements = Collections.unmodifiableSortedMap(new TreeMap<>(measurements));
        int hard = 0;
        for (Violation v : violations.values()) if (v.getSeverity() == Severity.HARD) hard++;
        this.hardCount = hard;
        this.softPenalty = softPenalty;
    }

    /** Report of a layout that could not be built: one hard violation, maximal penalty. */
    static ViolationReport unbuildable(String reason) {
        Violation v = new Violation("layout-buildable", Severity.HARD, 1.0, Double.NaN, Double.NaN, reason);
        return new ViolationReport(Map.of(v.getRuleId(), v), Map.of(), Double.MAX_VALUE);
    }

    public SortedMap<String, Violation> getViolations() {
        return violations;
    }

    /** Measured value per evaluated rule id; rules that did not apply are absent. */
    public SortedMap<String, Double> getMeasurements() {
        return measurements;
    }

    public int getHardCount() {
        return hardCount;
    }

    public int getSoftCount() {
        return violations.size() - hardCount;
    }

    /** Sum of weight x magnitude over soft violations. */
    public double getSoftPenalty() {
        return softPenalty;
    }

    public boolean isCompliant() {
        return hardCount == 0;
    }

    public List<Violation> bySeverity(Severity s) {
        List<Violation> out = new ArrayList<>();
        for (Violation v : violations.values()) if (v.getSeverity() == s) out.add(v);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ViolationReport that)) return false;
        return hardCount == that.hardCount && Double.compare(softPenalty, that.softPenalty) == 0
                && violations.equals(that.violations) && measurements.equals(that.measurements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(violations, measurements, hardCount, softPenalty);
    }

    @Override
    public String toString() {
        return "ViolationReport{hard=" + hardCount + ", soft=" + getSoftCount() + ", penalty=" + softPenalty
                + ", violations=" + violations.keySet() + "}";
    }
}
