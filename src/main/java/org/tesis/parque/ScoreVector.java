package org.tesis.parque;

import java.util.*;

/**
 * Normalized score per dimension plus their weighted aggregate, all in [0, 1].
 */
public final class ScoreVector {

    private final Map<ScoreDimension, Double> values;
    private final double aggregate;

    ScoreVector(Map<ScoreDimension, Double> values, Map<ScoreDimension, Double> weights) {
        EnumMap<ScoreDimension, Double> v = new EnumMap<>(ScoreDimension.class);
        double sum = 0, wsum = 0;
        for (ScoreDimension d : ScoreDimension.values()) {
            Double x = values.get(d);
            if (x == null) throw new IllegalArgumentException("missing score for " + d);
            double clipped = GeomUtils.clip01(x);
            v.put(d, clipped);
            double w = weights.getOrDefault(d, 1.0);
            sum += w * clipped;
            wsum += w;
        }
        this.values = Collections.unmodifiableMap(v);
        this.aggregate = wsum <= 0 ? 0 : sum / wsum;
    }

    /** All dimensions at zero, for layouts that could not be built. */
    static ScoreVector zero(Map<ScoreDimension, Double> weights) {
        Map<ScoreDimension, Double> v = new EnumMap<>(ScoreDimension.class);
        for (ScoreDimension d : ScoreDimension.values()) v.put(d, 0.0);
        return new ScoreVector(v, weights);
    }

    public double get(ScoreDimension d) {
        return values.get(d);
    }

    public Map<ScoreDimension, Double> getValues() {
        return values;
    }

    public double getAggregate() {
        return aggregate;
    }

    /** Letter grade of the aggregate, A+ down to F. */
    public String grade() {
        return grade(aggregate);
    }

    static String grade(double score) {
        if (score >= 0.95) return "A+";
        if (score >= 0.90) return "A";
        if (score >= 0.85) return "B+";
        if (score >= 0.80) return "B";
        if (score >= 0.75) return "C+";
        if (score >= 0.70) return "C";
        if (score >= 0.65) return "D+";
        if (score >= 0.60) return "D";
        return "F";
    }

    @Override
    public String toString() {
        return "ScoreVector{aggregate=" + aggregate + ", grade=" + grade() + ", " + values + "}";
    }
}
