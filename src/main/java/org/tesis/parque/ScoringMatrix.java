package org.tesis.parque;

import java.util.*;

/**
 * Seven-dimension score of a finished layout. Pure: reads the layout's
 * metrics, its violation report and its timeline, never the layout itself.
 */
public final class ScoringMatrix {

    /** penalty applied to the environmental score when a required detention pond is missing */
    static final double MISSING_POND_FACTOR = 0.75;

    private final ParameterSet params;

    public ScoringMatrix(ParameterSet params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    public ScoreVector score(LayoutMetrics m, ViolationReport report, TimelineResult timeline) {
        Map<ScoreDimension, Double> v = new EnumMap<>(ScoreDimension.class);
        double penalty = report.getSoftPenalty() == Double.MAX_VALUE ? 1e6 : report.getSoftPenalty();
        v.put(ScoreDimension.COMPLIANCE, 1.0 / (1.0 + report.getHardCount() + penalty));
        v.put(ScoreDimension.EFFICIENCY, Math.min(1.0, m.getSalableFraction() / params.getSalableAreaCeiling()));
        v.put(ScoreDimension.LOT_QUALITY, m.getLotQuality());
        v.put(ScoreDimension.FINANCIAL, financial(m));
        v.put(ScoreDimension.CONSTRUCTABILITY, timeline == null || timeline.getTotalDays() <= 0 ? 0.0
                : Math.min(1.0, (double) params.getTargetDurationDays() / timeline.getTotalDays()));
        v.put(ScoreDimension.ENVIRONMENTAL, environmental(m));
        int required = params.getInfrastructure().size();
        double placedShare = required == 0 ? 1.0 : (double) m.getPlacedKinds().size() / required;
        v.put(ScoreDimension.UTILITY_COVERAGE, m.getServiceCoverage() * placedShare);
        return new ScoreVector(v, params.getScoreWeights());
    }

    // margin over the value of the raw site at the salable price
    private double financial(LayoutMetrics m) {
        CostModel c = params.getCostModel();
        double revenue = m.getLotArea() * c.getPricePerSalableM2();
        double cost = m.getRoadArea() * c.getRoadCostPerM2()
                + m.getRoadLength() * c.getUtilityCostPerRoadM()
                + m.getInfrastructureArea() * c.getFacilityCostPerM2();
        return GeomUtils.clip01((revenue - cost) / (m.getSiteArea() * c.getPricePerSalableM2()));
    }

    private double environmental(LayoutMetrics m) {
        double s = Math.min(1.0, m.getGreenFraction() / params.getGreenTarget());
        for (InfrastructureRequirement r : params.getInfrastructure()) {
            if (r.getKind().isGreen() && !m.getPlacedKinds().contains(r.getKind())) {
                s *= MISSING_POND_FACTOR;
                break;
            }
        }
        return s;
    }

    /** Index of the best aggregate and of the best value per dimension; ties keep the earlier layout. */
    public static Comparison compare(List<ScoreVector> scores) {
        if (scores.isEmpty()) throw new IllegalArgumentException("nothing to compare");
        int best = 0;
        for (int i = 1; i < scores.size(); i++) {
            if (scores.get(i).getAggregate() > scores.get(best).getAggregate()) best = i;
        }
        EnumMap<ScoreDimension, Integer> byDim = new EnumMap<>(ScoreDimension.class);
        for (ScoreDimension d : ScoreDimension.values()) {
            int b = 0;
            for (int i = 1; i < scores.size(); i++) if (scores.get(i).get(d) > scores.get(b).get(d)) b = i;
            byDim.put(d, b);
        }
        return new Comparison(best, byDim);
    }

    public static final class Comparison {
        private final int bestOverall;
        private final Map<ScoreDimension, Integer> bestByDimension;

        Comparison(int bestOverall, Map<ScoreDimension, Integer> bestByDimension) {
            this.bestOverall = bestOverall;
            this.bestByDimension = Collections.unmodifiableMap(bestByDimension);
        }

        public int getBestOverall() {
            return bestOverall;
        }

        public Map<ScoreDimension, Integer> getBestByDimension() {
            return bestByDimension;
        }
    }
}
