package org.tesis.parque;

import java.util.*;

/**
 * Immutable targets for one optimization run: lot sizes, road widths,
 * buffers, required facilities, score weights and unit costs.
 */
public final class ParameterSet {

    private final double lotSizeMin;
    private final double lotSizeTarget;
    private final double lotSizeMax;
    private final int minLotCount;
    private final IndustryType industryType;
    private final List<InfrastructureRequirement> infrastructure;
    private final double salableAreaTarget;
    private final double salableAreaCeiling;
    private final double primaryRoadWidth;
    private final double secondaryRoadWidth;
    private final double perimeterBuffer;
    private final int entranceCount;
    private final double entranceClearance;
    private final double entranceCornerSetback;
    private final double maxAspectRatio;
    private final double serviceDistance;
    private final double greenTarget;
    private final int targetDurationDays;
    private final Map<ScoreDimension, Double> scoreWeights;
    private final CostModel costModel;
    private final ElevationModel elevationModel;

    private ParameterSet(Builder b) {
        this.lotSizeMin = b.lotSizeMin;
        this.lotSizeMax = b.lotSizeMax;
        this.lotSizeTarget = b.lotSizeTarget > 0 ? b.lotSizeTarget : (b.lotSizeMin + b.lotSizeMax) / 2.0;
        this.minLotCount = b.minLotCount;
        this.industryType = b.industryType;
        double factor = b.industryType.bufferFactor();
        List<InfrastructureRequirement> reqs = new ArrayList<>();
        for (InfrastructureRequirement r : b.infrastructure) {
            reqs.add(factor == 1.0 ? r : r.withExclusionRadius(r.getExclusionRadius() * factor));
        }
        this.infrastructure = Collections.unmodifiableList(reqs);
        this.salableAreaTarget = b.salableAreaTarget;
        this.salableAreaCeiling = b.salableAreaCeiling;
        this.primaryRoadWidth = b.primaryRoadWidth;
        this.secondaryRoadWidth = b.secondaryRoadWidth;
        this.perimeterBuffer = b.perimeterBuffer != null ? b.perimeterBuffer : 10.0 * factor;
        this.entranceCount = b.entranceCount;
        this.entranceClearance = b.entranceClearance;
        this.entranceCornerSetback = b.entranceCornerSetback;
        this.maxAspectRatio = b.maxAspectRatio;
        this.serviceDistance = b.serviceDistance;
        this.greenTarget = b.greenTarget;
        this.targetDurationDays = b.targetDurationDays;
        EnumMap<ScoreDimension, Double> w = new EnumMap<>(ScoreDimension.class);
        for (ScoreDimension d : ScoreDimension.values()) w.put(d, b.scoreWeights.getOrDefault(d, 1.0));
        this.scoreWeights = Collections.unmodifiableMap(w);
        this.costModel = b.costModel;
        this.elevationModel = b.elevationModel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ParameterSet defaults() {
        return builder().build();
    }

    public double getLotSizeMin() {
        return lotSizeMin;
    }

    public double getLotSizeTarget() {
        return lotSizeTarget;
    }

    public double getLotSizeMax() {
        return lotSizeMax;
    }

    public int getMinLotCount() {
        return minLotCount;
    }

    public IndustryType getIndustryType() {
        return industryType;
    }

    /** Required facilities in placement priority order. */
    public List<InfrastructureRequirement> getInfrastructure() {
        return infrastructure;
    }

    public double getSalableAreaTarget() {
        return salableAreaTarget;
    }

    public double getSalableAreaCeiling() {
        return salableAreaCeiling;
    }

    public double getPrimaryRoadWidth() {
        return primaryRoadWidth;
    }

    public double getSecondaryRoadWidth() {
        return secondaryRoadWidth;
    }

    public double getPerimeterBuffer() {
        return perimeterBuffer;
    }

    public int getEntranceCount() {
        return entranceCount;
    }

    public double getEntranceClearance() {
        return entranceClearance;
    }

    public double getEntranceCornerSetback() {
        return entranceCornerSetback;
    }

    public double getMaxAspectRatio() {
        return maxAspectRatio;
    }

    public double getServiceDistance() {
        return serviceDistance;
    }

    public double getGreenTarget() {
        return greenTarget;
    }

    public int getTargetDurationDays() {
        return targetDurationDays;
    }

    public Map<ScoreDimension, Double> getScoreWeights() {
        return scoreWeights;
    }

    public CostModel getCostModel() {
        return costModel;
    }

    public ElevationModel getElevationModel() {
        return elevationModel;
    }

    public static final class Builder {
        private double lotSizeMin = 1000;
        private double lotSizeTarget = 0;
        private double lotSizeMax = 3000;
        private int minLotCount = 1;
        private IndustryType industryType = IndustryType.LIGHT_MANUFACTURING;
        private List<InfrastructureRequirement> infrastructure = defaultInfrastructure();
        private double salableAreaTarget = 0.75;
        private double salableAreaCeiling = 0.85;
        private double primaryRoadWidth = 16;
        private double secondaryRoadWidth = 12;
        private Double perimeterBuffer;
        private int entranceCount = 1;
        private double entranceClearance = 30;
        private double entranceCornerSetback = 50;
        private double maxAspectRatio = 4.0;
        private double serviceDistance = 100;
        private double greenTarget = 0.15;
        private int targetDurationDays = 365;
        private Map<ScoreDimension, Double> scoreWeights = new EnumMap<>(ScoreDimension.class);
        private CostModel costModel = CostModel.defaults();
        private ElevationModel elevationModel = ElevationModel.FLAT;

        private Builder() {
        }

        private static List<InfrastructureRequirement> defaultInfrastructure() {
            List<InfrastructureRequirement> list = new ArrayList<>();
            for (InfrastructureKind k : InfrastructureKind.values()) list.add(InfrastructureRequirement.defaults(k));
            return list;
        }

        public Builder lotSize(double min, double target, double max) {
            this.lotSizeMin = min;
            this.lotSizeTarget = target;
            this.lotSizeMax = max;
            return this;
        }

        public Builder minLotCount(int minLotCount) {
            this.minLotCount = minLotCount;
            return this;
        }

        public Builder industryType(IndustryType industryType) {
            this.industryType = Objects.requireNonNull(industryType, "industryType");
            return this;
        }

        public Builder infrastructure(List<InfrastructureRequirement> requirements) {
            this.infrastructure = new ArrayList<>(requirements);
            return this;
        }

        /** Enables only the given kinds, with default rules, in the given priority order. */
        public Builder infrastructureKinds(InfrastructureKind... kinds) {
            List<InfrastructureRequirement> list = new ArrayList<>();
            for (InfrastructureKind k : kinds) list.add(InfrastructureRequirement.defaults(k));
            this.infrastructure = list;
            return this;
        }

        public Builder salableArea(double target, double ceiling) {
            this.salableAreaTarget = target;
            this.salableAreaCeiling = ceiling;
            return this;
        }

        public Builder roadWidths(double primary, double secondary) {
            this.primaryRoadWidth = primary;
            this.secondaryRoadWidth = secondary;
            return this;
        }

        public Builder perimeterBuffer(double perimeterBuffer) {
            this.perimeterBuffer = perimeterBuffer;
            return this;
        }

        public Builder entrances(int count, double clearance, double cornerSetback) {
            this.entranceCount = count;
            this.entranceClearance = clearance;
            this.entranceCornerSetback = cornerSetback;
            return this;
        }

        public Builder maxAspectRatio(double maxAspectRatio) {
            this.maxAspectRatio = maxAspectRatio;
            return this;
        }

        public Builder serviceDistance(double serviceDistance) {
            this.serviceDistance = serviceDistance;
            return this;
        }

        public Builder greenTarget(double greenTarget) {
            this.greenTarget = greenTarget;
            return this;
        }

        public Builder targetDurationDays(int days) {
            this.targetDurationDays = days;
            return this;
        }

        public Builder scoreWeight(ScoreDimension dimension, double weight) {
            this.scoreWeights.put(dimension, weight);
            return this;
        }

        public Builder costModel(CostModel costModel) {
            this.costModel = Objects.requireNonNull(costModel, "costModel");
            return this;
        }

        public Builder elevationModel(ElevationModel elevationModel) {
            this.elevationModel = Objects.requireNonNull(elevationModel, "elevationModel");
            return this;
        }

        public ParameterSet build() {
            if (lotSizeMin <= 0 || lotSizeMax < lotSizeMin)
                throw new IllegalArgumentException("lot size range [" + lotSizeMin + ", " + lotSizeMax + "] is invalid");
            if (lotSizeTarget != 0 && (lotSizeTarget < lotSizeMin || lotSizeTarget > lotSizeMax))
                throw new IllegalArgumentException("target lot size " + lotSizeTarget + " outside its range");
            if (minLotCount < 0) throw new IllegalArgumentException("minimum lot count must not be negative");
            if (primaryRoadWidth <= 0 || secondaryRoadWidth <= 0)
                throw new IllegalArgumentException("road widths must be positive");
            if (perimeterBuffer != null && perimeterBuffer < 0)
                throw new IllegalArgumentException("perimeter buffer must not be negative");
            if (salableAreaTarget <= 0 || salableAreaCeiling <= 0 || salableAreaCeiling > 1)
                throw new IllegalArgumentException("salable area fractions must be in (0, 1]");
            if (entranceCount < 0 || entranceClearance < 0 || entranceCornerSetback < 0)
                throw new IllegalArgumentException("entrance settings must not be negative");
            if (maxAspectRatio < 1) throw new IllegalArgumentException("max aspect ratio must be at least 1");
            if (serviceDistance <= 0) throw new IllegalArgumentException("service distance must be positive");
            if (targetDurationDays <= 0) throw new IllegalArgumentException("target duration must be positive");
            Set<InfrastructureKind> seen = EnumSet.noneOf(InfrastructureKind.class);
            for (InfrastructureRequirement r : infrastructure) {
                if (!seen.add(r.getKind())) throw new IllegalArgumentException("duplicate requirement for " + r.getKind());
            }
            double weightSum = 0;
            for (ScoreDimension d : ScoreDimension.values()) {
                double w = scoreWeights.getOrDefault(d, 1.0);
                if (w < 0) throw new IllegalArgumentException("score weight of " + d + " is negative");
                weightSum += w;
            }
            if (weightSum <= 0) throw new IllegalArgumentException("score weights sum to zero");
            return new ParameterSet(this);
        }
    }
}
