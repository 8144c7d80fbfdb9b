package org.tesis.parque;

import java.util.Objects;

/**
 * Sizing and siting rule for one facility: footprint (fixed or a share of the
 * site), what it must be adjacent to, and the clear ring kept around it.
 */
public final class InfrastructureRequirement {

    private final InfrastructureKind kind;
    private final double fixedArea;
    private final double siteAreaRatio;
    private final Adjacency adjacency;
    private final boolean preferLowElevation;
    private final double exclusionRadius;

    public InfrastructureRequirement(InfrastructureKind kind, double fixedArea, double siteAreaRatio,
                                     Adjacency adjacency, boolean preferLowElevation, double exclusionRadius) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.adjacency = Objects.requireNonNull(adjacency, "adjacency");
        if (fixedArea < 0 || siteAreaRatio < 0 || siteAreaRatio >= 1)
            throw new IllegalArgumentException("invalid footprint for " + kind);
        if (fixedArea == 0 && siteAreaRatio == 0)
            throw new IllegalArgumentException("footprint of " + kind + " must be positive");
        if (exclusionRadius < 0) throw new IllegalArgumentException("exclusion radius must not be negative");
        this.fixedArea = fixedArea;
        this.siteAreaRatio = siteAreaRatio;
        this.preferLowElevation = preferLowElevation;
        this.exclusionRadius = exclusionRadius;
    }

    /** Default rule per kind; pond sized at 2 % of the site, plants with fixed footprints. */
    public static InfrastructureRequirement defaults(InfrastructureKind kind) {
        switch (kind) {
            case DETENTION_POND:
                return new InfrastructureRequirement(kind, 0, 0.02, Adjacency.BOUNDARY, true, 0);
            case SUBSTATION:
                return new InfrastructureRequirement(kind, 1500, 0, Adjacency.ROAD, false, 5);
            case WATER_TREATMENT:
                return new InfrastructureRequirement(kind, 1200, 0, Adjacency.ROAD, false, 0);
            case WASTEWATER_TREATMENT:
                return new InfrastructureRequirement(kind, 1600, 0, Adjacency.ROAD, false, 5);
            default:
                throw new IllegalArgumentException("no default for " + kind);
        }
    }

    public double requiredArea(double siteArea) {
        return Math.max(fixedArea, siteAreaRatio * siteArea);
    }

    InfrastructureRequirement withExclusionRadius(double radius) {
        return new InfrastructureRequirement(kind, fixedArea, siteAreaRatio, adjacency, preferLowElevation, radius);
    }

    public InfrastructureKind getKind() {
        return kind;
    }

    public double getFixedArea() {
        return fixedArea;
    }

    public double getSiteAreaRatio() {
        return siteAreaRatio;
    }

    public Adjacency getAdjacency() {
        return adjacency;
    }

    public boolean isPreferLowElevation() {
        return preferLowElevation;
    }

    public double getExclusionRadius() {
        return exclusionRadius;
    }

    @Override
    public String toString() {
        return kind + "{area=" + (fixedArea > 0 ? fixedArea + "m2" : siteAreaRatio + "xsite")
                + ", adjacency=" + adjacency + ", exclusion=" + exclusionRadius + "}";
    }
}
