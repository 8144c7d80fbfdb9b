package org.tesis.parque;

/**
 * Kinds of construction work in the timeline graph, each tied to the phase
 * whose completion it counts towards and the unit its quantity is given in.
 */
public enum WorkType {
    SITE_PREPARATION(Phase.SITE_PREPARATION, "ha"),
    EARTHWORKS(Phase.SITE_PREPARATION, "ha"),
    UTILITY_NETWORK(Phase.UTILITIES, "km"),
    DETENTION_POND(Phase.FACILITIES, "1000 m2"),
    FACILITY(Phase.FACILITIES, "1000 m2"),
    PRIMARY_ROAD(Phase.ROADS, "km"),
    SECONDARY_ROAD(Phase.ROADS, "km"),
    ACCESS_ROAD(Phase.ROADS, "km"),
    LOT_GRADING(Phase.LOTS, "lots"),
    LANDSCAPING(Phase.LANDSCAPING, "ha"),
    FINAL_INSPECTION(Phase.HANDOVER, "-");

    /** Milestones are reported when every package of a phase has finished. */
    public enum Phase {
        SITE_PREPARATION, UTILITIES, FACILITIES, ROADS, LOTS, LANDSCAPING, HANDOVER
    }

    private final Phase phase;
    private final String unit;

    WorkType(Phase phase, String unit) {
        this.phase = phase;
        this.unit = unit;
    }

    public Phase getPhase() {
        return phase;
    }

    public String getUnit() {
        return unit;
    }
}
