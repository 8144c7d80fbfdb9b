package org.tesis.parque;

/**
 * Measurable property of a candidate layout that a rule can constrain.
 * Fractions are shares of the site area; lengths and areas are metres and m².
 */
public enum Quantity {
    SALABLE_FRACTION,
    GREEN_FRACTION,
    ROAD_FRACTION,
    INFRASTRUCTURE_FRACTION,
    MIN_PRIMARY_ROAD_WIDTH,
    MIN_SECONDARY_ROAD_WIDTH,
    PERIMETER_BUFFER_WIDTH,
    /** smallest facility-to-lot distance minus the facility's exclusion radius */
    INFRASTRUCTURE_CLEARANCE_MARGIN,
    LOTS_WITHOUT_FRONTAGE,
    LOT_OVERLAP_AREA,
    /** unaccounted or double-counted area as a share of the site */
    PARTITION_ERROR,
    LAYOUT_OUTSIDE_BOUNDARY_AREA,
    /** lot count over the required minimum */
    LOT_COUNT_RATIO,
    /** share of lots inside the size range */
    LOT_SIZE_CONFORMANCE,
    /** share of lots within the aspect bound */
    LOT_ASPECT_CONFORMANCE,
    /** connected components of the road graph beyond the first */
    ROAD_NETWORK_DISCONNECTED,
    ENTRANCE_SHORTFALL,
    INFRASTRUCTURE_UNPLACED,
    /** share of the buildable area within service distance of a road */
    SERVICE_COVERAGE,
    /** largest leftover open-space piece over the minimum lot size */
    LARGEST_RESIDUAL_RATIO
}
