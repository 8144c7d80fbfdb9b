package org.tesis.parque;

/**
 * The seven fixed dimensions of the scoring matrix.
 */
public enum ScoreDimension {
    COMPLIANCE,
    EFFICIENCY,
    LOT_QUALITY,
    FINANCIAL,
    CONSTRUCTABILITY,
    ENVIRONMENTAL,
    UTILITY_COVERAGE
}
