package org.tesis.parque;

/**
 * Industry tag of the park. Heavier uses get wider perimeter buffers and
 * larger exclusion radii around facilities.
 */
public enum IndustryType {
    LIGHT_MANUFACTURING(1.0),
    LOGISTICS(1.0),
    MIXED(1.2),
    HEAVY_INDUSTRY(1.5);

    private final double bufferFactor;

    IndustryType(double bufferFactor) {
        this.bufferFactor = bufferFactor;
    }

    public double bufferFactor() {
        return bufferFactor;
    }
}
