package org.tesis.parque;

import java.util.Locale;

/**
 * Discrete facilities placed on the site before final lot subdivision.
 */
public enum InfrastructureKind {
    DETENTION_POND,
    SUBSTATION,
    WATER_TREATMENT,
    WASTEWATER_TREATMENT;

    /** Feature type suffix, e.g. {@code detention-pond}. */
    public String slug() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /** Ponds count as green/water area in land-use ratios. */
    public boolean isGreen() {
        return this == DETENTION_POND;
    }
}
