package org.tesis.parque;

/**
 * Terrain height lookup in site coordinates. Used to rank detention pond sites.
 */
@FunctionalInterface
public interface ElevationModel {

    ElevationModel FLAT = (x, y) -> 0.0;

    double elevationAt(double x, double y);
}
