package org.tesis.parque;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;

/**
 * One row of future lots: a band one lot deep whose long side fronts a road.
 * Lots are cut across the run axis.
 */
final class Strip {

    final Polygon polygon;
    /** true when the depth runs along X (lots are stacked along Y) */
    final boolean depthAlongX;

    Strip(Polygon polygon, boolean depthAlongX) {
        this.polygon = polygon;
        this.depthAlongX = depthAlongX;
    }

    boolean runAlongX() {
        return !depthAlongX;
    }

    double depth() {
        Envelope e = polygon.getEnvelopeInternal();
        return depthAlongX ? e.getWidth() : e.getHeight();
    }

    double run() {
        Envelope e = polygon.getEnvelopeInternal();
        return depthAlongX ? e.getHeight() : e.getWidth();
    }

    double area() {
        return polygon.getArea();
    }
}
