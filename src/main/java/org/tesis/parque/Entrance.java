package org.tesis.parque;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.Objects;

/**
 * Access point on the site boundary and the connector road joining it to the
 * internal network. The connector is absent when the network already reaches
 * the boundary at that point.
 */
public final class Entrance {

    private final String id;
    private final Coordinate point;
    private final double inwardAngle;
    private final RoadSegment connector;

    public Entrance(String id, Coordinate point, double inwardAngle, RoadSegment connector) {
        this.id = Objects.requireNonNull(id, "id");
        this.point = new Coordinate(point.x, point.y);
        this.inwardAngle = inwardAngle;
        this.connector = connector;
    }

    Entrance transformed(AffineTransformation t, double rotation) {
        Coordinate p = new Coordinate();
        t.transform(point, p);
        double a = inwardAngle + rotation;
        return new Entrance(id, p, Math.atan2(Math.sin(a), Math.cos(a)),
                connector == null ? null : connector.transformed(t));
    }

    public String getId() {
        return id;
    }

    public Coordinate getPoint() {
        return new Coordinate(point.x, point.y);
    }

    /** Direction into the site, radians from the +X axis. */
    public double getInwardAngle() {
        return inwardAngle;
    }

    public RoadSegment getConnector() {
        return connector;
    }

    @Override
    public String toString() {
        return id + "{(" + Math.round(point.x) + ", " + Math.round(point.y) + ")}";
    }
}
