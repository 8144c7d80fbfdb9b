package org.tesis.parque;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.Objects;

/**
 * One road: centerline, class, right-of-way width and the right-of-way
 * polygon already clipped to the area it may occupy.
 */
public final class RoadSegment {

    private final String id;
    private final RoadClass roadClass;
    private final LineString centerline;
    private final double width;
    private final Geometry rightOfWay;

    public RoadSegment(String id, RoadClass roadClass, LineString centerline, double width, Geometry rightOfWay) {
        this.id = Objects.requireNonNull(id, "id");
        this.roadClass = Objects.requireNonNull(roadClass, "roadClass");
        this.centerline = Objects.requireNonNull(centerline, "centerline");
        if (!(width > 0)) throw new IllegalArgumentException("road width must be positive");
        this.width = width;
        this.rightOfWay = Objects.requireNonNull(rightOfWay, "rightOfWay");
    }

    RoadSegment transformed(AffineTransformation t) {
        return new RoadSegment(id, roadClass, (LineString) t.transform(centerline), width, t.transform(rightOfWay));
    }

    RoadSegment withId(String newId) {
        return new RoadSegment(newId, roadClass, centerline, width, rightOfWay);
    }

    public String getId() {
        return id;
    }

    public RoadClass getRoadClass() {
        return roadClass;
    }

    public LineString getCenterline() {
        return centerline;
    }

    public double getWidth() {
        return width;
    }

    public Geometry getRightOfWay() {
        return rightOfWay;
    }

    public double length() {
        return centerline.getLength();
    }

    @Override
    public String toString() {
        return id + "{" + roadClass + ", w=" + width + ", len=" + Math.round(length()) + "}";
    }
}
