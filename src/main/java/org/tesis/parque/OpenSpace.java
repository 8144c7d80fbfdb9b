package org.tesis.parque;

import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.Objects;

/**
 * Unsold land inside the buildable area: remnants too small or without
 * frontage for a lot, and the clear rings around facilities.
 */
public final class OpenSpace {

    public enum Origin { RESIDUAL, EXCLUSION_RING }

    private final String id;
    private final Polygon polygon;
    private final Origin origin;

    public OpenSpace(String id, Polygon polygon, Origin origin) {
        this.id = Objects.requireNonNull(id, "id");
        this.polygon = Objects.requireNonNull(polygon, "polygon");
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    OpenSpace transformed(AffineTransformation t) {
        return new OpenSpace(id, (Polygon) t.transform(polygon), origin);
    }

    public String getId() {
        return id;
    }

    public Polygon getPolygon() {
        return polygon;
    }

    public Origin getOrigin() {
        return origin;
    }

    public double getArea() {
        return polygon.getArea();
    }
}
