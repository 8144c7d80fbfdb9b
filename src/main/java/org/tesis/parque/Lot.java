package org.tesis.parque;

import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.Objects;

/**
 * Salable parcel with frontage on {@link #getAccessRoadId() its access road}.
 */
public final class Lot {

    private final String id;
    private final Polygon polygon;
    private final IndustryType use;
    private final String accessRoadId;

    public Lot(String id, Polygon polygon, IndustryType use, String accessRoadId) {
        this.id = Objects.requireNonNull(id, "id");
        this.polygon = Objects.requireNonNull(polygon, "polygon");
        this.use = Objects.requireNonNull(use, "use");
        this.accessRoadId = Objects.requireNonNull(accessRoadId, "accessRoadId");
    }

    Lot transformed(AffineTransformation t) {
        return new Lot(id, (Polygon) t.transform(polygon), use, accessRoadId);
    }

    public String getId() {
        return id;
    }

    public Polygon getPolygon() {
        return polygon;
    }

    public double getArea() {
        return polygon.getArea();
    }

    public IndustryType getUse() {
        return use;
    }

    public String getAccessRoadId() {
        return accessRoadId;
    }

    @Override
    public String toString() {
        return id + "{area=" + Math.round(getArea()) + ", road=" + accessRoadId + "}";
    }
}
