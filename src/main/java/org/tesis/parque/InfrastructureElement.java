package org.tesis.parque;

import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.Objects;

/**
 * Placed facility. The polygon is the usable core; the exclusion ring around
 * it is emitted separately as open space.
 */
public final class InfrastructureElement {

    private final String id;
    private final InfrastructureKind kind;
    private final Polygon polygon;
    private final double exclusionRadius;
    private final Adjacency adjacency;

    public InfrastructureElement(String id, InfrastructureKind kind, Polygon polygon,
                                 double exclusionRadius, Adjacency adjacency) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.polygon = Objects.requireNonNull(polygon, "polygon");
        this.exclusionRadius = exclusionRadius;
        this.adjacency = Objects.requireNonNull(adjacency, "adjacency");
    }

    InfrastructureElement transformed(AffineTransformation t) {
        return new InfrastructureElement(id, kind, (Polygon) t.transform(polygon), exclusionRadius, adjacency);
    }

    public String getId() {
        return id;
    }

    public InfrastructureKind getKind() {
        return kind;
    }

    public Polygon getPolygon() {
        return polygon;
    }

    public double getArea() {
        return polygon.getArea();
    }

    public double getExclusionRadius() {
        return exclusionRadius;
    }

    public Adjacency getAdjacency() {
        return adjacency;
    }

    @Override
    public String toString() {
        return id + "{area=" + Math.round(getArea()) + ", r=" + exclusionRadius + "}";
    }
}
