package org.tesis.parque;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateArrays;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;

/**
 * Site perimeter: a simple, closed ring with positive area in projected
 * planar coordinates (metres). Immutable once built.
 */
public final class Boundary {

    private final Polygon polygon;

    private Boundary(Polygon polygon) {
        this.polygon = polygon;
    }

    public static Boundary of(List<Coordinate> ring) {
        List<Coordinate> pts = new ArrayList<>(ring);
        if (pts.size() >= 2 && pts.get(0).equals2D(pts.get(pts.size() - 1))) pts.remove(pts.size() - 1);
        if (pts.size() < 3) throw new IllegalArgumentException("boundary needs at least 3 distinct vertices");
        return of(GeomUtils.polygon(pts));
    }

    public static Boundary of(Polygon polygon) {
        if (polygon == null || polygon.isEmpty()) throw new IllegalArgumentException("boundary polygon is empty");
        if (polygon.getNumInteriorRing() > 0) throw new IllegalArgumentException("boundary must be a single ring without holes");
        if (!polygon.getExteriorRing().isSimple()) throw new IllegalArgumentException("boundary ring self-intersects");
        if (!polygon.isValid()) throw new IllegalArgumentException("boundary polygon is not valid");
        if (!(polygon.getArea() > 0)) throw new IllegalArgumentException("boundary area must be positive");
        Coordinate[] shell = CoordinateArrays.copyDeep(polygon.getExteriorRing().getCoordinates());
        // counter-clockwise shell: the outward normal of every edge is on its right-hand side
        if (!Orientation.isCCW(shell)) CoordinateArrays.reverse(shell);
        return new Boundary(GeomUtils.GF.createPolygon(GeomUtils.GF.createLinearRing(shell)));
    }

    public static Boundary rectangle(double width, double height) {
        return of(GeomUtils.rectangle(0, 0, width, height));
    }

    public Polygon polygon() {
        return (Polygon) polygon.copy();
    }

    Polygon shell() {
        return polygon;
    }

    public double area() {
        return polygon.getArea();
    }

    /** Exterior edges in counter-clockwise order. */
    public List<LineSegment> edges() {
        Coordinate[] c = polygon.getExteriorRing().getCoordinates();
        List<LineSegment> out = new ArrayList<>(c.length - 1);
        for (int i = 0; i + 1 < c.length; i++) out.add(new LineSegment(c[i], c[i + 1]));
        return out;
    }

    @Override
    public String toString() {
        return "Boundary{area=" + polygon.getArea() + ", vertices=" + (polygon.getNumPoints() - 1) + "}";
    }
}
