package org.tesis.parque;

import org.locationtech.jts.algorithm.MinimumDiameter;
import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.operation.buffer.BufferOp;
import org.locationtech.jts.operation.buffer.BufferParameters;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.*;

/**
 * Planar geometry helpers shared by every generator: polygon construction,
 * offsets, axis-aligned cuts, oriented-box measures and frontage tests.
 * All methods are stateless; nothing here caches between calls.
 */
public class GeomUtils {

    static final GeometryFactory GF = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    /** areas below this are treated as empty slivers (m²) */
    static final double AREA_EPS = 1e-3;
    /** tolerance used when matching coincident edges (m) */
    static final double EDGE_EPS = 0.05;

    private static final int BISECT_STEPS = 40;
    private static final double QUARTER = Math.PI / 2;
    /** edges this close in direction share one orientation */
    static final double ANGLE_TOL = Math.toRadians(1.0);

    // closed coordinate array (last == first)
    static Coordinate[] toClosedCoords(List<Coordinate> pts) {
        if (pts.size() < 3) throw new IllegalArgumentException("polygon needs at least 3 points, got " + pts.size());
        Coordinate first = pts.get(0), last = pts.get(pts.size() - 1);
        boolean closed = first.equals2D(last);
        int n = closed ? pts.size() : pts.size() + 1;
        Coordinate[] c = new Coordinate[n];
        for (int i = 0; i < pts.size(); i++) c[i] = new Coordinate(pts.get(i).x, pts.get(i).y);
        if (!closed) c[n - 1] = new Coordinate(first.x, first.y);
        return c;
    }

    static Polygon polygon(List<Coordinate> pts) {
        return GF.createPolygon(GF.createLinearRing(toClosedCoords(pts)));
    }

    static Polygon rectangle(double minX, double minY, double maxX, double maxY) {
        return GF.createPolygon(new Coordinate[]{
                new Coordinate(minX, minY), new Coordinate(maxX, minY),
                new Coordinate(maxX, maxY), new Coordinate(minX, maxY),
                new Coordinate(minX, minY)});
    }

    static LineString line(double x0, double y0, double x1, double y1) {
        return GF.createLineString(new Coordinate[]{new Coordinate(x0, y0), new Coordinate(x1, y1)});
    }

    static Polygon emptyPolygon() {
        return GF.createPolygon();
    }

    // negative offset; if it splits, the largest piece is kept
    static Polygon inset(Polygon poly, double inset) {
        if (inset <= 0) return poly;
        BufferParameters bp = new BufferParameters(8, BufferParameters.CAP_FLAT, BufferParameters.JOIN_MITRE, 5.0);
        Geometry g = BufferOp.bufferOp(poly, -inset, bp);
        Polygon best = largest(g);
        return best == null ? emptyPolygon() : best;
    }

    // mitred inset, used for facility cores inside their setback ring
    static Geometry shrink(Geometry g, double d) {
        if (d <= 0) return g;
        BufferParameters bp = new BufferParameters(8, BufferParameters.CAP_FLAT, BufferParameters.JOIN_MITRE, 5.0);
        return BufferOp.bufferOp(g, -d, bp);
    }

    /** Right-of-way strip of a centerline with square ends. */
    static Geometry corridor(LineString centerline, double width) {
        BufferParameters bp = new BufferParameters(8, BufferParameters.CAP_FLAT, BufferParameters.JOIN_MITRE, 5.0);
        return BufferOp.bufferOp(centerline, width / 2.0, bp);
    }

    static Polygon largest(Geometry g) {
        Polygon best = null;
        double area = -1;
        for (Polygon p : polygons(g)) {
            if (p.getArea() > area) { area = p.getArea(); best = p; }
        }
        return best;
    }

    /** Polygon parts of {@code g} above the sliver threshold, in traversal order. */
    static List<Polygon> polygons(Geometry g) {
        List<Polygon> out = new ArrayList<>();
        if (g == null || g.isEmpty()) return out;
        for (int i = 0; i < g.getNumGeometries(); i++) {
            Geometry part = g.getGeometryN(i);
            if (part instanceof Polygon p) {
                if (p.getArea() > AREA_EPS) out.add(p);
            } else if (part instanceof GeometryCollection) {
                out.addAll(polygons(part));
            }
        }
        return out;
    }

    static List<LineString> lines(Geometry g) {
        List<LineString> out = new ArrayList<>();
        if (g == null || g.isEmpty()) return out;
        for (int i = 0; i < g.getNumGeometries(); i++) {
            Geometry part = g.getGeometryN(i);
            if (part instanceof LineString ls) {
                if (ls.getLength() > EDGE_EPS) out.add(ls);
            } else if (part instanceof GeometryCollection) {
                out.addAll(lines(part));
            }
        }
        return out;
    }

    static Geometry union(Collection<? extends Geometry> gs) {
        if (gs.isEmpty()) return emptyPolygon();
        Geometry u = UnaryUnionOp.union(new ArrayList<Geometry>(gs));
        return u == null ? emptyPolygon() : u;
    }

    static double area(Collection<? extends Geometry> gs) {
        double a = 0;
        for (Geometry g : gs) a += g.getArea();
        return a;
    }

    // axis-aligned rectangle iff its area fills its envelope
    static boolean isAxisRectangle(Geometry g) {
        if (!(g instanceof Polygon p) || p.getNumInteriorRing() > 0) return false;
        Envelope e = p.getEnvelopeInternal();
        double envArea = e.getWidth() * e.getHeight();
        return envArea > 0 && Math.abs(envArea - p.getArea()) <= 1e-7 * envArea;
    }

    /**
     * Splits {@code p} by the axis line {@code x = c} (when {@code alongX}) or
     * {@code y = c}; returns the low and the high side, either possibly empty.
     */
    static Geometry[] cut(Polygon p, boolean alongX, double c) {
        Envelope e = p.getEnvelopeInternal();
        if (isAxisRectangle(p)) {
            if (alongX) {
                double x = clamp(c, e.getMinX(), e.getMaxX());
                return new Geometry[]{
                        x > e.getMinX() ? rectangle(e.getMinX(), e.getMinY(), x, e.getMaxY()) : emptyPolygon(),
                        x < e.getMaxX() ? rectangle(x, e.getMinY(), e.getMaxX(), e.getMaxY()) : emptyPolygon()};
            }
            double y = clamp(c, e.getMinY(), e.getMaxY());
            return new Geometry[]{
                    y > e.getMinY() ? rectangle(e.getMinX(), e.getMinY(), e.getMaxX(), y) : emptyPolygon(),
                    y < e.getMaxY() ? rectangle(e.getMinX(), y, e.getMaxX(), e.getMaxY()) : emptyPolygon()};
        }
        double pad = 1.0 + Math.max(e.getWidth(), e.getHeight());
        Polygon low = alongX
                ? rectangle(e.getMinX() - pad, e.getMinY() - pad, c, e.getMaxY() + pad)
                : rectangle(e.getMinX() - pad, e.getMinY() - pad, e.getMaxX() + pad, c);
        Polygon high = alongX
                ? rectangle(c, e.getMinY() - pad, e.getMaxX() + pad, e.getMaxY() + pad)
                : rectangle(e.getMinX() - pad, c, e.getMaxX() + pad, e.getMaxY() + pad);
        return new Geometry[]{p.intersection(low), p.intersection(high)};
    }

    /**
     * Axis coordinate at which the part of {@code p} measured from the low
     * (or high) end reaches {@code targetArea}. Linear for rectangles,
     * bisection otherwise.
     */
    static double cutCoordinateForArea(Polygon p, boolean alongX, boolean fromLow, double targetArea) {
        Envelope e = p.getEnvelopeInternal();
        double lo = alongX ? e.getMinX() : e.getMinY();
        double hi = alongX ? e.getMaxX() : e.getMaxY();
        if (targetArea <= 0) return fromLow ? lo : hi;
        if (targetArea >= p.getArea()) return fromLow ? hi : lo;
        if (isAxisRectangle(p)) {
            double cross = alongX ? e.getHeight() : e.getWidth();
            double len = targetArea / cross;
            return fromLow ? lo + len : hi - len;
        }
        double a = lo, b = hi;
        for (int i = 0; i < BISECT_STEPS; i++) {
            double mid = (a + b) / 2.0;
            Geometry[] parts = cut(p, alongX, mid);
            double measured = fromLow ? parts[0].getArea() : parts[1].getArea();
            boolean tooMuch = measured > targetArea;
            if (fromLow == tooMuch) b = mid; else a = mid;
        }
        return (a + b) / 2.0;
    }

    // minimum-width oriented rectangle
    static Geometry orientedBox(Geometry g) {
        return new MinimumDiameter(g).getMinimumRectangle();
    }

    /** Long side over short side of the oriented bounding box; 1 for a square. */
    static double aspectRatio(Geometry g) {
        double[] s = boxSides(orientedBox(g));
        if (s[1] <= 0) return Double.POSITIVE_INFINITY;
        return s[0] / s[1];
    }

    static double rectangularity(Geometry g) {
        double boxArea = orientedBox(g).getArea();
        return boxArea <= 0 ? 0 : Math.min(1.0, g.getArea() / boxArea);
    }

    /**
     * Edge direction, modulo a quarter turn, carrying the most boundary
     * length; edges within {@link #ANGLE_TOL} of each other count together.
     * Result in [0, pi/2).
     */
    static double dominantAngle(Polygon p) {
        Coordinate[] c = p.getExteriorRing().getCoordinates();
        double[] dir = new double[c.length - 1];
        double[] len = new double[c.length - 1];
        for (int i = 0; i + 1 < c.length; i++) {
            double a = Math.atan2(c[i + 1].y - c[i].y, c[i + 1].x - c[i].x);
            dir[i] = ((a % QUARTER) + QUARTER) % QUARTER;
            len[i] = c[i].distance(c[i + 1]);
        }
        double best = 0, bestLen = -1;
        for (int i = 0; i < dir.length; i++) {
            double total = 0;
            for (int j = 0; j < dir.length; j++) {
                double d = Math.abs(dir[i] - dir[j]);
                if (Math.min(d, QUARTER - d) <= ANGLE_TOL) total += len[j];
            }
            if (total > bestLen + EDGE_EPS) {
                bestLen = total;
                best = dir[i];
            }
        }
        return QUARTER - best < ANGLE_TOL ? 0 : best;
    }

    static double[] boxSides(Geometry box) {
        Coordinate[] c = box.getCoordinates();
        if (!(box instanceof Polygon) || c.length < 4) {
            double len = box.getLength();
            return new double[]{len, 0};
        }
        double a = c[0].distance(c[1]), b = c[1].distance(c[2]);
        return new double[]{Math.max(a, b), Math.min(a, b)};
    }

    static double normalizeHalfTurn(double a) {
        while (a <= -Math.PI / 2) a += Math.PI;
        while (a > Math.PI / 2) a -= Math.PI;
        return a;
    }

    /**
     * Length of the exterior edges of {@code poly} whose midpoint lies inside
     * {@code roadZone} (road right-of-way grown by {@link #EDGE_EPS}).
     */
    static double frontageLength(Polygon poly, PreparedGeometry roadZone) {
        Coordinate[] c = poly.getExteriorRing().getCoordinates();
        double len = 0;
        for (int i = 0; i + 1 < c.length; i++) {
            double l = c[i].distance(c[i + 1]);
            if (l <= EDGE_EPS) continue;
            Point mid = GF.createPoint(new Coordinate((c[i].x + c[i + 1].x) / 2.0, (c[i].y + c[i + 1].y) / 2.0));
            if (roadZone.intersects(mid)) len += l;
        }
        return len;
    }

    static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    static double clip01(double v) {
        if (Double.isNaN(v)) return 0;
        return clamp(v, 0.0, 1.0);
    }
}
