package org.tesis.parque;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Guillotine subdivision of the land between roads. Blocks are first split
 * along their depth into strips one lot deep, each fronting a road; after
 * facilities are carved out, every strip is cut across into lots of equal
 * area within the size range and aspect bound. Anything without frontage or
 * below the minimum size stays as open space.
 */
public class LotSubdivider {

    private static final Logger log = LoggerFactory.getLogger(LotSubdivider.class);

    /** a lot needs at least this much road frontage (m) */
    static final double MIN_FRONTAGE = 2.0;
    /** blocks deeper than this many lot depths are split */
    static final double SPLIT_FACTOR = 1.5;
    /** blocks fronting on both sides and deeper than this keep an inner remainder */
    static final double INNER_FACTOR = 2.5;
    /** size relaxation applied when no lot count fits the strict range */
    static final double RELAXED_MAX = 1.25;
    private static final int MAX_LEVEL = 4;
    private static final double SIZE_TOL = 1e-6;

    private final double minSize;
    private final double targetSize;
    private final double maxSize;
    private final double maxAspect;

    public LotSubdivider(double minSize, double targetSize, double maxSize, double maxAspect) {
        if (!(minSize > 0) || maxSize < minSize || targetSize < minSize || targetSize > maxSize)
            throw new IllegalArgumentException("invalid lot size range " + minSize + " / " + targetSize + " / " + maxSize);
        this.minSize = minSize;
        this.targetSize = targetSize;
        this.maxSize = maxSize;
        this.maxAspect = maxAspect;
    }

    /** Result of cutting a pool: lots in creation order and left-over pieces. */
    public static final class Subdivision {
        private final List<Lot> lots;
        private final List<Polygon> residual;

        Subdivision(List<Lot> lots, List<Polygon> residual) {
            this.lots = List.copyOf(lots);
            this.residual = List.copyOf(residual);
        }

        public List<Lot> getLots() {
            return lots;
        }

        public List<Polygon> getResidual() {
            return residual;
        }
    }

    /**
     * Blocks = buildable minus right-of-way, split into strips one lot deep.
     */
    LandPool partition(Polygon buildable, Geometry rightOfWay, double lotDepth) {
        LandPool pool = new LandPool();
        Geometry blocks = rightOfWay.isEmpty() ? buildable : buildable.difference(rightOfWay);
        PreparedGeometry zone = PreparedGeometryFactory.prepare(rightOfWay.buffer(GeomUtils.EDGE_EPS));
        for (Polygon b : GeomUtils.polygons(blocks)) split(b, lotDepth, zone, pool, 0);
        log.debug("partition | strips={} | residual={}", pool.strips.size(), pool.residual.size());
        return pool;
    }

    private void split(Polygon p, double d, PreparedGeometry zone, LandPool pool, int level) {
        Frontage f = frontage(p, zone);
        if (f.vertical + f.horizontal < MIN_FRONTAGE) {
            pool.residual.add(p);
            return;
        }
        boolean depthAlongX = f.vertical >= f.horizontal;
        boolean frontLow = depthAlongX ? f.lowX : f.lowY;
        boolean frontHigh = depthAlongX ? f.highX : f.highY;
        Envelope e = p.getEnvelopeInternal();
        double lo = depthAlongX ? e.getMinX() : e.getMinY();
        double hi = depthAlongX ? e.getMaxX() : e.getMaxY();
        double extent = hi - lo;
        if (extent <= SPLIT_FACTOR * d || level >= MAX_LEVEL || !(frontLow || frontHigh)) {
            pool.strips.add(new Strip(p, depthAlongX));
            return;
        }
        if (frontLow && frontHigh && extent <= INNER_FACTOR * d) {
            Geometry[] parts = GeomUtils.cut(p, depthAlongX, lo + extent / 2.0);
            for (Polygon q : GeomUtils.polygons(parts[0])) pool.strips.add(new Strip(q, depthAlongX));
            for (Polygon q : GeomUtils.polygons(parts[1])) pool.strips.add(new Strip(q, depthAlongX));
            return;
        }
        Geometry rest = p;
        if (frontLow) {
            Geometry[] parts = GeomUtils.cut((Polygon) rest, depthAlongX, lo + d);
            for (Polygon q : GeomUtils.polygons(parts[0])) pool.strips.add(new Strip(q, depthAlongX));
            rest = parts[1];
        }
        if (frontHigh) {
            List<Polygon> inner = GeomUtils.polygons(rest);
            List<Geometry> keep = new ArrayList<>();
            for (Polygon q : inner) {
                Geometry[] parts = GeomUtils.cut(q, depthAlongX, hi - d);
                for (Polygon r : GeomUtils.polygons(parts[1])) pool.strips.add(new Strip(r, depthAlongX));
                keep.add(parts[0]);
            }
            rest = GeomUtils.GF.buildGeometry(keep);
        }
        for (Polygon q : GeomUtils.polygons(rest)) split(q, d, zone, pool, level + 1);
    }

    private static final class Frontage {
        double vertical, horizontal;
        boolean lowX, highX, lowY, highY;
    }

    // frontage per edge direction and whether it lies on the low or high side of the block
    private static Frontage frontage(Polygon p, PreparedGeometry zone) {
        Frontage f = new Frontage();
        Envelope e = p.getEnvelopeInternal();
        double qx = 0.25 * e.getWidth(), qy = 0.25 * e.getHeight();
        Coordinate[] c = p.getExteriorRing().getCoordinates();
        for (int i = 0; i + 1 < c.length; i++) {
            double dx = c[i + 1].x - c[i].x, dy = c[i + 1].y - c[i].y;
            double len = Math.hypot(dx, dy);
            if (len <= GeomUtils.EDGE_EPS) continue;
            double mx = (c[i].x + c[i + 1].x) / 2.0, my = (c[i].y + c[i + 1].y) / 2.0;
            if (!zone.intersects(GeomUtils.GF.createPoint(new Coordinate(mx, my)))) continue;
            if (Math.abs(dx) < Math.abs(dy)) {
                f.vertical += len;
                if (mx <= e.getMinX() + qx) f.lowX = true;
                if (mx >= e.getMaxX() - qx) f.highX = true;
            } else {
                f.horizontal += len;
                if (my <= e.getMinY() + qy) f.lowY = true;
                if (my >= e.getMaxY() - qy) f.highY = true;
            }
        }
        return f;
    }

    /**
     * Cuts every strip of the pool into lots. Lot ids run {@code lot-1},
     * {@code lot-2}, ... in strip order.
     */
    Subdivision subdivide(LandPool pool, RoadNetwork network, IndustryType use, long seed) {
        Random rng = new Random(seed);
        List<RoadSegment> roads = network.getSegments();
        List<PreparedGeometry> zones = new ArrayList<>(roads.size());
        for (RoadSegment r : roads) zones.add(PreparedGeometryFactory.prepare(r.getRightOfWay().buffer(GeomUtils.EDGE_EPS)));

        List<Lot> lots = new ArrayList<>();
        List<Polygon> residual = new ArrayList<>(pool.residual);
        for (Strip s : pool.strips) {
            for (Polygon piece : cutStrip(s, rng, residual)) {
                int best = -1;
                double bestLen = 0;
                for (int i = 0; i < zones.size(); i++) {
                    double len = GeomUtils.frontageLength(piece, zones.get(i));
                    if (len > bestLen) { bestLen = len; best = i; }
                }
                if (best < 0 || bestLen < MIN_FRONTAGE || piece.getArea() < minSize * (1 - SIZE_TOL)) {
                    residual.add(piece);
                } else {
                    lots.add(new Lot("lot-" + (lots.size() + 1), piece, use, roads.get(best).getId()));
                }
            }
        }
        log.debug("subdivide | lots={} | residual={}", lots.size(), residual.size());
        return new Subdivision(lots, residual);
    }

    /** Lot count for a strip, or 0 when no count fits even the relaxed range. */
    int lotCount(double area, double run, double depth) {
        if (area < minSize * (1 - SIZE_TOL)) return 0;
        int kMax = (int) Math.floor(area / minSize + SIZE_TOL);
        int kMin = (int) Math.ceil(area / maxSize - SIZE_TOL);
        if (kMin > kMax) kMin = (int) Math.ceil(area / (maxSize * RELAXED_MAX) - SIZE_TOL);
        kMin = Math.max(1, kMin);
        // oversize lots beat leaving a lot-sized piece unsold
        if (kMin > kMax) return kMax;
        int k = (int) GeomUtils.clamp(Math.round(area / targetSize), kMin, kMax);
        if (aspect(run / k, depth) <= maxAspect) return k;
        for (int step = 1; step <= kMax - kMin; step++) {
            for (int cand : new int[]{k - step, k + step}) {
                if (cand >= kMin && cand <= kMax && aspect(run / cand, depth) <= maxAspect) return cand;
            }
        }
        return k;
    }

    private static double aspect(double a, double b) {
        double lo = Math.min(a, b), hi = Math.max(a, b);
        return lo <= 0 ? Double.POSITIVE_INFINITY : hi / lo;
    }

    // equal-area cuts across the run axis; slivers and split-off bits go to residual
    private List<Polygon> cutStrip(Strip s, Random rng, List<Polygon> residual) {
        List<Polygon> out = new ArrayList<>();
        double area = s.area();
        int k = lotCount(area, s.run(), s.depth());
        if (k == 0) {
            residual.add(s.polygon);
            return out;
        }
        boolean runX = s.runAlongX();
        boolean fromLow = rng.nextBoolean();
        double piece = area / k;
        Polygon rest = s.polygon;
        for (int i = 0; i < k - 1 && rest != null; i++) {
            double c = GeomUtils.cutCoordinateForArea(rest, runX, fromLow, piece);
            Geometry[] parts = GeomUtils.cut(rest, runX, c);
            Geometry mine = fromLow ? parts[0] : parts[1];
            Geometry other = fromLow ? parts[1] : parts[0];
            Polygon lot = keepLargest(mine, residual);
            if (lot != null) out.add(lot);
            rest = keepLargest(other, residual);
        }
        if (rest != null) out.add(rest);
        return out;
    }

    private static Polygon keepLargest(Geometry g, List<Polygon> residual) {
        List<Polygon> parts = GeomUtils.polygons(g);
        Polygon big = GeomUtils.largest(g);
        for (Polygon p : parts) if (p != big) residual.add(p);
        return big;
    }
}
