package org.tesis.parque;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.operation.distance.DistanceOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds the internal road skeleton in frame coordinates: one primary spine
 * along the main axis and secondary roads across it, spaced so that the
 * blocks between them hold two rows of lots back to back. On non-convex
 * sites, secondaries the spine misses are joined by primary collectors
 * parallel to it, and spurs are run into any land still more than about one
 * lot depth from a road. Dead ends that serve no extra land are pruned.
 */
public class RoadNetworkGenerator {

    private static final Logger log = LoggerFactory.getLogger(RoadNetworkGenerator.class);

    /** pruning removes a dead end only if that leaves less than this much more land unserved (m²) */
    static final double COVERAGE_LOSS_EPS = 1.0;
    /** land farther than this many lot depths from a right-of-way is unserved */
    static final double GAP_REACH = 1.1;
    /** collectors tried at these shares of a cut-off component's extent across the spine */
    private static final double[] COLLECTOR_POSITIONS = {0.5, 0.25, 0.75};
    /** limit on collectors and on spurs per network */
    private static final int MAX_EXTENSIONS = 12;
    /** spine position bounds when pinned by a seed entrance, as a share of the cross extent */
    static final double SEED_SPINE_MIN = 0.2;
    static final double SEED_SPINE_MAX = 0.8;

    private final double primaryWidth;
    private final double secondaryWidth;
    private final double serviceDistance;
    private final double minGapArea;

    /**
     * @param serviceDistance upper bound on how far a lot may lie from a road (m)
     * @param minGapArea      unserved pieces smaller than this get no spur (m²)
     */
    public RoadNetworkGenerator(double primaryWidth, double secondaryWidth, double serviceDistance, double minGapArea) {
        if (!(primaryWidth > 0) || !(secondaryWidth > 0)) throw new IllegalArgumentException("road widths must be positive");
        if (!(serviceDistance > 0)) throw new IllegalArgumentException("service distance must be positive");
        if (!(minGapArea > 0)) throw new IllegalArgumentException("minimum gap area must be positive");
        this.primaryWidth = primaryWidth;
        this.secondaryWidth = secondaryWidth;
        this.serviceDistance = serviceDistance;
        this.minGapArea = minGapArea;
    }

    /** Generated network and the lot depth its secondary spacing leaves. */
    public static final class Result {
        private final RoadNetwork network;
        private final double lotDepth;

        Result(RoadNetwork network, double lotDepth) {
            this.network = network;
            this.lotDepth = lotDepth;
        }

        public RoadNetwork getNetwork() {
            return network;
        }

        public double getLotDepth() {
            return lotDepth;
        }
    }

    /**
     * Boundary minus the perimeter buffer.
     *
     * @throws InfeasibleGeometryException if nothing is left
     */
    public static Polygon buildableArea(Boundary boundary, double perimeterBuffer) {
        Polygon b = GeomUtils.inset(boundary.shell(), perimeterBuffer);
        if (b.isEmpty() || b.getArea() <= GeomUtils.AREA_EPS)
            throw new InfeasibleGeometryException("buildable interior is empty after removing a "
                    + perimeterBuffer + " m perimeter buffer");
        return b;
    }

    /** Secondary road count for a main-axis extent; zero when no block would stay deep enough. */
    static int secondaryCount(double extent, double lotDepth, double secondaryWidth, int delta) {
        int n = Math.max(1, (int) Math.round(extent / (2 * lotDepth + secondaryWidth)) + delta);
        while (n > 0 && blockDepth(extent, n, secondaryWidth) < 0.5 * lotDepth) n--;
        return n;
    }

    /** Lot depth left by {@code n} evenly spaced secondaries (half the block width). */
    static double blockDepth(double extent, int n, double secondaryWidth) {
        if (n <= 0) return extent;
        return (extent - n * secondaryWidth) / (2.0 * n);
    }

    /**
     * @param buildable     buildable area in frame coordinates
     * @param lotDepth      target depth of one row of lots
     * @param spineOffset   spine position as a share of the cross extent
     * @param secondaryDelta adjustment of the secondary count (-1, 0 or 1)
     * @param seedEntrances optional entrance points; one on a short side pins the spine
     */
    public Result generate(Polygon buildable, double lotDepth, double spineOffset, int secondaryDelta,
                           List<Coordinate> seedEntrances) {
        if (buildable.isEmpty() || buildable.getArea() <= GeomUtils.AREA_EPS)
            throw new InfeasibleGeometryException("buildable area has zero area");
        if (!(lotDepth > 0)) throw new IllegalArgumentException("lot depth must be positive");
        Envelope e = buildable.getEnvelopeInternal();
        double w = e.getWidth(), h = e.getHeight();

        double spineY = e.getMinY() + GeomUtils.clamp(spineOffset, 0, 1) * h;
        for (Coordinate s : seedEntrances) {
            if (s.x <= e.getMinX() + 0.1 * w || s.x >= e.getMaxX() - 0.1 * w) {
                spineY = GeomUtils.clamp(s.y, e.getMinY() + SEED_SPINE_MIN * h, e.getMinY() + SEED_SPINE_MAX * h);
                break;
            }
        }

        int n = secondaryCount(w, lotDepth, secondaryWidth, secondaryDelta);
        double depth = n > 0 ? blockDepth(w, n, secondaryWidth) : lotDepth;

        List<LineString> primary = GeomUtils.lines(buildable.intersection(
                GeomUtils.line(e.getMinX() - 1, spineY, e.getMaxX() + 1, spineY)));
        if (primary.isEmpty()) throw new InfeasibleGeometryException("spine misses the buildable area");

        List<LineString> secondary = new ArrayList<>();
        for (int k = 0; k < n; k++) {
            double x = e.getMinX() + depth + secondaryWidth / 2.0 + k * (2 * depth + secondaryWidth);
            secondary.addAll(GeomUtils.lines(buildable.intersection(GeomUtils.line(x, e.getMinY() - 1, x, spineY))));
            secondary.addAll(GeomUtils.lines(buildable.intersection(GeomUtils.line(x, spineY, x, e.getMaxY() + 1))));
        }

        List<Draft> drafts = new ArrayList<>();
        for (LineString l : primary) drafts.add(new Draft(RoadClass.PRIMARY, l));
        for (LineString l : secondary) drafts.add(new Draft(RoadClass.SECONDARY, l));

        PreparedGeometry land = PreparedGeometryFactory.prepare(buildable.buffer(GeomUtils.EDGE_EPS));
        int collectors = connectOrphans(drafts, buildable, land);
        drafts = keepConnected(drafts);
        double reach = Math.min(GAP_REACH * depth, serviceDistance);
        int spurs = fillGaps(drafts, buildable, land, reach);
        int before = drafts.size();
        drafts = prune(drafts, buildable, reach);
        log.debug("roads | secondaries={} | depth={} | collectors={} | spurs={} | kept={} | pruned={}",
                n, depth, collectors, spurs, drafts.size(), before - drafts.size());

        List<RoadSegment> segments = new ArrayList<>();
        int p = 0, s = 0;
        for (Draft d : drafts) {
            String id = d.cls == RoadClass.PRIMARY ? "road-primary-" + (++p) : "road-secondary-" + (++s);
            Geometry row = GeomUtils.corridor(d.line, width(d.cls)).intersection(buildable);
            segments.add(new RoadSegment(id, d.cls, d.line, width(d.cls), row));
        }
        return new Result(new RoadNetwork(segments), depth);
    }

    private double width(RoadClass cls) {
        return cls == RoadClass.PRIMARY ? primaryWidth : secondaryWidth;
    }

    private static final class Draft {
        final RoadClass cls;
        final LineString line;

        Draft(RoadClass cls, LineString line) {
            this.cls = cls;
            this.line = line;
        }
    }

    private static int root(List<Draft> drafts) {
        int root = -1;
        for (int i = 0; i < drafts.size(); i++) {
            Draft d = drafts.get(i);
            if (d.cls != RoadClass.PRIMARY) continue;
            if (root < 0 || d.line.getLength() > drafts.get(root).line.getLength()) root = i;
        }
        if (root < 0) throw new InfeasibleGeometryException("no primary road fits the buildable area");
        return root;
    }

    /** Connected components, the one holding the longest primary first, the rest longest first. */
    private static List<List<Draft>> components(List<Draft> drafts) {
        int root = root(drafts);
        boolean[] seen = new boolean[drafts.size()];
        List<List<Draft>> out = new ArrayList<>();
        List<Integer> starts = new ArrayList<>();
        starts.add(root);
        for (int i = 0; i < drafts.size(); i++) if (i != root) starts.add(i);
        for (int start : starts) {
            if (seen[start]) continue;
            List<Draft> comp = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            seen[start] = true;
            while (!queue.isEmpty()) {
                Draft cur = drafts.get(queue.poll());
                comp.add(cur);
                for (int j = 0; j < drafts.size(); j++) {
                    if (!seen[j] && cur.line.distance(drafts.get(j).line) <= RoadNetwork.TOUCH_EPS) {
                        seen[j] = true;
                        queue.add(j);
                    }
                }
            }
            out.add(comp);
        }
        // stable, so equal lengths keep draft order
        out.subList(1, out.size()).sort(Comparator.comparingDouble((List<Draft> c) -> -length(c)));
        return out;
    }

    private static List<Draft> keepConnected(List<Draft> drafts) {
        return components(drafts).get(0);
    }

    private static double length(List<Draft> drafts) {
        double l = 0;
        for (Draft d : drafts) l += d.line.getLength();
        return l;
    }

    private static boolean touchesAny(LineString line, List<Draft> drafts) {
        for (Draft d : drafts) if (line.distance(d.line) <= RoadNetwork.TOUCH_EPS) return true;
        return false;
    }

    private static Geometry centerlines(List<Draft> drafts) {
        LineString[] lines = new LineString[drafts.size()];
        for (int i = 0; i < lines.length; i++) lines[i] = drafts.get(i).line;
        return GeomUtils.GF.createMultiLineString(lines);
    }

    // road pieces the spine missed are joined by collectors parallel to it, else by a straight link
    private int connectOrphans(List<Draft> drafts, Polygon buildable, PreparedGeometry land) {
        int added = 0;
        for (int round = 0; round < MAX_EXTENSIONS; round++) {
            List<List<Draft>> comps = components(drafts);
            if (comps.size() <= 1) break;
            Draft join = null;
            for (int c = 1; c < comps.size() && join == null; c++) {
                join = collector(comps.get(0), comps.get(c), buildable, land);
            }
            if (join == null) break;
            drafts.add(join);
            added++;
        }
        return added;
    }

    private static Draft collector(List<Draft> main, List<Draft> orphan, Polygon buildable, PreparedGeometry land) {
        Envelope e = buildable.getEnvelopeInternal();
        Envelope oe = centerlines(orphan).getEnvelopeInternal();
        for (double t : COLLECTOR_POSITIONS) {
            double y = oe.getMinY() + t * oe.getHeight();
            LineString across = GeomUtils.line(e.getMinX() - 1, y, e.getMaxX() + 1, y);
            for (LineString piece : GeomUtils.lines(buildable.intersection(across))) {
                if (touchesAny(piece, orphan) && touchesAny(piece, main)) return new Draft(RoadClass.PRIMARY, piece);
            }
        }
        LineString link = link(centerlines(orphan), centerlines(main), land);
        return link == null ? null : new Draft(RoadClass.SECONDARY, link);
    }

    // shortest straight connection, when it stays on buildable land
    private static LineString link(Geometry from, Geometry to, PreparedGeometry land) {
        Coordinate[] pair = DistanceOp.nearestPoints(from, to);
        if (pair[0].distance(pair[1]) <= GeomUtils.EDGE_EPS) return null;
        LineString link = GeomUtils.GF.createLineString(new Coordinate[]{pair[0], pair[1]});
        return land.covers(link) ? link : null;
    }

    /**
     * Pieces of buildable land farther than {@code reach} from every
     * right-of-way and at least the gap threshold in area, largest first.
     */
    private List<Polygon> gaps(List<Draft> drafts, Polygon buildable, double reach) {
        List<Polygon> out = new ArrayList<>();
        for (Polygon g : GeomUtils.polygons(buildable.difference(served(drafts, reach)))) {
            if (g.getArea() >= minGapArea) out.add(g);
        }
        out.sort(Comparator.comparingDouble((Polygon g) -> -g.getArea()));
        return out;
    }

    private double unserved(List<Draft> drafts, Polygon buildable, double reach) {
        if (drafts.isEmpty()) return buildable.getArea();
        return buildable.difference(served(drafts, reach)).getArea();
    }

    private Geometry served(List<Draft> drafts, double reach) {
        List<Geometry> zones = new ArrayList<>(2);
        for (RoadClass cls : new RoadClass[]{RoadClass.PRIMARY, RoadClass.SECONDARY}) {
            List<Draft> of = new ArrayList<>();
            for (Draft d : drafts) if (d.cls == cls) of.add(d);
            if (!of.isEmpty()) zones.add(centerlines(of).buffer(width(cls) / 2.0 + reach, 4));
        }
        return GeomUtils.union(zones);
    }

    // one spur per round into the largest gap that can be reached
    private int fillGaps(List<Draft> drafts, Polygon buildable, PreparedGeometry land, double reach) {
        int added = 0;
        for (int round = 0; round < MAX_EXTENSIONS; round++) {
            List<Draft> spur = List.of();
            for (Polygon gap : gaps(drafts, buildable, reach)) {
                spur = spur(gap, drafts, buildable, land);
                if (!spur.isEmpty()) break;
            }
            if (spur.isEmpty()) break;
            drafts.addAll(spur);
            added += spur.size();
        }
        return added;
    }

    /**
     * Secondary road through the gap along its long side, running on to the
     * nearest road it meets on that line; the short side is tried next, and
     * a straight link to the network is the last resort.
     */
    private static List<Draft> spur(Polygon gap, List<Draft> drafts, Polygon buildable, PreparedGeometry land) {
        Envelope ge = gap.getEnvelopeInternal();
        Coordinate c = gap.getInteriorPoint().getCoordinate();
        boolean longX = ge.getWidth() >= ge.getHeight();
        for (boolean alongX : new boolean[]{longX, !longX}) {
            LineString piece = axisPiece(buildable, c, alongX);
            if (piece == null) continue;
            double at = alongX ? c.x : c.y;
            double hit = Double.NaN;
            for (Draft d : drafts) {
                for (Coordinate x : piece.intersection(d.line).getCoordinates()) {
                    double v = alongX ? x.x : x.y;
                    if (Double.isNaN(hit) || Math.abs(v - at) < Math.abs(hit - at)) hit = v;
                }
            }
            if (Double.isNaN(hit)) continue;
            double lo = alongX ? ge.getMinX() : ge.getMinY();
            double hi = alongX ? ge.getMaxX() : ge.getMaxY();
            // crosses the road it starts from by a metre so the two always touch
            LineString spur = clip(piece, alongX, Math.min(lo, hit - 1.0), Math.max(hi, hit + 1.0));
            if (spur != null) return List.of(new Draft(RoadClass.SECONDARY, spur));
        }
        LineString piece = axisPiece(buildable, c, longX);
        if (piece == null) return List.of();
        LineString spur = clip(piece, longX, longX ? ge.getMinX() : ge.getMinY(), longX ? ge.getMaxX() : ge.getMaxY());
        if (spur == null) return List.of();
        LineString link = link(spur, centerlines(drafts), land);
        if (link == null) return List.of();
        return List.of(new Draft(RoadClass.SECONDARY, spur), new Draft(RoadClass.SECONDARY, link));
    }

    // the part of the axis line through c that lies on the buildable area and holds c
    private static LineString axisPiece(Polygon buildable, Coordinate c, boolean alongX) {
        Envelope e = buildable.getEnvelopeInternal();
        LineString axis = alongX
                ? GeomUtils.line(e.getMinX() - 1, c.y, e.getMaxX() + 1, c.y)
                : GeomUtils.line(c.x, e.getMinY() - 1, c.x, e.getMaxY() + 1);
        Point centre = GeomUtils.GF.createPoint(c);
        for (LineString l : GeomUtils.lines(buildable.intersection(axis))) {
            if (l.distance(centre) <= RoadNetwork.TOUCH_EPS) return l;
        }
        return null;
    }

    private static LineString clip(LineString line, boolean alongX, double from, double to) {
        Envelope e = line.getEnvelopeInternal();
        Polygon slab = alongX
                ? GeomUtils.rectangle(from, e.getMinY() - 1, to, e.getMaxY() + 1)
                : GeomUtils.rectangle(e.getMinX() - 1, from, e.getMaxX() + 1, to);
        List<LineString> parts = GeomUtils.lines(line.intersection(slab));
        return parts.isEmpty() ? null : parts.get(0);
    }

    // drops dead-end secondaries, shortest first, while no land becomes unserved
    private List<Draft> prune(List<Draft> drafts, Polygon buildable, double reach) {
        List<Draft> kept = new ArrayList<>(drafts);
        double unserved = unserved(kept, buildable, reach);
        List<Draft> candidates = new ArrayList<>();
        for (Draft d : kept) if (d.cls == RoadClass.SECONDARY && degree(d, kept) <= 1) candidates.add(d);
        candidates.sort(Comparator.comparingDouble(d -> d.line.getLength()));
        for (Draft d : candidates) {
            List<Draft> without = new ArrayList<>(kept);
            without.remove(d);
            double u = unserved(without, buildable, reach);
            if (u - unserved < COVERAGE_LOSS_EPS) {
                kept = without;
                unserved = u;
            }
        }
        return kept;
    }

    private static int degree(Draft d, List<Draft> all) {
        int deg = 0;
        for (Draft o : all) {
            if (o != d && d.line.distance(o.line) <= RoadNetwork.TOUCH_EPS) deg++;
        }
        return deg;
    }
}
