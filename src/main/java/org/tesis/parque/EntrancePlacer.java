package org.tesis.parque;

import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.*;
import org.locationtech.jts.operation.distance.DistanceOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Chooses entrance points on boundary edges facing the external reference
 * line and connects each one to the nearest internal road with an access
 * road. Further entrances go to the best aligned edges still available and,
 * among equally aligned candidates, as far from the chosen ones as possible.
 */
public class EntrancePlacer {

    private static final Logger log = LoggerFactory.getLogger(EntrancePlacer.class);

    /** candidate points closer than this are the same entrance (m) */
    static final double SAME_POINT_EPS = 1.0;
    /** edges whose alignment differs by less than this rank as equally aligned */
    static final double ALIGNMENT_TOL = 0.01;

    private final double clearance;
    private final double cornerSetback;
    private final double connectorWidth;
    private final double maxConnectorLength;

    public EntrancePlacer(double clearance, double cornerSetback, double connectorWidth, double maxConnectorLength) {
        this.clearance = clearance;
        this.cornerSetback = cornerSetback;
        this.connectorWidth = connectorWidth;
        this.maxConnectorLength = maxConnectorLength;
    }

    static EntrancePlacer forParameters(ParameterSet p) {
        return new EntrancePlacer(p.getEntranceClearance(), p.getEntranceCornerSetback(), p.getPrimaryRoadWidth(),
                1.5 * p.getPerimeterBuffer() + p.getPrimaryRoadWidth());
    }

    /** Boundary edge usable as frontage, with its ranking keys. */
    public static final class FrontageEdge {
        final LineSegment segment;
        final double nx, ny;
        final double alignment;
        final double distance;

        FrontageEdge(LineSegment segment, double nx, double ny, double alignment, double distance) {
            this.segment = segment;
            this.nx = nx;
            this.ny = ny;
            this.alignment = alignment;
            this.distance = distance;
        }

        public LineSegment getSegment() {
            return segment;
        }

        /** 1 when the edge runs parallel to the reference line, 0 when perpendicular. */
        public double getAlignment() {
            return alignment;
        }

        public double getDistance() {
            return distance;
        }
    }

    /** Plan for one layout: entrances in choice order and how many could not be placed. */
    public static final class Placement {
        private final List<Entrance> entrances;
        private final int shortfall;

        Placement(List<Entrance> entrances, int shortfall) {
            this.entrances = List.copyOf(entrances);
            this.shortfall = shortfall;
        }

        public List<Entrance> getEntrances() {
            return entrances;
        }

        public int getShortfall() {
            return shortfall;
        }

        public List<RoadSegment> connectors() {
            List<RoadSegment> out = new ArrayList<>();
            for (Entrance e : entrances) if (e.getConnector() != null) out.add(e.getConnector());
            return out;
        }
    }

    /**
     * Boundary edges at least {@code clearance} long whose outward side faces
     * the reference line, best aligned first. Without a reference line the
     * longest edge is the frontage.
     *
     * @throws NoValidFrontageException if no edge qualifies
     */
    public static List<FrontageEdge> frontageEdges(Polygon boundary, LineString reference, double clearance) {
        Coordinate[] c = boundary.getExteriorRing().getCoordinates();
        boolean ccw = Orientation.isCCW(c);
        List<FrontageEdge> out = new ArrayList<>();
        double dirX = 0, dirY = 0;
        if (reference != null) {
            Coordinate a = reference.getCoordinateN(0), b = reference.getCoordinateN(reference.getNumPoints() - 1);
            double len = a.distance(b);
            if (len > 0) { dirX = (b.x - a.x) / len; dirY = (b.y - a.y) / len; }
        }
        FrontageEdge longest = null;
        for (int i = 0; i + 1 < c.length; i++) {
            LineSegment seg = new LineSegment(c[i], c[i + 1]);
            double len = seg.getLength();
            if (len < clearance || len <= 0) continue;
            double ux = (seg.p1.x - seg.p0.x) / len, uy = (seg.p1.y - seg.p0.y) / len;
            // right-hand normal points out of a counter-clockwise ring
            double nx = ccw ? uy : -uy, ny = ccw ? -ux : ux;
            if (reference == null) {
                if (longest == null || len > longest.segment.getLength())
                    longest = new FrontageEdge(seg, nx, ny, 1.0, 0.0);
                continue;
            }
            Point mid = GeomUtils.GF.createPoint(seg.midPoint());
            Coordinate near = DistanceOp.nearestPoints(mid, reference)[1];
            double toX = near.x - mid.getX(), toY = near.y - mid.getY();
            if (nx * toX + ny * toY <= 0) continue;
            double alignment = 1.0 - Math.abs(nx * dirX + ny * dirY);
            out.add(new FrontageEdge(seg, nx, ny, alignment, mid.distance(reference)));
        }
        if (reference == null && longest != null) out.add(longest);
        if (out.isEmpty())
            throw new NoValidFrontageException("no boundary edge of at least " + clearance + " m faces the reference line");
        out.sort(Comparator.comparingDouble((FrontageEdge f) -> -f.alignment)
                .thenComparingDouble(f -> f.distance)
                .thenComparingDouble(f -> -f.segment.getLength()));
        return out;
    }

    /**
     * @param boundary  site boundary, same frame as {@code network}
     * @param reference external reference line or null
     * @param count     desired entrances
     * @param choice    index of the first entrance among the ranked candidates
     */
    public Placement place(Polygon boundary, LineString reference, RoadNetwork network, int count, int choice) {
        if (count <= 0) return new Placement(List.of(), 0);
        List<FrontageEdge> edges = frontageEdges(boundary, reference, clearance);
        List<Candidate> candidates = candidates(edges, network);
        if (candidates.isEmpty()) {
            log.debug("entrances | no candidate reaches the road network");
            return new Placement(List.of(), count);
        }

        List<Candidate> chosen = new ArrayList<>();
        chosen.add(candidates.get(Math.floorMod(choice, candidates.size())));
        while (chosen.size() < count) {
            Candidate best = null;
            double bestD = -1;
            for (Candidate cand : candidates) {
                if (chosen.contains(cand)) continue;
                double d = Double.POSITIVE_INFINITY;
                for (Candidate ch : chosen) d = Math.min(d, cand.onBoundary.distance(ch.onBoundary));
                if (best == null || cand.edge.alignment > best.edge.alignment + ALIGNMENT_TOL
                        || (cand.edge.alignment >= best.edge.alignment - ALIGNMENT_TOL && d > bestD)) {
                    bestD = d;
                    best = cand;
                }
            }
            if (best == null) break;
            chosen.add(best);
        }

        List<Entrance> out = new ArrayList<>();
        for (int i = 0; i < chosen.size(); i++) {
            Candidate cand = chosen.get(i);
            RoadSegment connector = null;
            if (cand.onBoundary.distance(cand.onRoad) > RoadNetwork.TOUCH_EPS) {
                LineString line = GeomUtils.GF.createLineString(new Coordinate[]{
                        new Coordinate(cand.onBoundary), new Coordinate(cand.onRoad)});
                Geometry row = GeomUtils.corridor(line, connectorWidth).intersection(boundary);
                connector = new RoadSegment("road-access-" + (i + 1), RoadClass.ACCESS, line, connectorWidth, row);
            }
            out.add(new Entrance("entrance-" + (i + 1), cand.onBoundary, Math.atan2(-cand.edge.ny, -cand.edge.nx), connector));
        }
        int shortfall = count - out.size();
        log.debug("entrances | candidates={} | placed={} | shortfall={}", candidates.size(), out.size(), shortfall);
        return new Placement(out, shortfall);
    }

    private static final class Candidate {
        final FrontageEdge edge;
        final Coordinate onBoundary;
        final Coordinate onRoad;

        Candidate(FrontageEdge edge, Coordinate onBoundary, Coordinate onRoad) {
            this.edge = edge;
            this.onBoundary = onBoundary;
            this.onRoad = onRoad;
        }
    }

    // nearest boundary-road pairs within connector reach, in edge rank order
    private List<Candidate> candidates(List<FrontageEdge> edges, RoadNetwork network) {
        List<Candidate> out = new ArrayList<>();
        for (FrontageEdge fe : edges) {
            Geometry usable = usablePart(fe.segment);
            for (RoadSegment road : network.getSegments()) {
                Coordinate[] pair = DistanceOp.nearestPoints(usable, road.getCenterline());
                if (pair[0].distance(pair[1]) > maxConnectorLength) continue;
                addDistinct(out, new Candidate(fe, pair[0], pair[1]));
            }
        }
        if (!out.isEmpty() || network.isEmpty()) return out;
        // nothing within reach: connect each edge's usable centre to the closest road
        List<Geometry> lines = new ArrayList<>();
        for (RoadSegment road : network.getSegments()) lines.add(road.getCenterline());
        Geometry all = GeomUtils.GF.buildGeometry(lines);
        for (FrontageEdge fe : edges) {
            Point centre = usablePart(fe.segment).getCentroid();
            Coordinate[] pair = DistanceOp.nearestPoints(centre, all);
            addDistinct(out, new Candidate(fe, pair[0], pair[1]));
        }
        return out;
    }

    private static void addDistinct(List<Candidate> out, Candidate c) {
        for (Candidate o : out) if (o.onBoundary.distance(c.onBoundary) < SAME_POINT_EPS) return;
        out.add(c);
    }

    // edge minus the corner setback at both ends; the midpoint when the edge is too short
    private Geometry usablePart(LineSegment seg) {
        double len = seg.getLength();
        if (len < 2 * cornerSetback) return GeomUtils.GF.createPoint(seg.midPoint());
        Coordinate a = seg.pointAlong(cornerSetback / len);
        Coordinate b = seg.pointAlong(1.0 - cornerSetback / len);
        return GeomUtils.GF.createLineString(new Coordinate[]{a, b});
    }
}
