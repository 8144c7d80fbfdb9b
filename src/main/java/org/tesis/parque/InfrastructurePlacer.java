package org.tesis.parque;

import org.locationtech.jts.geom.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Greedy facility placement. Each requirement, in priority order, takes the
 * best compatible piece of the land pool: the facility is carved from one end
 * of the piece, shrunk by its exclusion radius, and the rest of the piece
 * goes back to the pool before lots are cut.
 */
public class InfrastructurePlacer {

    private static final Logger log = LoggerFactory.getLogger(InfrastructurePlacer.class);

    /** extra distance accepted on top of the exclusion radius for adjacency (m) */
    static final double ADJACENCY_SLACK = 1.0;
    /** share of the required area a carved core must reach */
    static final double MIN_CORE_SHARE = 0.95;

    /** Placed facilities, the rings kept around them and the requirements that failed. */
    public static final class Placement {
        private final List<InfrastructureElement> elements;
        private final List<Polygon> rings;
        private final List<PlacementInfeasible> failures;

        Placement(List<InfrastructureElement> elements, List<Polygon> rings, List<PlacementInfeasible> failures) {
            this.elements = List.copyOf(elements);
            this.rings = List.copyOf(rings);
            this.failures = List.copyOf(failures);
        }

        public List<InfrastructureElement> getElements() {
            return elements;
        }

        public List<Polygon> getRings() {
            return rings;
        }

        public List<PlacementInfeasible> getFailures() {
            return failures;
        }
    }

    /**
     * Places every requirement it can. {@code pool} is consumed: used pieces
     * are replaced by what is left of them.
     *
     * @param rightOfWay    road right-of-way, for road adjacency
     * @param buildableEdge outer ring of the buildable area, for boundary adjacency
     * @param elevation     terrain lookup in the same coordinates as the pool
     */
    Placement place(LandPool pool, List<InfrastructureRequirement> requirements, double siteArea,
                    Geometry rightOfWay, Geometry buildableEdge, ElevationModel elevation) {
        List<InfrastructureElement> elements = new ArrayList<>();
        List<Polygon> rings = new ArrayList<>();
        List<PlacementInfeasible> failures = new ArrayList<>();
        for (InfrastructureRequirement req : requirements) {
            double need = req.requiredArea(siteArea);
            Geometry target = null;
            if (req.getAdjacency() == Adjacency.ROAD) target = rightOfWay;
            else if (req.getAdjacency() == Adjacency.BOUNDARY) target = buildableEdge;
            Carve carve = null;
            boolean sized = false;
            search:
            for (Piece piece : ranked(pool, req, elevation)) {
                for (Carve c : carves(piece, need, req.getExclusionRadius())) {
                    sized = true;
                    if (target != null && c.core.distance(target) > req.getExclusionRadius() + ADJACENCY_SLACK) continue;
                    carve = c;
                    break search;
                }
            }
            if (carve == null) {
                String reason = sized
                        ? "no parcel of " + Math.round(need) + " m2 satisfies " + req.getAdjacency() + " adjacency"
                        : "no remaining parcel fits " + Math.round(need) + " m2";
                failures.add(new PlacementInfeasible(req.getKind(), reason));
                log.warn("infrastructure | {} not placed: {}", req.getKind(), reason);
                continue;
            }
            carve.piece.remove(pool);
            carve.piece.giveBack(pool, carve.remainder);
            rings.addAll(carve.ring);
            elements.add(new InfrastructureElement("infrastructure-" + req.getKind().slug(), req.getKind(),
                    carve.core, req.getExclusionRadius(), req.getAdjacency()));
            log.debug("infrastructure | {} placed | area={}", req.getKind(), Math.round(carve.core.getArea()));
        }
        return new Placement(elements, rings, failures);
    }

    private static final class Piece {
        final Polygon polygon;
        final Strip strip;

        Piece(Polygon polygon, Strip strip) {
            this.polygon = polygon;
            this.strip = strip;
        }

        boolean runAlongX() {
            if (strip != null) return strip.runAlongX();
            Envelope e = polygon.getEnvelopeInternal();
            return e.getWidth() >= e.getHeight();
        }

        void remove(LandPool pool) {
            if (strip != null) pool.strips.remove(strip);
            else pool.residual.remove(polygon);
        }

        void giveBack(LandPool pool, List<Polygon> parts) {
            for (Polygon p : parts) {
                if (strip != null) pool.strips.add(new Strip(p, strip.depthAlongX));
                else pool.residual.add(p);
            }
        }
    }

    private static final class Carve {
        final Piece piece;
        final Polygon core;
        final List<Polygon> ring;
        final List<Polygon> remainder;

        Carve(Piece piece, Polygon core, List<Polygon> ring, List<Polygon> remainder) {
            this.piece = piece;
            this.core = core;
            this.ring = ring;
            this.remainder = remainder;
        }
    }

    // residual land before strips, lowest first when the facility prefers it, then largest
    private static List<Piece> ranked(LandPool pool, InfrastructureRequirement req, ElevationModel elevation) {
        List<Piece> pieces = new ArrayList<>();
        for (Polygon p : pool.residual) pieces.add(new Piece(p, null));
        for (Strip s : pool.strips) pieces.add(new Piece(s.polygon, s));
        Comparator<Piece> order = Comparator.comparingInt(p -> p.strip == null ? 0 : 1);
        if (req.isPreferLowElevation() && elevation != ElevationModel.FLAT) {
            Map<Piece, Double> z = new IdentityHashMap<>();
            for (Piece p : pieces) {
                Point c = p.polygon.getCentroid();
                z.put(p, elevation.elevationAt(c.getX(), c.getY()));
            }
            order = Comparator.comparingDouble((Piece p) -> z.get(p)).thenComparing(order);
        }
        order = order.thenComparingDouble(p -> -p.polygon.getArea());
        // stable sort keeps pool order among equals
        pieces.sort(order);
        return pieces;
    }

    /** Ways to carve {@code need} m² plus its ring from the low and the high end of the piece. */
    private static List<Carve> carves(Piece piece, double need, double r) {
        List<Carve> out = new ArrayList<>(2);
        Polygon p = piece.polygon;
        boolean alongX = piece.runAlongX();
        Envelope e = p.getEnvelopeInternal();
        double cross = alongX ? e.getHeight() : e.getWidth();
        if (cross - 2 * r <= 0) return out;
        double length = need / (cross - 2 * r) + 2 * r;
        double carvedArea = length * cross;
        if (carvedArea > p.getArea() * (1 + 1e-9)) return out;
        for (boolean fromLow : new boolean[]{true, false}) {
            Carve c = carveFrom(piece, alongX, fromLow, carvedArea, need, r);
            if (c != null) out.add(c);
        }
        return out;
    }

    private static Carve carveFrom(Piece piece, boolean alongX, boolean fromLow, double carvedArea, double need, double r) {
        Polygon p = piece.polygon;
        double c = GeomUtils.cutCoordinateForArea(p, alongX, fromLow, carvedArea);
        Geometry[] parts = GeomUtils.cut(p, alongX, c);
        Geometry carved = fromLow ? parts[0] : parts[1];
        Geometry rest = fromLow ? parts[1] : parts[0];
        Polygon block = GeomUtils.largest(carved);
        if (block == null) return null;
        Polygon core = r > 0 ? GeomUtils.largest(GeomUtils.shrink(block, r)) : block;
        if (core == null || core.getArea() < MIN_CORE_SHARE * need) return null;
        List<Polygon> ring = r > 0 ? GeomUtils.polygons(block.difference(core)) : new ArrayList<>();
        List<Polygon> remainder = new ArrayList<>(GeomUtils.polygons(rest));
        for (Polygon q : GeomUtils.polygons(carved)) if (q != block) remainder.add(q);
        return new Carve(piece, core, ring, remainder);
    }
}
