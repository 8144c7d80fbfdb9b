package org.tesis.parque;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.*;

/**
 * Planar road graph. Two segments are connected when their centerlines touch.
 */
public final class RoadNetwork {

    /** centerlines closer than this are considered joined (m) */
    static final double TOUCH_EPS = 1e-6;

    private final List<RoadSegment> segments;
    private final Map<String, Set<String>> adjacency;
    private Geometry rightOfWay;

    public RoadNetwork(List<RoadSegment> segments) {
        this(segments, buildAdjacency(segments));
    }

    private RoadNetwork(List<RoadSegment> segments, Map<String, Set<String>> adjacency) {
        this.segments = List.copyOf(segments);
        this.adjacency = adjacency;
    }

    private static Map<String, Set<String>> buildAdjacency(List<RoadSegment> segs) {
        Map<String, Set<String>> adj = new LinkedHashMap<>();
        for (RoadSegment s : segs) {
            if (adj.put(s.getId(), new TreeSet<>()) != null)
                throw new IllegalArgumentException("duplicate road id " + s.getId());
        }
        for (int i = 0; i < segs.size(); i++) {
            for (int j = i + 1; j < segs.size(); j++) {
                RoadSegment a = segs.get(i), b = segs.get(j);
                if (!a.getCenterline().getEnvelopeInternal().intersects(b.getCenterline().getEnvelopeInternal())) {
                    if (a.getCenterline().getEnvelopeInternal().distance(b.getCenterline().getEnvelopeInternal()) > TOUCH_EPS)
                        continue;
                }
                if (a.getCenterline().distance(b.getCenterline()) <= TOUCH_EPS) {
                    adj.get(a.getId()).add(b.getId());
                    adj.get(b.getId()).add(a.getId());
                }
            }
        }
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        adj.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        return Collections.unmodifiableMap(frozen);
    }

    /** Network plus the given segments, connectivity recomputed. */
    public RoadNetwork withSegments(List<RoadSegment> extra) {
        if (extra.isEmpty()) return this;
        List<RoadSegment> all = new ArrayList<>(segments);
        all.addAll(extra);
        return new RoadNetwork(all);
    }

    // same graph, geometry mapped; the rigid transform keeps the topology
    RoadNetwork transformed(AffineTransformation t) {
        List<RoadSegment> out = new ArrayList<>(segments.size());
        for (RoadSegment s : segments) out.add(s.transformed(t));
        return new RoadNetwork(out, adjacency);
    }

    public List<RoadSegment> getSegments() {
        return segments;
    }

    public List<RoadSegment> segments(RoadClass cls) {
        List<RoadSegment> out = new ArrayList<>();
        for (RoadSegment s : segments) if (s.getRoadClass() == cls) out.add(s);
        return out;
    }

    public Set<String> neighbours(String id) {
        Set<String> n = adjacency.get(id);
        if (n == null) throw new IllegalArgumentException("unknown road " + id);
        return n;
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /** Number of connected components; 0 for an empty network. */
    public int componentCount() {
        Set<String> seen = new HashSet<>();
        int components = 0;
        for (RoadSegment s : segments) {
            if (seen.contains(s.getId())) continue;
            components++;
            Deque<String> stack = new ArrayDeque<>();
            stack.push(s.getId());
            seen.add(s.getId());
            while (!stack.isEmpty()) {
                for (String n : adjacency.get(stack.pop())) {
                    if (seen.add(n)) stack.push(n);
                }
            }
        }
        return components;
    }

    public boolean isConnected() {
        return componentCount() <= 1;
    }

    /** Segments meeting at least two others. */
    public int junctionCount() {
        int j = 0;
        for (Set<String> n : adjacency.values()) if (n.size() >= 2) j++;
        return j;
    }

    public double totalLength() {
        double l = 0;
        for (RoadSegment s : segments) l += s.length();
        return l;
    }

    public double length(RoadClass cls) {
        double l = 0;
        for (RoadSegment s : segments) if (s.getRoadClass() == cls) l += s.length();
        return l;
    }

    /** Union of all right-of-way polygons. */
    public synchronized Geometry rightOfWay() {
        if (rightOfWay == null) {
            List<Geometry> rows = new ArrayList<>(segments.size());
            for (RoadSegment s : segments) rows.add(s.getRightOfWay());
            rightOfWay = GeomUtils.union(rows);
        }
        return rightOfWay;
    }

    @Override
    public String toString() {
        return "RoadNetwork{segments=" + segments.size() + ", length=" + Math.round(totalLength())
                + ", components=" + componentCount() + "}";
    }
}
