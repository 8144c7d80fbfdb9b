package org.tesis.parque;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.*;

/**
 * One complete proposed site plan in site coordinates: roads, entrances,
 * lots, facilities, open space and the perimeter buffer. Immutable.
 */
public final class CandidateLayout {

    private final LayoutGenome genome;
    private final Polygon boundary;
    private final Polygon buildable;
    private final RoadNetwork roads;
    private final List<Entrance> entrances;
    private final int entranceShortfall;
    private final List<Lot> lots;
    private final List<InfrastructureElement> infrastructure;
    private final List<PlacementInfeasible> placementFailures;
    private final List<OpenSpace> openSpaces;
    private final Geometry perimeterBuffer;
    private final double lotDepth;

    CandidateLayout(LayoutGenome genome, Polygon boundary, Polygon buildable, RoadNetwork roads,
                    List<Entrance> entrances, int entranceShortfall, List<Lot> lots,
                    List<InfrastructureElement> infrastructure, List<PlacementInfeasible> placementFailures,
                    List<OpenSpace> openSpaces, Geometry perimeterBuffer, double lotDepth) {
        this.genome = genome;
        this.boundary = boundary;
        this.buildable = buildable;
        this.roads = roads;
        this.entrances = List.copyOf(entrances);
        this.entranceShortfall = entranceShortfall;
        this.lots = List.copyOf(lots);
        this.infrastructure = List.copyOf(infrastructure);
        this.placementFailures = List.copyOf(placementFailures);
        this.openSpaces = List.copyOf(openSpaces);
        this.perimeterBuffer = perimeterBuffer;
        this.lotDepth = lotDepth;
    }

    public LayoutGenome getGenome() {
        return genome;
    }

    public Polygon getBoundary() {
        return boundary;
    }

    public Polygon getBuildable() {
        return buildable;
    }

    public RoadNetwork getRoads() {
        return roads;
    }

    public List<Entrance> getEntrances() {
        return entrances;
    }

    public int getEntranceShortfall() {
        return entranceShortfall;
    }

    public List<Lot> getLots() {
        return lots;
    }

    public List<InfrastructureElement> getInfrastructure() {
        return infrastructure;
    }

    public List<PlacementInfeasible> getPlacementFailures() {
        return placementFailures;
    }

    public List<OpenSpace> getOpenSpaces() {
        return openSpaces;
    }

    public Geometry getPerimeterBuffer() {
        return perimeterBuffer;
    }

    /** Depth of one row of lots as laid out by the secondary spacing. */
    public double getLotDepth() {
        return lotDepth;
    }

    public double lotArea() {
        double a = 0;
        for (Lot l : lots) a += l.getArea();
        return a;
    }

    public double infrastructureArea() {
        double a = 0;
        for (InfrastructureElement e : infrastructure) a += e.getArea();
        return a;
    }

    public double openSpaceArea() {
        double a = 0;
        for (OpenSpace o : openSpaces) a += o.getArea();
        return a;
    }

    public Optional<InfrastructureElement> infrastructure(InfrastructureKind kind) {
        for (InfrastructureElement e : infrastructure) if (e.getKind() == kind) return Optional.of(e);
        return Optional.empty();
    }

    /** Every element as an exported feature, roads first, then lots, facilities and open space. */
    public List<LayoutFeature> features() {
        List<LayoutFeature> out = new ArrayList<>();
        for (RoadSegment s : roads.getSegments()) {
            Map<String, String> props = new LinkedHashMap<>();
            props.put("width", fmt(s.getWidth()));
            props.put("length", fmt(s.length()));
            out.add(new LayoutFeature(s.getId(), s.getRoadClass().featureType(), s.getCenterline(), props));
        }
        for (Lot l : lots) {
            Map<String, String> props = new LinkedHashMap<>();
            props.put("area", fmt(l.getArea()));
            props.put("use", l.getUse().name());
            props.put("accessRoad", l.getAccessRoadId());
            out.add(new LayoutFeature(l.getId(), "lot", l.getPolygon(), props));
        }
        for (InfrastructureElement e : infrastructure) {
            Map<String, String> props = new LinkedHashMap<>();
            props.put("area", fmt(e.getArea()));
            props.put("exclusionRadius", fmt(e.getExclusionRadius()));
            out.add(new LayoutFeature(e.getId(), "infrastructure-" + e.getKind().slug(), e.getPolygon(), props));
        }
        for (OpenSpace o : openSpaces) {
            out.add(new LayoutFeature(o.getId(), "open-space", o.getPolygon(),
                    Map.of("area", fmt(o.getArea()), "origin", o.getOrigin().name())));
        }
        if (!perimeterBuffer.isEmpty()) {
            out.add(new LayoutFeature("perimeter-buffer", "open-space", perimeterBuffer,
                    Map.of("area", fmt(perimeterBuffer.getArea()), "origin", "PERIMETER_BUFFER")));
        }
        return out;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    @Override
    public String toString() {
        return "CandidateLayout{lots=" + lots.size() + ", roads=" + roads.getSegments().size()
                + ", infrastructure=" + infrastructure.size() + ", entrances=" + entrances.size() + "}";
    }
}
