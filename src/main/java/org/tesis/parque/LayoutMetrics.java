package org.tesis.parque;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.*;

/**
 * Land-use figures of one layout, measured once. {@link #measure(Quantity)}
 * is the rule interpreter's view of them; {@code NaN} means the quantity
 * does not apply to this layout (no lots, no secondary roads, ...).
 */
public final class LayoutMetrics {

    private static final double SIZE_TOL = 1e-6;

    private final double siteArea;
    private final double buildableArea;
    private final double lotArea;
    private final double roadArea;
    private final double bufferArea;
    private final double openSpaceArea;
    private final double pondArea;
    private final double infrastructureArea;
    private final int lotCount;
    private final int minLotCount;
    private final double minPrimaryWidth;
    private final double minSecondaryWidth;
    private final double perimeterBufferWidth;
    private final double clearanceMargin;
    private final int lotsWithoutFrontage;
    private final double overlapArea;
    private final double outsideArea;
    private final double sizeConformance;
    private final double aspectConformance;
    private final double lotQuality;
    private final int extraComponents;
    private final int entranceShortfall;
    private final int unplaced;
    private final double serviceCoverage;
    private final double largestResidual;
    private final double lotSizeMin;
    private final double roadLength;
    private final Set<InfrastructureKind> placedKinds;

    private LayoutMetrics(CandidateLayout layout, ParameterSet params) {
        Polygon boundary = layout.getBoundary();
        siteArea = boundary.getArea();
        buildableArea = layout.getBuildable().getArea();
        List<Lot> lots = layout.getLots();
        lotCount = lots.size();
        minLotCount = params.getMinLotCount();
        lotArea = layout.lotArea();
        Geometry row = layout.getRoads().rightOfWay();
        roadArea = row.getArea();
        roadLength = layout.getRoads().totalLength();
        bufferArea = layout.getPerimeterBuffer().getArea();
        openSpaceArea = layout.openSpaceArea();
        infrastructureArea = layout.infrastructureArea();
        double ponds = 0;
        EnumSet<InfrastructureKind> kinds = EnumSet.noneOf(InfrastructureKind.class);
        for (InfrastructureElement e : layout.getInfrastructure()) {
            kinds.add(e.getKind());
            if (e.getKind().isGreen()) ponds += e.getArea();
        }
        pondArea = ponds;
        placedKinds = Collections.unmodifiableSet(kinds);

        double minP = Double.NaN, minS = Double.NaN;
        for (RoadSegment s : layout.getRoads().getSegments()) {
            if (s.getRoadClass() == RoadClass.SECONDARY) minS = Double.isNaN(minS) ? s.getWidth() : Math.min(minS, s.getWidth());
            else minP = Double.isNaN(minP) ? s.getWidth() : Math.min(minP, s.getWidth());
        }
        minPrimaryWidth = minP;
        minSecondaryWidth = minS;

        LineString ring = boundary.getExteriorRing();
        double buf = Double.NaN;
        for (Lot l : lots) buf = minNaN(buf, ring.distance(l.getPolygon()));
        for (InfrastructureElement e : layout.getInfrastructure()) buf = minNaN(buf, ring.distance(e.getPolygon()));
        for (RoadSegment s : layout.getRoads().getSegments()) {
            if (s.getRoadClass() != RoadClass.ACCESS) buf = minNaN(buf, ring.distance(s.getRightOfWay()));
        }
        perimeterBufferWidth = buf;

        STRtree lotIndex = new STRtree();
        for (Lot l : lots) lotIndex.insert(l.getPolygon().getEnvelopeInternal(), l.getPolygon());
        double margin = Double.NaN;
        for (InfrastructureElement e : layout.getInfrastructure()) {
            double r = e.getExclusionRadius();
            if (r <= 0) continue;
            Envelope near = new Envelope(e.getPolygon().getEnvelopeInternal());
            near.expandBy(r + 1.0);
            for (Object o : lotIndex.query(near)) {
                margin = minNaN(margin, e.getPolygon().distance((Geometry) o) - r);
            }
        }
        clearanceMargin = margin;

        PreparedGeometry zone = PreparedGeometryFactory.prepare(row.buffer(GeomUtils.EDGE_EPS));
        int noFront = 0;
        for (Lot l : lots) if (GeomUtils.frontageLength(l.getPolygon(), zone) < LotSubdivider.MIN_FRONTAGE) noFront++;
        lotsWithoutFrontage = noFront;

        overlapArea = overlap(layout);

        PreparedGeometry inside = PreparedGeometryFactory.prepare(boundary);
        List<Geometry> placed = new ArrayList<>();
        for (Lot l : lots) placed.add(l.getPolygon());
        for (InfrastructureElement e : layout.getInfrastructure()) placed.add(e.getPolygon());
        for (RoadSegment s : layout.getRoads().getSegments()) placed.add(s.getRightOfWay());
        double out = 0;
        for (Geometry g : placed) if (!inside.covers(g)) out += g.difference(boundary).getArea();
        outsideArea = out;

        double min = params.getLotSizeMin(), max = params.getLotSizeMax(), maxAspect = params.getMaxAspectRatio();
        int sizeOk = 0, aspectOk = 0;
        double quality = 0;
        for (Lot l : lots) {
            double a = l.getArea();
            if (a >= min * (1 - SIZE_TOL) && a <= max * (1 + SIZE_TOL)) sizeOk++;
            double aspect = GeomUtils.aspectRatio(l.getPolygon());
            if (aspect <= maxAspect * (1 + SIZE_TOL)) aspectOk++;
            double aspectScore = aspect <= maxAspect ? 1.0 : maxAspect / aspect;
            quality += 0.6 * aspectScore + 0.4 * GeomUtils.rectangularity(l.getPolygon());
        }
        sizeConformance = lotCount == 0 ? Double.NaN : (double) sizeOk / lotCount;
        aspectConformance = lotCount == 0 ? Double.NaN : (double) aspectOk / lotCount;
        lotQuality = lotCount == 0 ? 0 : quality / lotCount;

        extraComponents = Math.max(0, layout.getRoads().componentCount() - 1);
        entranceShortfall = layout.getEntranceShortfall();
        unplaced = layout.getPlacementFailures().size();

        double largest = 0;
        for (OpenSpace o : layout.getOpenSpaces()) {
            if (o.getOrigin() == OpenSpace.Origin.RESIDUAL) largest = Math.max(largest, o.getArea());
        }
        largestResidual = largest;
        lotSizeMin = params.getLotSizeMin();

        if (layout.getRoads().isEmpty() || buildableArea <= 0) {
            serviceCoverage = 0;
        } else {
            List<LineString> lines = new ArrayList<>();
            for (RoadSegment s : layout.getRoads().getSegments()) lines.add(s.getCenterline());
            Geometry reach = GeomUtils.GF.createMultiLineString(lines.toArray(new LineString[0]))
                    .buffer(params.getServiceDistance(), 4);
            serviceCoverage = Math.min(1.0, layout.getBuildable().intersection(reach).getArea() / buildableArea);
        }
    }

    public static LayoutMetrics of(CandidateLayout layout, ParameterSet params) {
        return new LayoutMetrics(layout, params);
    }

    private static double minNaN(double acc, double v) {
        return Double.isNaN(acc) ? v : Math.min(acc, v);
    }

    // pairwise interior overlap among lots and facilities
    private static double overlap(CandidateLayout layout) {
        List<Polygon> parts = new ArrayList<>();
        for (Lot l : layout.getLots()) parts.add(l.getPolygon());
        for (InfrastructureElement e : layout.getInfrastructure()) parts.add(e.getPolygon());
        STRtree index = new STRtree();
        for (int i = 0; i < parts.size(); i++) index.insert(parts.get(i).getEnvelopeInternal(), i);
        double total = 0;
        for (int i = 0; i < parts.size(); i++) {
            Polygon a = parts.get(i);
            for (Object o : index.query(a.getEnvelopeInternal())) {
                int j = (Integer) o;
                if (j <= i) continue;
                Polygon b = parts.get(j);
                Envelope common = a.getEnvelopeInternal().intersection(b.getEnvelopeInternal());
                if (common.isNull() || common.getArea() <= 0) continue;
                if (GeomUtils.isAxisRectangle(a) && GeomUtils.isAxisRectangle(b)) total += common.getArea();
                else total += a.intersection(b).getArea();
            }
        }
        return total;
    }

    /** Value of {@code q} for this layout, or NaN when it does not apply. */
    public double measure(Quantity q) {
        switch (q) {
            case SALABLE_FRACTION: return lotArea / siteArea;
            case GREEN_FRACTION: return greenArea() / siteArea;
            case ROAD_FRACTION: return roadArea / siteArea;
            case INFRASTRUCTURE_FRACTION: return infrastructureArea / siteArea;
            case MIN_PRIMARY_ROAD_WIDTH: return minPrimaryWidth;
            case MIN_SECONDARY_ROAD_WIDTH: return minSecondaryWidth;
            case PERIMETER_BUFFER_WIDTH: return perimeterBufferWidth;
            case INFRASTRUCTURE_CLEARANCE_MARGIN: return clearanceMargin;
            case LOTS_WITHOUT_FRONTAGE: return lotsWithoutFrontage;
            case LOT_OVERLAP_AREA: return overlapArea;
            case PARTITION_ERROR: return partitionError();
            case LAYOUT_OUTSIDE_BOUNDARY_AREA: return outsideArea;
            case LOT_COUNT_RATIO: return minLotCount <= 0 ? Double.NaN : (double) lotCount / minLotCount;
            case LOT_SIZE_CONFORMANCE: return sizeConformance;
            case LOT_ASPECT_CONFORMANCE: return aspectConformance;
            case ROAD_NETWORK_DISCONNECTED: return extraComponents;
            case ENTRANCE_SHORTFALL: return entranceShortfall;
            case INFRASTRUCTURE_UNPLACED: return unplaced;
            case SERVICE_COVERAGE: return serviceCoverage;
            case LARGEST_RESIDUAL_RATIO: return lotSizeMin <= 0 ? Double.NaN : largestResidual / lotSizeMin;
            default: throw new IllegalArgumentException("unknown quantity " + q);
        }
    }

    public double partitionError() {
        double accounted = lotArea + infrastructureArea + openSpaceArea + roadArea + bufferArea;
        return Math.abs(siteArea - accounted) / siteArea;
    }

    public double greenArea() {
        return bufferArea + openSpaceArea + pondArea;
    }

    /** 1 minus the road share of the land given to roads and lots. */
    public double roadEfficiency() {
        double d = roadArea + lotArea;
        return d <= 0 ? 0 : 1.0 - roadArea / d;
    }

    public double getSiteArea() {
        return siteArea;
    }

    public double getBuildableArea() {
        return buildableArea;
    }

    public double getLotArea() {
        return lotArea;
    }

    public double getRoadArea() {
        return roadArea;
    }

    public double getRoadLength() {
        return roadLength;
    }

    public double getBufferArea() {
        return bufferArea;
    }

    public double getOpenSpaceArea() {
        return openSpaceArea;
    }

    public double getInfrastructureArea() {
        return infrastructureArea;
    }

    /** Area of the largest leftover piece; 0 when every piece of land was used. */
    public double getLargestResidualArea() {
        return largestResidual;
    }

    public int getLotCount() {
        return lotCount;
    }

    public double getMeanLotArea() {
        return lotCount == 0 ? 0 : lotArea / lotCount;
    }

    /** Mean of 0.6 aspect conformance + 0.4 rectangularity over lots; 0 without lots. */
    public double getLotQuality() {
        return lotQuality;
    }

    public double getServiceCoverage() {
        return serviceCoverage;
    }

    public Set<InfrastructureKind> getPlacedKinds() {
        return placedKinds;
    }

    public double getSalableFraction() {
        return lotArea / siteArea;
    }

    public double getGreenFraction() {
        return greenArea() / siteArea;
    }

    public double getRoadFraction() {
        return roadArea / siteArea;
    }
}
