package org.tesis.parque;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a genome into a full candidate layout: roads, entrances, facility
 * placement, then lots. Everything geometric that does not depend on the
 * genome (buildable area, both working frames) is computed once here, so one
 * decoder belongs to one optimization run. Decoding is deterministic and
 * thread-safe.
 */
public class LayoutDecoder {

    private static final Logger log = LoggerFactory.getLogger(LayoutDecoder.class);

    /** unserved land below this share of the minimum lot size gets no spur road */
    static final double MIN_GAP_SHARE = 0.5;

    private final Boundary boundary;
    private final LineString reference;
    private final ParameterSet params;
    private final Polygon buildable;
    private final Geometry bufferRing;
    private final FrameContext[] frames = new FrameContext[2];
    private final RoadNetworkGenerator roadGenerator;
    private final EntrancePlacer entrancePlacer;
    private final InfrastructurePlacer infrastructurePlacer = new InfrastructurePlacer();

    private static final class FrameContext {
        final LayoutFrame frame;
        final Polygon boundary;
        final Polygon buildable;
        final Geometry buildableEdge;
        final LineString reference;
        final List<Coordinate> seeds;

        FrameContext(LayoutFrame frame, Polygon boundary, Polygon buildable, LineString reference, ParameterSet params) {
            this.frame = frame;
            this.boundary = (Polygon) frame.toFrame(boundary);
            this.buildable = (Polygon) frame.toFrame(buildable);
            this.buildableEdge = this.buildable.getExteriorRing();
            this.reference = reference == null ? null : (LineString) frame.toFrame(reference);
            this.seeds = seeds(this.boundary, this.reference, params);
        }

        // middle of the best frontage edge; entrance placement reports a missing frontage on decode
        private static List<Coordinate> seeds(Polygon boundary, LineString reference, ParameterSet params) {
            if (params.getEntranceCount() <= 0) return List.of();
            try {
                List<EntrancePlacer.FrontageEdge> edges =
                        EntrancePlacer.frontageEdges(boundary, reference, params.getEntranceClearance());
                return List.of(edges.get(0).getSegment().midPoint());
            } catch (NoValidFrontageException e) {
                log.debug("decoder | no frontage to seed the spine | {}", e.getMessage());
                return List.of();
            }
        }
    }

    /**
     * @throws InfeasibleGeometryException if the perimeter buffer leaves no buildable area
     */
    public LayoutDecoder(Boundary boundary, LineString reference, ParameterSet params) {
        this.boundary = Objects.requireNonNull(boundary, "boundary");
        this.reference = reference;
        this.params = Objects.requireNonNull(params, "params");
        this.buildable = RoadNetworkGenerator.buildableArea(boundary, params.getPerimeterBuffer());
        this.bufferRing = boundary.shell().difference(buildable);
        for (int i = 0; i < 2; i++) {
            frames[i] = new FrameContext(LayoutFrame.of(buildable, i == 1), boundary.shell(), buildable, reference, params);
        }
        this.roadGenerator = new RoadNetworkGenerator(params.getPrimaryRoadWidth(), params.getSecondaryRoadWidth(),
                params.getServiceDistance(), MIN_GAP_SHARE * params.getLotSizeMin());
        this.entrancePlacer = EntrancePlacer.forParameters(params);
    }

    public Boundary getBoundary() {
        return boundary;
    }

    public LineString getReference() {
        return reference;
    }

    public ParameterSet getParams() {
        return params;
    }

    public Polygon getBuildable() {
        return buildable;
    }

    public CandidateLayout decode(LayoutGenome genome) {
        FrameContext fc = frames[genome.crossAxis() ? 1 : 0];
        double lotSize = genome.lotSize(params.getLotSizeMin(), params.getLotSizeMax());

        RoadNetworkGenerator.Result roads = roadGenerator.generate(fc.buildable, genome.lotDepth(lotSize),
                genome.spineOffset(), genome.secondaryDelta(), fc.seeds);
        EntrancePlacer.Placement entrances = entrancePlacer.place(fc.boundary, fc.reference, roads.getNetwork(),
                params.getEntranceCount(), genome.entranceChoice());
        RoadNetwork network = roads.getNetwork().withSegments(entrances.connectors());
        Geometry row = network.rightOfWay();

        LotSubdivider subdivider = new LotSubdivider(params.getLotSizeMin(), lotSize, params.getLotSizeMax(),
                params.getMaxAspectRatio());
        LandPool pool = subdivider.partition(fc.buildable, row, roads.getLotDepth());
        InfrastructurePlacer.Placement infra = infrastructurePlacer.place(pool, params.getInfrastructure(),
                boundary.area(), row, fc.buildableEdge, fc.frame.frameElevation(params.getElevationModel()));
        LotSubdivider.Subdivision sub = subdivider.subdivide(pool, network, params.getIndustryType(), genome.cutSeed());

        AffineTransformation w = fc.frame.toWorldTransform();
        List<Lot> lots = new ArrayList<>(sub.getLots().size());
        for (Lot l : sub.getLots()) lots.add(l.transformed(w));
        List<InfrastructureElement> elements = new ArrayList<>();
        for (InfrastructureElement e : infra.getElements()) elements.add(e.transformed(w));
        List<OpenSpace> open = new ArrayList<>();
        for (Polygon p : sub.getResidual()) {
            open.add(new OpenSpace("open-space-" + (open.size() + 1), (Polygon) w.transform(p), OpenSpace.Origin.RESIDUAL));
        }
        for (Polygon p : infra.getRings()) {
            open.add(new OpenSpace("open-space-" + (open.size() + 1), (Polygon) w.transform(p), OpenSpace.Origin.EXCLUSION_RING));
        }
        List<Entrance> worldEntrances = new ArrayList<>();
        for (Entrance e : entrances.getEntrances()) worldEntrances.add(e.transformed(w, fc.frame.angle()));
        RoadNetwork worldNetwork = network.transformed(w);

        Geometry buffer = bufferRing;
        List<Geometry> connectorRows = new ArrayList<>();
        for (RoadSegment s : worldNetwork.segments(RoadClass.ACCESS)) connectorRows.add(s.getRightOfWay());
        if (!connectorRows.isEmpty()) buffer = bufferRing.difference(GeomUtils.union(connectorRows));

        return new CandidateLayout(genome, boundary.polygon(), (Polygon) buildable.copy(), worldNetwork,
                worldEntrances, entrances.getShortfall(), lots, elements, infra.getFailures(), open, buffer,
                roads.getLotDepth());
    }
}
