package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoadNetworkGeneratorTest {

    private final RoadNetworkGenerator generator = new RoadNetworkGenerator(16, 12, 100, 1000);

    @Test
    @DisplayName("Spine plus secondaries form one connected network inside the buildable area")
    void connectedGrid() {
        Polygon buildable = GeomUtils.rectangle(10, 10, 490, 390);
        RoadNetworkGenerator.Result r = generator.generate(buildable, 52, 0.5, 0, List.of());
        RoadNetwork net = r.getNetwork();
        assertFalse(net.isEmpty());
        assertTrue(net.isConnected());
        assertEquals(1, net.segments(RoadClass.PRIMARY).size());
        assertFalse(net.segments(RoadClass.SECONDARY).isEmpty());
        assertTrue(net.rightOfWay().difference(buildable).getArea() < 1e-6);
        for (RoadSegment s : net.getSegments()) {
            assertTrue(s.getId().startsWith("road-primary-") || s.getId().startsWith("road-secondary-"), s.getId());
        }
    }

    @Test
    @DisplayName("Secondary count and resulting lot depth follow the block spacing")
    void spacing() {
        assertEquals(4, RoadNetworkGenerator.secondaryCount(480, 52, 12, 0));
        assertEquals(54.0, RoadNetworkGenerator.blockDepth(480, 4, 12), 1e-9);
        assertEquals(5, RoadNetworkGenerator.secondaryCount(480, 52, 12, 1));
        assertEquals(480.0, RoadNetworkGenerator.blockDepth(480, 0, 12), 1e-9);
    }

    @Test
    @DisplayName("A seed entrance on a short side pins the spine")
    void seedPinsSpine() {
        Polygon buildable = GeomUtils.rectangle(0, 0, 500, 300);
        RoadNetworkGenerator.Result r = generator.generate(buildable, 52, 0.5, 0, List.of(new Coordinate(0, 100)));
        RoadSegment spine = r.getNetwork().segments(RoadClass.PRIMARY).get(0);
        assertEquals(100, spine.getCenterline().getCoordinateN(0).y, 1e-9);
    }

    @Test
    @DisplayName("On an L-shaped site a collector joins the secondaries the spine misses and no land is left unserved")
    void lShapeCollector() {
        Polygon buildable = GeomUtils.polygon(List.of(
                new Coordinate(10, 10), new Coordinate(590, 10), new Coordinate(590, 190),
                new Coordinate(190, 190), new Coordinate(190, 590), new Coordinate(10, 590)));
        // spine at y = 300 only crosses the vertical arm
        RoadNetworkGenerator.Result r = generator.generate(buildable, 52, 0.5, 0, List.of());
        RoadNetwork net = r.getNetwork();

        assertTrue(net.isConnected());
        List<RoadSegment> primaries = net.segments(RoadClass.PRIMARY);
        assertTrue(primaries.size() >= 2, "spine plus collector");
        assertTrue(primaries.stream().anyMatch(s -> s.getCenterline().getEnvelopeInternal().getMaxX() > 500));
        assertTrue(net.segments(RoadClass.SECONDARY).stream()
                .anyMatch(s -> s.getCenterline().getEnvelopeInternal().getMinX() > 500));
        assertTrue(net.rightOfWay().difference(buildable).getArea() < 1e-6);

        double reach = RoadNetworkGenerator.GAP_REACH * r.getLotDepth();
        List<Geometry> served = new ArrayList<>();
        for (RoadSegment s : net.getSegments()) served.add(s.getCenterline().buffer(s.getWidth() / 2.0 + reach, 4));
        for (Polygon gap : GeomUtils.polygons(buildable.difference(GeomUtils.union(served)))) {
            assertTrue(gap.getArea() < 1000, () -> "unserved piece of " + gap.getArea() + " m²");
        }
    }

    @Test
    @DisplayName("Land out of reach behind a notch gets a spur road")
    void spurIntoGap() {
        // the far end of the strip lies beyond every secondary position
        Polygon buildable = GeomUtils.polygon(List.of(
                new Coordinate(0, 0), new Coordinate(300, 0), new Coordinate(300, 120),
                new Coordinate(120, 120), new Coordinate(120, 400), new Coordinate(0, 400)));
        RoadNetworkGenerator.Result r = generator.generate(buildable, 52, 0.5, 0, List.of());
        RoadNetwork net = r.getNetwork();
        assertTrue(net.isConnected());

        double reach = RoadNetworkGenerator.GAP_REACH * r.getLotDepth();
        List<Geometry> served = new ArrayList<>();
        for (RoadSegment s : net.getSegments()) served.add(s.getCenterline().buffer(s.getWidth() / 2.0 + reach, 4));
        for (Polygon gap : GeomUtils.polygons(buildable.difference(GeomUtils.union(served)))) {
            assertTrue(gap.getArea() < 1000, () -> "unserved piece of " + gap.getArea() + " m²");
        }
    }

    @Test
    @DisplayName("Zero-area input is infeasible")
    void zeroArea() {
        assertThrows(InfeasibleGeometryException.class,
                () -> generator.generate(GeomUtils.emptyPolygon(), 52, 0.5, 0, List.of()));
        assertThrows(InfeasibleGeometryException.class,
                () -> RoadNetworkGenerator.buildableArea(Boundary.rectangle(40, 40), 25));
    }
}
