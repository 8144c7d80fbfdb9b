package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntrancePlacerTest {

    private final Polygon site = Sites.twentyHectares().polygon();

    @Test
    @DisplayName("The edge facing the highway ranks first")
    void frontageFacesReference() {
        List<EntrancePlacer.FrontageEdge> edges = EntrancePlacer.frontageEdges(site, Sites.highway(), 30);
        EntrancePlacer.FrontageEdge first = edges.get(0);
        assertEquals(0.0, first.getSegment().p0.y, 1e-9);
        assertEquals(0.0, first.getSegment().p1.y, 1e-9);
        assertEquals(1.0, first.getAlignment(), 1e-9);
        assertEquals(20.0, first.getDistance(), 1e-9);
    }

    @Test
    @DisplayName("Without a reference line the longest edge is the frontage")
    void longestEdgeFallback() {
        List<EntrancePlacer.FrontageEdge> edges = EntrancePlacer.frontageEdges(site, null, 30);
        assertEquals(1, edges.size());
        assertEquals(500.0, edges.get(0).getSegment().getLength(), 1e-9);
    }

    @Test
    @DisplayName("No edge long enough for the clearance means no valid frontage")
    void noFrontage() {
        assertThrows(NoValidFrontageException.class, () -> EntrancePlacer.frontageEdges(site, Sites.highway(), 1000));
    }

    @Test
    @DisplayName("Entrances sit on the boundary and connect to the road grid")
    void placesConnectedEntrances() {
        RoadNetwork grid = new RoadNetworkGenerator(16, 12, 100, 1000)
                .generate(GeomUtils.rectangle(10, 10, 490, 390), 52, 0.5, 0, List.of()).getNetwork();
        EntrancePlacer placer = new EntrancePlacer(30, 50, 12, 31);
        EntrancePlacer.Placement p = placer.place(site, Sites.highway(), grid, 2, 0);

        assertEquals(2, p.getEntrances().size());
        assertEquals(0, p.getShortfall());
        for (Entrance e : p.getEntrances()) {
            assertEquals(0.0, e.getPoint().y, 1e-6);
            assertNotNull(e.getConnector());
            assertEquals(RoadClass.ACCESS, e.getConnector().getRoadClass());
            assertTrue(e.getConnector().getId().startsWith("road-access-"));
            // inward means north for the south edge
            assertEquals(Math.PI / 2, e.getInwardAngle(), 1e-9);
        }
        RoadNetwork joined = grid.withSegments(p.connectors());
        assertTrue(joined.isConnected());
        Coordinate a = p.getEntrances().get(0).getPoint(), b = p.getEntrances().get(1).getPoint();
        assertTrue(a.distance(b) > 100, "second entrance is spread away from the first");
    }

    @Test
    @DisplayName("Asking for more entrances than candidates reports a shortfall")
    void shortfall() {
        RoadNetwork grid = new RoadNetworkGenerator(16, 12, 100, 1000)
                .generate(GeomUtils.rectangle(10, 10, 490, 390), 52, 0.5, 0, List.of()).getNetwork();
        EntrancePlacer.Placement p = new EntrancePlacer(30, 50, 12, 31).place(site, Sites.highway(), grid, 6, 0);
        assertEquals(4, p.getEntrances().size());
        assertEquals(2, p.getShortfall());
    }

    @Test
    @DisplayName("A further entrance stays on the best aligned edge before spreading to a chamfer")
    void furtherEntrancePrefersAlignedEdge() {
        Polygon chamfered = GeomUtils.polygon(List.of(
                new Coordinate(0, 0), new Coordinate(300, 0), new Coordinate(400, 100),
                new Coordinate(400, 300), new Coordinate(0, 300)));
        RoadNetwork net = new RoadNetwork(List.of(
                road("road-secondary-1", 100, 10, 100, 250),
                road("road-secondary-2", 200, 10, 200, 250),
                road("road-primary-1", 10, 250, 390, 250),
                road("road-secondary-3", 350, 80, 350, 250)));

        List<EntrancePlacer.FrontageEdge> edges = EntrancePlacer.frontageEdges(chamfered, Sites.highway(), 30);
        assertEquals(2, edges.size());
        assertTrue(edges.get(1).getAlignment() < 0.5, "the chamfer faces the highway at 45 degrees");

        EntrancePlacer.Placement p = new EntrancePlacer(30, 50, 12, 40).place(chamfered, Sites.highway(), net, 2, 0);
        assertEquals(2, p.getEntrances().size());
        Coordinate first = p.getEntrances().get(0).getPoint(), second = p.getEntrances().get(1).getPoint();
        assertEquals(100.0, first.x, 1e-6);
        assertEquals(0.0, second.y, 1e-6);
        assertEquals(200.0, second.x, 1e-6);
    }

    private static RoadSegment road(String id, double x0, double y0, double x1, double y1) {
        double width = id.startsWith("road-primary-") ? 16 : 12;
        LineString line = GeomUtils.line(x0, y0, x1, y1);
        RoadClass cls = id.startsWith("road-primary-") ? RoadClass.PRIMARY : RoadClass.SECONDARY;
        return new RoadSegment(id, cls, line, width, GeomUtils.corridor(line, width));
    }
}
