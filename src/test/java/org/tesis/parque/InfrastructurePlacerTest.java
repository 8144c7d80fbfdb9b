package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InfrastructurePlacerTest {

    private static LandPool pool(Polygon buildable, Geometry row) {
        return new LotSubdivider(1000, 1200, 2000, 4).partition(buildable, row, 40);
    }

    @Test
    @DisplayName("A road-adjacent facility is carved from a strip with its clear ring kept aside")
    void carvesWithRing() {
        Polygon buildable = GeomUtils.rectangle(0, 0, 300, 100);
        Geometry row = GeomUtils.rectangle(0, 44, 300, 56);
        LandPool pool = pool(buildable, row);
        double before = pool.area();
        InfrastructureRequirement sub = new InfrastructureRequirement(InfrastructureKind.SUBSTATION, 1500, 0,
                Adjacency.ROAD, false, 5);

        InfrastructurePlacer.Placement p = new InfrastructurePlacer().place(pool, List.of(sub), 30000, row,
                buildable.getExteriorRing(), ElevationModel.FLAT);

        assertTrue(p.getFailures().isEmpty());
        assertEquals(1, p.getElements().size());
        InfrastructureElement e = p.getElements().get(0);
        assertEquals("infrastructure-substation", e.getId());
        assertTrue(e.getArea() >= InfrastructurePlacer.MIN_CORE_SHARE * 1500);
        assertTrue(e.getPolygon().distance(row) <= 5 + InfrastructurePlacer.ADJACENCY_SLACK);
        double ring = 0;
        for (Polygon r : p.getRings()) ring += r.getArea();
        assertEquals(before, pool.area() + e.getArea() + ring, 1e-3);
    }

    @Test
    @DisplayName("An oversized facility is recorded as infeasible and the rest still placed")
    void recordsFailure() {
        Polygon buildable = GeomUtils.rectangle(0, 0, 300, 100);
        Geometry row = GeomUtils.rectangle(0, 44, 300, 56);
        LandPool pool = pool(buildable, row);
        InfrastructureRequirement huge = new InfrastructureRequirement(InfrastructureKind.WATER_TREATMENT, 50_000, 0,
                Adjacency.ROAD, false, 0);
        InfrastructureRequirement pond = InfrastructureRequirement.defaults(InfrastructureKind.DETENTION_POND);

        InfrastructurePlacer.Placement p = new InfrastructurePlacer().place(pool, List.of(huge, pond), 30000, row,
                buildable.getExteriorRing(), ElevationModel.FLAT);

        assertEquals(1, p.getFailures().size());
        PlacementInfeasible f = p.getFailures().get(0);
        assertEquals(InfrastructureKind.WATER_TREATMENT, f.getKind());
        assertNotNull(f.getReason());
        assertEquals(1, p.getElements().size());
        assertEquals(InfrastructureKind.DETENTION_POND, p.getElements().get(0).getKind());
    }

    @Test
    @DisplayName("Facilities of the seeded layout stay clear of every lot")
    void clearOfLots() {
        CandidateLayout layout = Sites.decoder().decode(LayoutGenome.seeded(Sites.industrialPark()));
        assertEquals(Sites.industrialPark().getInfrastructure().size(),
                layout.getInfrastructure().size() + layout.getPlacementFailures().size());
        for (InfrastructureElement e : layout.getInfrastructure()) {
            assertTrue(layout.getBoundary().covers(e.getPolygon()));
            for (Lot l : layout.getLots()) {
                assertTrue(e.getPolygon().distance(l.getPolygon()) >= e.getExclusionRadius() - 0.01,
                        e.getId() + " vs " + l.getId());
            }
        }
    }
}
