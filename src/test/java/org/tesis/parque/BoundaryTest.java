package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundaryTest {

    @Test
    @DisplayName("Clockwise input is normalized to a counter-clockwise shell")
    void orientation() {
        Boundary b = Boundary.of(List.of(new Coordinate(0, 0), new Coordinate(0, 10),
                new Coordinate(10, 10), new Coordinate(10, 0)));
        assertTrue(Orientation.isCCW(b.polygon().getExteriorRing().getCoordinates()));
        assertEquals(100, b.area(), 1e-9);
        assertEquals(4, b.edges().size());
    }

    @Test
    @DisplayName("Degenerate and self-intersecting rings are rejected")
    void invalidRings() {
        assertThrows(IllegalArgumentException.class,
                () -> Boundary.of(List.of(new Coordinate(0, 0), new Coordinate(1, 1))));
        assertThrows(IllegalArgumentException.class,
                () -> Boundary.of(List.of(new Coordinate(0, 0), new Coordinate(10, 10),
                        new Coordinate(10, 0), new Coordinate(0, 10))));
        assertThrows(IllegalArgumentException.class,
                () -> Boundary.of(List.of(new Coordinate(0, 0), new Coordinate(5, 0), new Coordinate(10, 0))));
    }
}
