package org.tesis.parque;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

import java.util.List;

/**
 * Shared fixtures: a 20 ha rectangle fronting a highway 20 m south of it, and
 * a 20 ha L of two 200 m wide arms on the same highway.
 */
final class Sites {

    private Sites() {
    }

    static Boundary twentyHectares() {
        return Boundary.rectangle(500, 400);
    }

    static Boundary lShape() {
        return Boundary.of(List.of(
                new Coordinate(0, 0), new Coordinate(600, 0), new Coordinate(600, 200),
                new Coordinate(200, 200), new Coordinate(200, 600), new Coordinate(0, 600)));
    }

    static LineString highway() {
        return GeomUtils.line(-100, -20, 600, -20);
    }

    static ParameterSet industrialPark() {
        return ParameterSet.builder()
                .lotSize(1000, 1200, 2000)
                .minLotCount(50)
                .perimeterBuffer(10)
                .build();
    }

    static LayoutDecoder decoder() {
        return new LayoutDecoder(twentyHectares(), highway(), industrialPark());
    }
}
