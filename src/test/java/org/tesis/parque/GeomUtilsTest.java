package org.tesis.parque;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeomUtilsTest {

    private static final double EPS = 1e-6;

    @Test
    @DisplayName("Cutting a rectangle keeps both sides and their total area")
    void cutRectangle() {
        Polygon r = GeomUtils.rectangle(0, 0, 100, 50);
        Geometry[] parts = GeomUtils.cut(r, true, 30);
        assertEquals(30 * 50, parts[0].getArea(), EPS);
        assertEquals(70 * 50, parts[1].getArea(), EPS);
        assertTrue(GeomUtils.isAxisRectangle(parts[0]));
    }

    @Test
    @DisplayName("Cut position for an area works on non-rectangular polygons")
    void cutCoordinateOnTriangle() {
        Polygon tri = GeomUtils.polygon(List.of(new Coordinate(0, 0), new Coordinate(100, 0), new Coordinate(0, 100)));
        double c = GeomUtils.cutCoordinateForArea(tri, true, true, 2000);
        Geometry[] parts = GeomUtils.cut(tri, true, c);
        assertEquals(2000, parts[0].getArea(), 0.5);
        assertEquals(tri.getArea(), parts[0].getArea() + parts[1].getArea(), 1e-6);
    }

    @Test
    @DisplayName("Aspect ratio and rectangularity of simple shapes")
    void shapeMeasures() {
        Polygon r = GeomUtils.rectangle(0, 0, 40, 10);
        assertEquals(4.0, GeomUtils.aspectRatio(r), 1e-6);
        assertEquals(1.0, GeomUtils.rectangularity(r), 1e-6);
        Polygon tri = GeomUtils.polygon(List.of(new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(0, 10)));
        assertEquals(0.5, GeomUtils.rectangularity(tri), 1e-6);
    }

    @Test
    @DisplayName("Inset of a rectangle stays a rectangle; an inset too large leaves nothing")
    void inset() {
        Polygon r = GeomUtils.rectangle(0, 0, 100, 60);
        Polygon in = GeomUtils.inset(r, 10);
        assertEquals(80 * 40, in.getArea(), 1e-6);
        assertTrue(GeomUtils.isAxisRectangle(in));
        assertTrue(GeomUtils.inset(r, 31).isEmpty());
    }

    @Test
    @DisplayName("Clipping helpers")
    void clamps() {
        assertEquals(0.0, GeomUtils.clip01(Double.NaN));
        assertEquals(1.0, GeomUtils.clip01(3));
        assertEquals(0.25, GeomUtils.clamp(0.25, 0, 1));
    }

    @Test
    @DisplayName("The dominant edge direction of an L is its axis, not the diagonal of its minimum box")
    void dominantAngle() {
        Polygon l = Sites.lShape().polygon();
        assertEquals(0.0, GeomUtils.dominantAngle(l), EPS);
        LayoutFrame frame = LayoutFrame.of(l, false);
        assertEquals(0.0, frame.angle(), EPS);

        Polygon tilted = (Polygon) AffineTransformation.rotationInstance(Math.toRadians(30))
                .transform(GeomUtils.rectangle(0, 0, 100, 40));
        assertEquals(Math.toRadians(30), GeomUtils.dominantAngle(tilted), EPS);
        assertEquals(Math.toRadians(30), LayoutFrame.of(tilted, false).angle(), EPS);
        // a tall rectangle turns a quarter so that X follows its long side
        assertEquals(Math.PI / 2, LayoutFrame.of(GeomUtils.rectangle(0, 0, 40, 100), false).angle(), EPS);
    }
}
