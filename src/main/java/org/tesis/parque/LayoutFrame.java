package org.tesis.parque;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;

/**
 * Working coordinate frame of one decode: the buildable area rotated about
 * its envelope centre so that the main axis runs along X. Generators work in
 * frame coordinates; results are mapped back with {@link #toWorld(Geometry)}.
 */
final class LayoutFrame {

    private static final double SNAP = 1e-9;

    private final double angle;
    private final AffineTransformation toFrame;
    private final AffineTransformation toWorld;

    private LayoutFrame(double angle, AffineTransformation toFrame, AffineTransformation toWorld) {
        this.angle = angle;
        this.toFrame = toFrame;
        this.toWorld = toWorld;
    }

    /**
     * Frame aligned with the dominant edge direction of {@code region}, with
     * X along the longer extent; {@code crossAxis} turns it a further quarter turn.
     */
    static LayoutFrame of(Polygon region, boolean crossAxis) {
        Envelope e = region.getEnvelopeInternal();
        double px = (e.getMinX() + e.getMaxX()) / 2.0, py = (e.getMinY() + e.getMaxY()) / 2.0;
        double a = GeomUtils.dominantAngle(region);
        Envelope r = AffineTransformation.rotationInstance(-a, px, py).transform(region).getEnvelopeInternal();
        if (r.getHeight() > r.getWidth() + GeomUtils.EDGE_EPS) a += Math.PI / 2;
        a = GeomUtils.normalizeHalfTurn(a);
        if (crossAxis) a = GeomUtils.normalizeHalfTurn(a + Math.PI / 2);
        // exact transforms for axis-aligned cases keep rectangular sites free of rounding noise
        if (Math.abs(a) < SNAP) {
            return new LayoutFrame(0, new AffineTransformation(), new AffineTransformation());
        }
        if (Math.abs(Math.abs(a) - Math.PI / 2) < SNAP) {
            return new LayoutFrame(Math.PI / 2,
                    new AffineTransformation(0, 1, px - py, -1, 0, px + py),
                    new AffineTransformation(0, -1, px + py, 1, 0, py - px));
        }
        return new LayoutFrame(a,
                AffineTransformation.rotationInstance(-a, px, py),
                AffineTransformation.rotationInstance(a, px, py));
    }

    double angle() {
        return angle;
    }

    AffineTransformation toFrameTransform() {
        return toFrame;
    }

    AffineTransformation toWorldTransform() {
        return toWorld;
    }

    Geometry toFrame(Geometry g) {
        return g == null ? null : toFrame.transform(g);
    }

    Geometry toWorld(Geometry g) {
        return g == null ? null : toWorld.transform(g);
    }

    Coordinate toWorld(Coordinate c) {
        Coordinate out = new Coordinate();
        toWorld.transform(c, out);
        return out;
    }

    /** Elevation lookup taking frame coordinates. */
    ElevationModel frameElevation(ElevationModel world) {
        if (world == ElevationModel.FLAT) return world;
        return (x, y) -> {
            Coordinate w = toWorld(new Coordinate(x, y));
            return world.elevationAt(w.x, w.y);
        };
    }
}
