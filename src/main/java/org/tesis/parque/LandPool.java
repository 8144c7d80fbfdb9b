package org.tesis.parque;

import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;

/**
 * Land still available inside one decode: lot strips and residual pieces
 * without usable frontage. Facilities are carved out of it before the strips
 * are cut into lots. Owned by a single decode, never shared.
 */
final class LandPool {

    final List<Strip> strips = new ArrayList<>();
    final List<Polygon> residual = new ArrayList<>();

    double area() {
        double a = 0;
        for (Strip s : strips) a += s.area();
        for (Polygon p : residual) a += p.getArea();
        return a;
    }
}
