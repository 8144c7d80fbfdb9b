package org.tesis.parque;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads a site from a vertex table with columns {@code entity_type,
 * entity_id, ring, point_idx, x, y}. {@code BOUNDARY} rows (outer ring only)
 * form the site polygon; {@code REFERENCE} rows, if any, the external road
 * polyline. Vertices are taken in {@code point_idx} order.
 */
public final class BoundaryCsvReader {

    private BoundaryCsvReader() {
    }

    public static SiteInput read(Path path) throws IOException {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(r, path.toString());
        }
    }

    public static SiteInput read(InputStream in, String name) throws IOException {
        return read(new InputStreamReader(in, StandardCharsets.UTF_8), name);
    }

    static SiteInput read(Reader reader, String name) throws IOException {
        List<VertexRow> rows = readRows(reader, name);
        List<VertexRow> boundary = new ArrayList<>();
        List<VertexRow> reference = new ArrayList<>();
        Set<String> boundaryIds = new TreeSet<>();
        for (VertexRow r : rows) {
            if (VertexRow.BOUNDARY.equals(r.entityType)) {
                if (r.ring != 0) throw new IllegalArgumentException(name + ": boundary holes are not supported (ring " + r.ring + ")");
                boundaryIds.add(r.entityId);
                boundary.add(r);
            } else if (VertexRow.REFERENCE.equals(r.entityType)) {
                reference.add(r);
            } else {
                throw new IllegalArgumentException(name + ": unknown entity_type " + r.entityType);
            }
        }
        if (boundaryIds.size() != 1) {
            throw new IllegalArgumentException(name + ": expected one BOUNDARY entity, found " + boundaryIds);
        }
        Boundary site = Boundary.of(coordinates(boundary));
        LineString road = null;
        if (!reference.isEmpty()) {
            List<Coordinate> pts = coordinates(reference);
            if (pts.size() < 2) throw new IllegalArgumentException(name + ": REFERENCE needs at least two vertices");
            road = GeomUtils.GF.createLineString(pts.toArray(new Coordinate[0]));
        }
        return new SiteInput(site, road);
    }

    static List<VertexRow> readRows(Reader reader, String name) throws IOException {
        List<VertexRow> out = new ArrayList<>();
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String header = br.readLine();
        if (header == null) throw new IOException("empty CSV: " + name);
        String[] h = VertexRow.splitCsv(header.replace("\uFEFF", ""));
        String line;
        int n = 1;
        while ((line = br.readLine()) != null) {
            n++;
            if (line.trim().isEmpty() || line.startsWith("#")) continue;
            out.add(VertexRow.fromCsv(h, VertexRow.splitCsv(line), n));
        }
        return out;
    }

    private static List<Coordinate> coordinates(List<VertexRow> rows) {
        List<VertexRow> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparingInt(r -> r.pointIdx));
        List<Coordinate> pts = new ArrayList<>(sorted.size());
        for (VertexRow r : sorted) pts.add(new Coordinate(r.x, r.y));
        return pts;
    }
}
