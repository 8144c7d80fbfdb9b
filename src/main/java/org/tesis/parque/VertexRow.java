package org.tesis.parque;

import java.util.Locale;

/** One line of the site vertex table. */
final class VertexRow {

    static final String BOUNDARY = "BOUNDARY";
    static final String REFERENCE = "REFERENCE";

    String entityType;   // BOUNDARY | REFERENCE
    String entityId;
    int ring;
    int pointIdx;
    double x, y;

    static VertexRow fromCsv(String[] h, String[] v, int line) {
        VertexRow r = new VertexRow();
        r.entityType = get(v, idx(h, "entity_type")).toUpperCase(Locale.ROOT);
        r.entityId = get(v, idx(h, "entity_id"));
        int ringIdx = idxOpt(h, "ring");
        r.ring = ringIdx < 0 || get(v, ringIdx).isEmpty() ? 0 : parseInt(get(v, ringIdx), "ring", line);
        r.pointIdx = parseInt(get(v, idx(h, "point_idx")), "point_idx", line);
        r.x = parseDouble(get(v, idx(h, "x")), "x", line);
        r.y = parseDouble(get(v, idx(h, "y")), "y", line);
        return r;
    }

    static String[] splitCsv(String s) {
        String[] raw = s.split(",", -1);
        for (int i = 0; i < raw.length; i++) raw[i] = raw[i].trim();
        return raw;
    }

    static int idx(String[] h, String name) {
        int i = idxOpt(h, name);
        if (i < 0) throw new IllegalArgumentException("missing CSV column: " + name);
        return i;
    }

    static int idxOpt(String[] h, String name) {
        for (int i = 0; i < h.length; i++) if (h[i].equalsIgnoreCase(name)) return i;
        return -1;
    }

    static String get(String[] v, int idx) {
        if (idx < 0 || idx >= v.length) return "";
        return v[idx];
    }

    private static int parseInt(String s, String column, int line) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("line " + line + ": bad " + column + " '" + s + "'", e);
        }
    }

    private static double parseDouble(String s, String column, int line) {
        try {
            double d = Double.parseDouble(s);
            if (!Double.isFinite(d)) throw new NumberFormatException("not finite");
            return d;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("line " + line + ": bad " + column + " '" + s + "'", e);
        }
    }
}
