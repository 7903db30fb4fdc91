package org.tesis.tessellation;

import java.util.*;

public class VertexRow {
    static final Set<String> CORE_COLUMNS = Set.of("entity_type", "entity_id", "ring", "point_idx", "x", "y");

    String entityType;   // REGION | SPLIT | REMOVE_BEFORE | REMOVE_AFTER
    String entityId;
    int ring;            // 0 = borde exterior, >0 = huecos
    int pointIdx;
    double x, y;

    Map<String, String> attributes = new LinkedHashMap<>(); // columnas extra (SPLIT)

    static VertexRow fromCsv(String[] h, String[] v) {
        VertexRow r = new VertexRow();
        r.entityType = get(v, idx(h, "entity_type")).toUpperCase(Locale.ROOT);
        r.entityId   = get(v, idx(h, "entity_id"));
        r.ring       = parseInt(get(v, idx(h, "ring")), 0);
        r.pointIdx   = parseInt(get(v, idx(h, "point_idx")), 0);
        r.x          = parseDouble(get(v, idx(h, "x")), 0);
        r.y          = parseDouble(get(v, idx(h, "y")), 0);

        for (int i = 0; i < h.length; i++) {
            String col = h[i].toLowerCase(Locale.ROOT);
            if (CORE_COLUMNS.contains(col)) continue;
            String val = get(v, i);
            if (!val.isEmpty()) r.attributes.put(col, val);
        }
        return r;
    }

    // ------------- helpers CSV -------------
    static String[] splitCsv(String s) {
        String[] raw = s.split(",", -1);
        for (int i=0;i<raw.length;i++) raw[i] = raw[i].trim();
        return raw;
    }
    static int idx(String[] h, String name) {
        for (int i=0;i<h.length;i++) if (h[i].equalsIgnoreCase(name)) return i;
        throw new IllegalArgumentException("Cabecera CSV faltante: " + name);
    }
    static String get(String[] v, int idx) {
        if (idx < 0 || idx >= v.length) return "";
        return v[idx];
    }

    static Integer parseNullableInt(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Integer.parseInt(s); } catch (NumberFormatException e) { return null; }
    }
    static Double parseNullableDouble(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Double.parseDouble(s); } catch (NumberFormatException e) { return null; }
    }
    static int parseInt(String s, int d) {
        Integer v = parseNullableInt(s); return v == null ? d : v;
    }
    static double parseDouble(String s, double d) {
        Double v = parseNullableDouble(s); return v == null ? d : v;
    }
}
