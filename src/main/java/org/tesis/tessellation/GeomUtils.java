package org.tesis.tessellation;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.util.*;
import java.util.stream.Collectors;

public class GeomUtils {

    static final String REGION        = "REGION";
    static final String SPLIT         = "SPLIT";
    static final String REMOVE_BEFORE = "REMOVE_BEFORE";
    static final String REMOVE_AFTER  = "REMOVE_AFTER";

    // arma todas las geometrías de entrada a partir de las filas del CSV
    static GeometryInput buildInput(List<VertexRow> rows, GeometryFactory gf) {
        GeometryInput in = new GeometryInput();
        List<Polygon> region = buildPolygons(rows, REGION, gf).values().stream()
                .map(e -> e.poly).collect(Collectors.toList());
        if (region.isEmpty()) throw new IllegalStateException("No se encontró " + REGION + " en el CSV");
        in.region = union(region, gf);

        for (SplitPolygon sp : buildPolygons(rows, SPLIT, gf).values()) in.splits.add(sp);

        List<Polygon> before = polys(buildPolygons(rows, REMOVE_BEFORE, gf));
        if (!before.isEmpty()) in.removeBefore = union(before, gf);
        List<Polygon> after = polys(buildPolygons(rows, REMOVE_AFTER, gf));
        if (!after.isEmpty()) in.removeAfter = union(after, gf);
        return in;
    }

    // construye los polígonos de un tipo de entidad, en orden de aparición del id
    static Map<String, SplitPolygon> buildPolygons(List<VertexRow> rows, String entityType, GeometryFactory gf) {
        Map<String, List<VertexRow>> byId = rows.stream()
                .filter(r -> entityType.equalsIgnoreCase(r.entityType))
                .collect(Collectors.groupingBy(r -> r.entityId, LinkedHashMap::new, Collectors.toList()));

        Map<String, SplitPolygon> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<VertexRow>> e : byId.entrySet()) {
            String id = e.getKey();
            Map<Integer, List<VertexRow>> byRing = e.getValue().stream()
                    .collect(Collectors.groupingBy(r -> r.ring, TreeMap::new, Collectors.toList()));
            List<VertexRow> shellRows = byRing.remove(0);
            if (shellRows == null) throw new IllegalArgumentException(entityType + " " + id + " sin ring 0");
            shellRows.sort(Comparator.comparingInt(r -> r.pointIdx));
            LinearRing shell = gf.createLinearRing(toClosedCoords(shellRows));

            // los huecos se agrupan por ring y se crean como LinearRing[]
            LinearRing[] holes = null;
            if (!byRing.isEmpty()) {
                holes = new LinearRing[byRing.size()];
                int i = 0;
                for (List<VertexRow> hp : byRing.values()) {
                    hp.sort(Comparator.comparingInt(r -> r.pointIdx));
                    holes[i++] = gf.createLinearRing(toClosedCoords(hp));
                }
            }

            // atributos: primer valor no nulo por columna
            Map<String, String> attrs = new LinkedHashMap<>();
            for (VertexRow r : e.getValue()) {
                for (Map.Entry<String, String> a : r.attributes.entrySet()) attrs.putIfAbsent(a.getKey(), a.getValue());
            }
            out.put(id, new SplitPolygon(id, gf.createPolygon(shell, holes), attrs));
        }
        return out;
    }

    static List<Polygon> polys(Map<String, SplitPolygon> m) {
        return m.values().stream().map(sp -> sp.poly).collect(Collectors.toList());
    }

    // convierte la lista de vértices en un arreglo de coordenadas cerrado (último = primero)
    static Coordinate[] toClosedCoords(List<VertexRow> pts) {
        if (pts.size() < 3) throw new IllegalArgumentException("Polígono requiere >=3 puntos");
        Coordinate[] c = new Coordinate[pts.size() + 1];
        for (int i=0;i<pts.size();i++) c[i] = new Coordinate(pts.get(i).x, pts.get(i).y);
        c[c.length-1] = new Coordinate(pts.get(0).x, pts.get(0).y);
        return c;
    }

    static Geometry union(Collection<? extends Geometry> geoms, GeometryFactory gf) {
        if (geoms.isEmpty()) return gf.createGeometryCollection();
        return UnaryUnionOp.union(geoms);
    }

    // descompone cualquier geometría en sus partes poligonales
    static List<Polygon> polygons(Geometry g) {
        List<Polygon> out = new ArrayList<>();
        collectPolygons(g, out);
        return out;
    }

    private static void collectPolygons(Geometry g, List<Polygon> out) {
        if (g == null || g.isEmpty()) return;
        if (g instanceof Polygon) {
            out.add((Polygon) g);
        } else if (g instanceof GeometryCollection) { // incluye MultiPolygon
            for (int i = 0; i < g.getNumGeometries(); i++) collectPolygons(g.getGeometryN(i), out);
        }
    }

    // vértices de la geometría (anillo exterior y luego huecos), sin repetidos
    static List<Coordinate> vertices(Geometry g) {
        LinkedHashSet<Coordinate> out = new LinkedHashSet<>();
        for (Polygon p : polygons(g)) {
            addRing(out, p.getExteriorRing());
            for (int i = 0; i < p.getNumInteriorRing(); i++) addRing(out, p.getInteriorRingN(i));
        }
        return new ArrayList<>(out);
    }

    private static void addRing(Set<Coordinate> out, LineString ring) {
        for (Coordinate c : ring.getCoordinates()) out.add(new Coordinate(c.x, c.y));
    }
}
