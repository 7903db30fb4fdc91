package org.tesis.tessellation;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.quadtree.Quadtree;

import java.util.*;

/**
 * Grafo no dirigido sobre índices de celda: hay arista si las geometrías
 * se intersecan. Con {@code cornersAdjacent = false} además se exige que
 * los bordes compartan un segmento (tocarse en un vértice no cuenta).
 */
public final class AdjacencyGraph {

    private static final Set<Integer> NONE = Collections.emptySet();

    private final Map<Integer, TreeSet<Integer>> neighbors = new TreeMap<>();

    AdjacencyGraph() {}

    // construye el grafo para un subconjunto de celdas
    static AdjacencyGraph build(List<Cell> cells, boolean cornersAdjacent) {
        AdjacencyGraph g = new AdjacencyGraph();
        Quadtree qt = new Quadtree();
        for (Cell c : cells) {
            g.addNode(c.index);
            qt.insert(c.bounds, c);
        }
        for (Cell c : cells) {
            PreparedGeometry prep = PreparedGeometryFactory.prepare(c.geometry);
            @SuppressWarnings("unchecked")
            List<Cell> hits = qt.query(c.bounds);
            for (Cell o : hits) {
                if (o.index <= c.index) continue; // cada par una vez
                if (!c.bounds.intersects(o.bounds)) continue;
                if (!prep.intersects(o.geometry)) continue;
                if (!cornersAdjacent && !sharesEdge(c.geometry, o.geometry)) continue;
                g.addEdge(c.index, o.index);
            }
        }
        return g;
    }

    // intersección de bordes de dimensión 1
    static boolean sharesEdge(Geometry a, Geometry b) {
        return a.relate(b, "****1****") || a.relate(b, "2********");
    }

    void addNode(int i) {
        neighbors.computeIfAbsent(i, k -> new TreeSet<>());
    }

    void addEdge(int a, int b) {
        if (a == b) return;
        neighbors.computeIfAbsent(a, k -> new TreeSet<>()).add(b);
        neighbors.computeIfAbsent(b, k -> new TreeSet<>()).add(a);
    }

    public Set<Integer> neighbors(int i) {
        TreeSet<Integer> n = neighbors.get(i);
        return n == null ? NONE : Collections.unmodifiableSet(n);
    }

    public boolean adjacent(int a, int b) {
        TreeSet<Integer> n = neighbors.get(a);
        return n != null && n.contains(b);
    }

    public Set<Integer> nodes() {
        return Collections.unmodifiableSet(neighbors.keySet());
    }

    public int edgeCount() {
        int n = 0;
        for (TreeSet<Integer> s : neighbors.values()) n += s.size();
        return n / 2;
    }

    // true si ningún par del conjunto es adyacente
    boolean isIndependent(Collection<Integer> set) {
        for (int i : set) {
            for (int j : neighbors(i)) if (set.contains(j)) return false;
        }
        return true;
    }

    /**
     * Componentes conexas de tamaño >= 2 del subgrafo inducido por el conjunto;
     * las celdas sin vecino dentro del conjunto no forman cluster.
     */
    List<TreeSet<Integer>> clusters(SortedSet<Integer> set) {
        List<TreeSet<Integer>> out = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int start : set) {
            if (seen.contains(start)) continue;
            TreeSet<Integer> comp = new TreeSet<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(start);
            seen.add(start);
            while (!stack.isEmpty()) {
                int i = stack.pop();
                comp.add(i);
                for (int j : neighbors(i)) {
                    if (set.contains(j) && seen.add(j)) stack.push(j);
                }
            }
            if (comp.size() > 1) out.add(comp);
        }
        return out;
    }

    /**
     * Pares adyacentes asignados al mismo chop (< overflow). Vacío si se
     * cumple la no adyacencia.
     */
    public List<int[]> conflicts(Map<Integer, Integer> chopOf, int overflow) {
        List<int[]> out = new ArrayList<>();
        for (Map.Entry<Integer, TreeSet<Integer>> e : neighbors.entrySet()) {
            int i = e.getKey();
            Integer ci = chopOf.get(i);
            if (ci == null || ci >= overflow) continue;
            for (int j : e.getValue()) {
                if (j > i && ci.equals(chopOf.get(j))) out.add(new int[]{i, j});
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "AdjacencyGraph(nodes=" + neighbors.size() + ", edges=" + edgeCount() + ")";
    }
}
