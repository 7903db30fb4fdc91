package org.tesis.tessellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Reparte las celdas de cada grupo de split en chops ordenados con cuota de
 * área, de modo que dos celdas del mismo chop no sean adyacentes, y
 * privilegia el valor capturado por los primeros chops.
 *
 * <p>Etapa A: llenado codicioso por puntaje {@code valor × área} descendente.
 * Etapa B: grafo de adyacencia del grupo. Etapa C: para cada chop en orden,
 * se enumeran subconjuntos no adyacentes de cada cluster (el resto se degrada
 * al desborde) y se rellena la cuota liberada promoviendo celdas de chops
 * posteriores; gana la combinación de mayor puntaje.
 *
 * <p>La etapa C hace una sola pasada por los chops, no itera hasta un punto
 * fijo: el tiempo de ejecución queda acotado a costa de optimalidad.
 */
public class ChopPartitioner {

    private static final Logger log = LoggerFactory.getLogger(ChopPartitioner.class);

    static final int DEFAULT_MAX_CLUSTER_SIZE = 12;
    static final int DEFAULT_MAX_CANDIDATES   = 20_000;

    final double[] divisions;
    final boolean  cornersAdjacent;
    final int      maxClusterSize;
    final int      maxCandidates;

    ChopPartitioner(double[] divisions) {
        this(divisions, true, DEFAULT_MAX_CLUSTER_SIZE, DEFAULT_MAX_CANDIDATES);
    }

    ChopPartitioner(double[] divisions, boolean cornersAdjacent, int maxClusterSize, int maxCandidates) {
        this.divisions = divisions.clone();
        this.cornersAdjacent = cornersAdjacent;
        this.maxClusterSize = maxClusterSize;
        this.maxCandidates = maxCandidates;
    }

    static ChopPartitioner of(TessellationConfig cfg) {
        return new ChopPartitioner(cfg.areaDivisions, cfg.neighborCorners, cfg.maxClusterSize, cfg.maxCandidates);
    }

    int overflow() { return divisions.length; }

    // ======= API =======

    /**
     * @param cells  celdas con índice = posición en la lista global
     * @param values valor a optimizar, indexado por índice de celda
     * @param splitKeyFields campos que forman la clave de agrupamiento
     */
    ChopResult partition(List<Cell> cells, double[] values, List<String> splitKeyFields) {
        int n = 0;
        for (Cell c : cells) n = Math.max(n, c.index + 1);
        if (values.length < n) throw new IllegalArgumentException("Faltan valores: " + values.length + " < " + n);
        ChopResult res = new ChopResult(n, overflow());

        // grupos en orden de primera aparición
        Map<List<String>, List<Cell>> groups = new LinkedHashMap<>();
        for (Cell c : cells) groups.computeIfAbsent(c.splitKey(splitKeyFields), k -> new ArrayList<>()).add(c);

        int current = 0;
        for (Map.Entry<List<String>, List<Cell>> e : groups.entrySet()) {
            current++;
            if (e.getValue().isEmpty()) continue;
            log.info("Chops del split {} ({} de {}, {} celdas)", e.getKey(), current, groups.size(), e.getValue().size());
            partitionGroup(e.getKey(), e.getValue(), values, res);
        }
        return res;
    }

    void partitionGroup(List<String> key, List<Cell> group, double[] values, ChopResult res) {
        Map<Integer, Cell> byIndex = new HashMap<>();
        for (Cell c : group) byIndex.put(c.index, c);

        GroupState st = new GroupState(overflow());
        for (Cell c : group) {
            st.area.put(c.index, c.areaFraction);
            st.score.put(c.index, values[c.index] * c.areaFraction);
        }

        // ---- Etapa A: llenado codicioso ----
        List<Cell> order = new ArrayList<>(group);
        order.sort((a, b) -> Double.compare(st.priority(b.index), st.priority(a.index)));
        int chop = 0, inChop = 0;
        double chopArea = 0;
        double limit = quota(0);
        for (Cell c : order) {
            chopArea += c.areaFraction;
            if (chopArea > limit && inChop > 0) {
                chop++;
                chopArea = c.areaFraction;
                inChop = 0;
                limit = quota(chop);
            }
            inChop++;
            res.initialChop[c.index] = chop;
            st.assign(c.index, chop);
        }

        // ---- Etapa B: adyacencia ----
        AdjacencyGraph graph = AdjacencyGraph.build(group, cornersAdjacent);
        res.graphs.put(key, graph);
        log.debug("Split {}: {}", key, graph);

        // ---- Etapa C: mejora por chop ----
        for (int c = 0; c < overflow(); c++) improveChop(c, graph, st);

        for (Map.Entry<Integer, Integer> e : st.chopOf.entrySet()) res.finalChop[e.getKey()] = e.getValue();
    }

    // cuota del chop; el desborde no tiene límite
    double quota(int chop) {
        return chop < divisions.length ? divisions[chop] : Double.POSITIVE_INFINITY;
    }

    // ======= Etapa C =======

    void improveChop(int c, AdjacencyGraph graph, GroupState st) {
        TreeSet<Integer> chopSet = new TreeSet<>(st.chops.get(c));
        List<TreeSet<Integer>> clusters = graph.clusters(chopSet);
        TreeSet<Integer> free = new TreeSet<>(chopSet);
        for (TreeSet<Integer> cl : clusters) free.removeAll(cl);

        // subconjuntos que se conservan, por cluster
        List<List<List<Integer>>> options = new ArrayList<>();
        for (TreeSet<Integer> cl : clusters) {
            List<List<Integer>> opts;
            if (cl.size() > maxClusterSize) {
                log.warn("Chop {}: cluster de {} celdas supera el máximo enumerable ({})", c, cl.size(), maxClusterSize);
                opts = Collections.singletonList(greedyIndependent(cl, graph, st));
            } else {
                opts = independentSubsets(cl, graph);
            }
            if (opts.isEmpty()) {
                log.debug("Chop {}: cluster {} sin subconjuntos, se deja igual", c, cl);
                return;
            }
            options.add(opts);
        }

        // producto cartesiano demasiado grande: un único subconjunto codicioso por cluster
        if (combinations(options) > maxCandidates) {
            log.warn("Chop {}: {} clusters superan {} combinaciones, se conserva un conjunto codicioso por cluster",
                    c, clusters.size(), maxCandidates);
            options.clear();
            for (TreeSet<Integer> cl : clusters) options.add(Collections.singletonList(greedyIndependent(cl, graph, st)));
        }

        Candidate best = null;
        int[] pos = new int[options.size()];
        while (true) {
            TreeSet<Integer> kept = new TreeSet<>(free);
            for (int k = 0; k < pos.length; k++) kept.addAll(options.get(k).get(pos[k]));

            if (graph.isIndependent(kept)) {
                Candidate cand = new Candidate();
                cand.kept = kept;
                cand.demoted = new TreeSet<>(chopSet);
                cand.demoted.removeAll(kept);
                cand.promoted = bestPromotion(c, kept, graph, st);
                cand.total = st.sum(kept) + st.sum(cand.promoted);
                if (best == null || cand.total > best.total) best = cand;
            }

            if (!advance(pos, options)) break;
        }

        if (best == null) {
            log.debug("Chop {}: sin candidatos válidos, se deja igual", c);
            return;
        }

        for (int i : best.demoted) st.assign(i, st.overflow);
        for (int i : best.promoted) st.assign(i, c);

        if (!best.demoted.isEmpty() || !best.promoted.isEmpty()) {
            log.debug("Chop {}: clusters={} conservadas={} degradadas={} promovidas={} puntaje={}",
                    c, clusters.size(), best.kept.size(), best.demoted.size(), best.promoted.size(), best.total);
        }
    }

    // tamaño del producto cartesiano, saturado en Long.MAX_VALUE
    static long combinations(List<List<List<Integer>>> options) {
        long total = 1;
        for (List<List<Integer>> opts : options) {
            if (total > Long.MAX_VALUE / opts.size()) return Long.MAX_VALUE;
            total *= opts.size();
        }
        return total;
    }

    // odómetro sobre el producto cartesiano; la última dimensión gira más rápido
    static boolean advance(int[] pos, List<List<List<Integer>>> options) {
        for (int d = pos.length - 1; d >= 0; d--) {
            if (++pos[d] < options.get(d).size()) return true;
            pos[d] = 0;
        }
        return false;
    }

    /**
     * Subconjuntos sin aristas internas de tamaño 1 a n-1, por tamaño
     * creciente y en orden lexicográfico dentro de cada tamaño.
     */
    static List<List<Integer>> independentSubsets(TreeSet<Integer> cluster, AdjacencyGraph graph) {
        Integer[] items = cluster.toArray(new Integer[0]);
        List<List<Integer>> out = new ArrayList<>();
        for (int size = 1; size < items.length; size++) {
            combine(items, size, 0, new ArrayDeque<>(), graph, out);
        }
        return out;
    }

    private static void combine(Integer[] items, int size, int from, Deque<Integer> chosen,
                                AdjacencyGraph graph, List<List<Integer>> out) {
        if (chosen.size() == size) {
            out.add(new ArrayList<>(chosen));
            return;
        }
        for (int i = from; i <= items.length - (size - chosen.size()); i++) {
            int item = items[i];
            boolean ok = true;
            for (int x : chosen) if (graph.adjacent(x, item)) { ok = false; break; }
            if (!ok) continue;
            chosen.addLast(item);
            combine(items, size, i + 1, chosen, graph, out);
            chosen.removeLast();
        }
    }

    // clusters demasiado grandes: conjunto independiente maximal por puntaje descendente
    static List<Integer> greedyIndependent(TreeSet<Integer> cluster, AdjacencyGraph graph, GroupState st) {
        List<Integer> order = new ArrayList<>(cluster);
        order.sort((a, b) -> Double.compare(st.priority(b), st.priority(a)));
        List<Integer> kept = new ArrayList<>();
        for (int i : order) {
            boolean ok = true;
            for (int k : kept) if (graph.adjacent(i, k)) { ok = false; break; }
            if (ok) kept.add(i);
        }
        log.debug("Cluster de {} celdas: se conservan {} por puntaje", cluster.size(), kept.size());
        kept.sort(Comparator.naturalOrder());
        return kept;
    }

    /**
     * Relleno de la cuota del chop con celdas de chops posteriores no
     * adyacentes a las conservadas. Se prueba un llenado codicioso por índice
     * ascendente desde cada celda compatible y se queda el de mayor puntaje.
     */
    TreeSet<Integer> bestPromotion(int c, Set<Integer> kept, AdjacencyGraph graph, GroupState st) {
        Set<Integer> blocked = new HashSet<>();
        for (int i : kept) blocked.addAll(graph.neighbors(i));

        TreeSet<Integer> pool = new TreeSet<>();
        for (int later = c + 1; later <= st.overflow; later++) pool.addAll(st.chops.get(later));
        pool.removeAll(blocked);

        double keptArea = st.area(kept);
        double limit = quota(c);

        TreeSet<Integer> best = new TreeSet<>();
        double bestValue = Double.NEGATIVE_INFINITY;
        for (int start : pool) {
            TreeSet<Integer> remaining = new TreeSet<>(pool);
            TreeSet<Integer> promoted = new TreeSet<>();
            double area = keptArea;
            int idx = start;
            while (!remaining.isEmpty()) {
                area += st.area.get(idx);
                if (area > limit) break;
                remaining.remove(idx);
                promoted.add(idx);
                remaining.removeAll(graph.neighbors(idx));
                if (!remaining.isEmpty()) idx = remaining.first();
            }
            if (promoted.isEmpty()) continue;
            double v = st.sum(promoted);
            if (v > bestValue) {
                bestValue = v;
                best = promoted;
            }
        }
        return best;
    }

    // ======= estado mutable de un grupo =======

    static final class GroupState {
        final int overflow;
        final Map<Integer, Double> area = new HashMap<>();
        final Map<Integer, Double> score = new HashMap<>();
        final Map<Integer, Integer> chopOf = new TreeMap<>();
        final List<TreeSet<Integer>> chops = new ArrayList<>();

        GroupState(int overflow) {
            this.overflow = overflow;
            for (int i = 0; i <= overflow; i++) chops.add(new TreeSet<>());
        }

        void assign(int cell, int chop) {
            Integer prev = chopOf.put(cell, chop);
            if (prev != null) chops.get(prev).remove(cell);
            chops.get(chop).add(cell);
        }

        // para ordenar: NaN al final
        double priority(int cell) {
            double s = score.get(cell);
            return Double.isNaN(s) ? Double.NEGATIVE_INFINITY : s;
        }

        // para sumar: NaN cuenta 0
        double sum(Collection<Integer> cells) {
            double s = 0;
            for (int i : cells) {
                double v = score.get(i);
                if (!Double.isNaN(v)) s += v;
            }
            return s;
        }

        double area(Collection<Integer> cells) {
            double a = 0;
            for (int i : cells) a += area.get(i);
            return a;
        }
    }

    static final class Candidate {
        TreeSet<Integer> kept;
        TreeSet<Integer> demoted;
        TreeSet<Integer> promoted;
        double total;
    }
}
