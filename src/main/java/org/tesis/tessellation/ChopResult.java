package org.tesis.tessellation;

import java.util.*;

/**
 * Asignación de chops por índice de celda. Internamente los chops van de
 * 0 a K-1 y K es el chop de desborde; hacia afuera se numeran desde 1 y
 * el 0 indica "sin asignar".
 */
public final class ChopResult {
    final int overflow;
    final int[] initialChop;
    final int[] finalChop;
    final Map<List<String>, AdjacencyGraph> graphs = new LinkedHashMap<>();

    ChopResult(int cellCount, int overflow) {
        this.overflow = overflow;
        this.initialChop = new int[cellCount];
        this.finalChop = new int[cellCount];
        Arrays.fill(initialChop, overflow);
        Arrays.fill(finalChop, overflow);
    }

    public int overflow() { return overflow; }

    public int initialChopNumber(int cell) { return toNumber(initialChop[cell]); }

    public int finalChopNumber(int cell) { return toNumber(finalChop[cell]); }

    private int toNumber(int chop) { return chop < overflow ? chop + 1 : 0; }

    public int groupCount() { return graphs.size(); }

    public AdjacencyGraph graph(List<String> splitKey) { return graphs.get(splitKey); }

    // pares adyacentes en el mismo chop, en todos los grupos
    public List<int[]> conflicts() {
        Map<Integer, Integer> chopOf = new HashMap<>();
        for (int i = 0; i < finalChop.length; i++) chopOf.put(i, finalChop[i]);
        List<int[]> out = new ArrayList<>();
        for (AdjacencyGraph g : graphs.values()) out.addAll(g.conflicts(chopOf, overflow));
        return out;
    }
}
