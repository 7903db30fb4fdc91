package org.tesis.tessellation;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.tesis.tessellation.TestGeometries.*;

public class AdjacencyGraphTest {

    @Test
    public void testSharedEdgesAreAdjacent() {
        List<Cell> cells = List.of(cell(0, rect(0, 0, 1, 1), 1), cell(1, rect(1, 0, 2, 1), 1),
                cell(2, rect(2, 0, 3, 1), 1));
        AdjacencyGraph g = AdjacencyGraph.build(cells, true);
        assertTrue(g.adjacent(0, 1));
        assertTrue(g.adjacent(1, 0));
        assertTrue(g.adjacent(1, 2));
        assertFalse(g.adjacent(0, 2));
        assertEquals(2, g.edgeCount());
        assertEquals(Set.of(0, 2), g.neighbors(1));
        assertEquals(Set.of(0, 1, 2), g.nodes());
    }

    @Test
    public void testCornerContact() {
        List<Cell> cells = List.of(cell(0, rect(0, 0, 1, 1), 1), cell(1, rect(1, 1, 2, 2), 1));
        assertTrue(AdjacencyGraph.build(cells, true).adjacent(0, 1));
        assertFalse(AdjacencyGraph.build(cells, false).adjacent(0, 1));
    }

    @Test
    public void testClustersIgnoreIsolatedCells() {
        AdjacencyGraph g = new AdjacencyGraph();
        g.addEdge(0, 1);
        g.addEdge(1, 2);
        g.addEdge(3, 4);
        g.addNode(5);
        List<TreeSet<Integer>> clusters = g.clusters(new TreeSet<>(List.of(0, 1, 2, 4, 5)));
        assertEquals(1, clusters.size());
        assertEquals(new TreeSet<>(List.of(0, 1, 2)), clusters.get(0));
    }

    @Test
    public void testConflicts() {
        AdjacencyGraph g = new AdjacencyGraph();
        g.addEdge(0, 1);
        g.addEdge(1, 2);
        Map<Integer, Integer> chopOf = new HashMap<>();
        chopOf.put(0, 0);
        chopOf.put(1, 0);
        chopOf.put(2, 1);
        List<int[]> conflicts = g.conflicts(chopOf, 1);
        assertEquals(1, conflicts.size());
        assertArrayEquals(new int[]{0, 1}, conflicts.get(0));

        // en el desborde la adyacencia no cuenta
        chopOf.put(0, 1);
        chopOf.put(1, 1);
        assertTrue(g.conflicts(chopOf, 1).isEmpty());
    }

    @Test
    public void testIsIndependent() {
        AdjacencyGraph g = new AdjacencyGraph();
        g.addEdge(0, 1);
        g.addNode(2);
        assertTrue(g.isIndependent(Set.of(0, 2)));
        assertFalse(g.isIndependent(Set.of(0, 1, 2)));
    }
}
