package org.tesis.tessellation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.tesis.tessellation.TestGeometries.*;

public class CellBuilderTest {

    private static List<Coordinate> gridPoints() {
        List<Coordinate> pts = new ArrayList<>();
        for (int i = 1; i < 10; i += 2) {
            for (int j = 1; j < 10; j += 2) pts.add(new Coordinate(i, j));
        }
        return pts;
    }

    private static double totalArea(List<Polygon> cells) {
        return cells.stream().mapToDouble(Polygon::getArea).sum();
    }

    @Test
    @DisplayName("Las celdas Voronoi cubren la región sin solaparse")
    public void testVoronoiCoversRegion() {
        Polygon region = rect(0, 0, 10, 10);
        List<Polygon> cells = CellBuilder.build(gridPoints(), region, TessellationMethod.VORONOI, 0.01, null);
        assertEquals(25, cells.size());
        assertEquals(100, totalArea(cells), 1e-6);

        Geometry union = GeomUtils.union(cells, GF);
        assertEquals(0, union.symDifference(region).getArea(), 1e-6);
        for (int i = 0; i < cells.size(); i++) {
            for (int j = i + 1; j < cells.size(); j++) {
                assertEquals(0, cells.get(i).intersection(cells.get(j)).getArea(), 1e-9);
            }
        }
    }

    @Test
    public void testDelaunayTriangles() {
        Polygon region = rect(0, 0, 10, 10);
        List<Coordinate> pts = Arrays.asList(new Coordinate(0, 0), new Coordinate(10, 0),
                new Coordinate(10, 10), new Coordinate(0, 10), new Coordinate(5, 5));
        List<Polygon> cells = CellBuilder.build(pts, region, TessellationMethod.DELAUNAY, 0.01, null);
        assertEquals(4, cells.size());
        assertEquals(100, totalArea(cells), 1e-6);
        for (Polygon p : cells) assertEquals(4, p.getNumPoints()); // triángulo cerrado
    }

    @Test
    public void testMinAreaDropsFragments() {
        List<Polygon> cells = CellBuilder.build(gridPoints(), rect(0, 0, 10, 10), TessellationMethod.VORONOI, 5, null);
        assertTrue(cells.isEmpty());
    }

    @Test
    public void testRemoveAfterTessellation() {
        Polygon region = rect(0, 0, 10, 10);
        List<Polygon> cells = CellBuilder.build(gridPoints(), region, TessellationMethod.VORONOI, 0.01, rect(0, 0, 5, 5));
        assertEquals(75, totalArea(cells), 1e-6);
        for (Polygon p : cells) assertEquals(0, p.intersection(rect(0, 0, 5, 5)).getArea(), 1e-9);
    }

    @Test
    public void testClippingSplitsMultiPartFaces() {
        // región en U: la celda del punto central queda partida en dos
        Polygon u = (Polygon) rect(0, 0, 9, 3).union(rect(0, 0, 3, 9)).union(rect(6, 0, 9, 9));
        List<Coordinate> pts = Arrays.asList(new Coordinate(4.5, 8), new Coordinate(4.5, 1.5));
        List<Polygon> cells = CellBuilder.build(pts, u, TessellationMethod.VORONOI, 0.01, null);
        assertEquals(u.getArea(), totalArea(cells), 1e-6);
        assertTrue(cells.size() >= 3);
    }

    @Test
    public void testSinglePointGivesWholeRegion() {
        Polygon region = rect(0, 0, 4, 4);
        List<Polygon> cells = CellBuilder.build(List.of(new Coordinate(2, 2)), region, TessellationMethod.VORONOI, 0.01, null);
        assertEquals(1, cells.size());
        assertEquals(16, cells.get(0).getArea(), 1e-9);
    }
}
