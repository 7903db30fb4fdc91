package org.tesis.tessellation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.TopologyException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.tesis.tessellation.TestGeometries.*;

public class TessellationPipelineTest {

    private static final String RANDOM_RUN =
            "tessellation {\n"
            + "  name = prueba\n"
            + "  seed = 7\n"
            + "  point { method = random_uniform, min-distance = 2 }\n"
            + "  polygon { min-area = 0, simplify-tolerance = 0 }\n"
            + "  stats = [mean, std]\n"
            + "  percentiles = [50]\n"
            + "  priority { area-divisions = [30, 30] }\n"
            + "}";

    private static GeometryInput square() {
        GeometryInput in = new GeometryInput();
        in.region = rect(0, 0, 10, 10);
        return in;
    }

    private static List<RasterSource> layers() {
        double[] chm = new double[100];
        double[] dem = new double[100];
        for (int i = 0; i < 100; i++) {
            chm[i] = 1 + (i * 7) % 11;
            dem[i] = 100 + i;
        }
        return List.of(grid("chm", chm, -9999), grid("dem", dem, -9999));
    }

    private static double totalArea(TessellationResult res) {
        double a = 0;
        for (Cell c : res.cells()) a += c.geometry.getArea();
        return a;
    }

    @Test
    public void testRunIsDeterministic() {
        TessellationConfig cfg = TessellationConfig.parse(RANDOM_RUN);
        TessellationResult a = new TessellationPipeline(cfg).run(square(), layers());
        TessellationResult b = new TessellationPipeline(cfg).run(square(), layers());

        assertEquals(a.points().size(), b.points().size());
        assertEquals(a.cells().size(), b.cells().size());
        for (int i = 0; i < a.cells().size(); i++) {
            assertEquals(a.chops().finalChopNumber(i), b.chops().finalChopNumber(i));
            assertEquals(a.stats().get(i, "chm_mean"), b.stats().get(i, "chm_mean"), 0);
        }
    }

    @Test
    public void testSparseSamplingIsReproducible() {
        TessellationConfig cfg = TessellationConfig.parse(RANDOM_RUN + "\ntessellation.point.min-distance = 10");
        TessellationResult a = new TessellationPipeline(cfg).run(square(), layers());
        TessellationResult b = new TessellationPipeline(cfg).run(square(), layers());

        assertFalse(a.points().isEmpty());
        assertEquals(a.points(), b.points());
        for (int i = 0; i < a.points().size(); i++) {
            for (int j = i + 1; j < a.points().size(); j++) {
                assertTrue(a.points().get(i).distance(a.points().get(j)) >= 10);
            }
        }
        assertEquals(a.cells().size(), b.cells().size());
        for (int i = 0; i < a.cells().size(); i++) {
            assertEquals(a.chops().initialChopNumber(i), b.chops().initialChopNumber(i));
            assertEquals(a.chops().finalChopNumber(i), b.chops().finalChopNumber(i));
        }
        assertEquals(100, totalArea(a), 1e-6);
    }

    @Test
    public void testCellsCoverRegionWithoutConflicts() {
        TessellationResult res = new TessellationPipeline(TessellationConfig.parse(RANDOM_RUN)).run(square(), layers());

        assertTrue(res.cells().size() > 1);
        assertEquals(100, totalArea(res), 1e-6);
        double fractions = 0;
        for (Cell c : res.cells()) fractions += c.areaFraction;
        assertEquals(100, fractions, 1e-6);

        assertTrue(res.chops().conflicts().isEmpty());
        assertTrue(res.stats().hasColumn("dem_50_percentile"));
        assertTrue(res.stats().hasColumn("chm_mean_div_std"));
        assertEquals(0, res.report.regionsSkipped);
        assertEquals(res.cells().size(), res.report.cells);
    }

    @Test
    public void testSplitGroups() {
        TessellationConfig cfg = TessellationConfig.parse(
                "tessellation {\n"
                + "  point { method = direct, min-distance = 0 }\n"
                + "  polygon { min-area = 0, simplify-tolerance = 0, split-add-fields = [kvart] }\n"
                + "  priority { split-key = [kvart], area-divisions = [50], optimize-field = split_area_percentile }\n"
                + "}");
        GeometryInput in = square();
        in.splits.add(new SplitPolygon("a", rect(0, 0, 5, 10), Map.of("kvart", "a")));
        in.splits.add(new SplitPolygon("b", rect(5, 0, 10, 10), Map.of("kvart", "b")));

        TessellationResult res = new TessellationPipeline(cfg).run(in, Collections.emptyList());
        assertEquals(2, res.chops().groupCount());

        // el área % se mide contra el polígono de split: cada grupo suma 100
        Map<String, Double> byGroup = new TreeMap<>();
        for (Cell c : res.cells()) byGroup.merge(c.splitFields.get("kvart"), c.areaFraction, Double::sum);
        assertEquals(Set.of("a", "b"), byGroup.keySet());
        assertEquals(100, byGroup.get("a"), 1e-6);
        assertEquals(100, byGroup.get("b"), 1e-6);
        assertTrue(res.chops().conflicts().isEmpty());
    }

    @Test
    public void testGeometryFaultSkipsOnlyThatRegion() {
        TessellationConfig cfg = TessellationConfig.parse(
                "tessellation {\n"
                + "  point { method = direct, min-distance = 0 }\n"
                + "  polygon { min-area = 0, simplify-tolerance = 0, split-add-fields = [kvart] }\n"
                + "  priority { split-key = [kvart], area-divisions = [50], optimize-field = split_area_percentile }\n"
                + "}");
        GeometryInput in = square();
        in.splits.add(new SplitPolygon("a", rect(0, 0, 5, 10), Map.of("kvart", "a")));
        in.splits.add(new SplitPolygon("b", rect(5, 0, 10, 10), Map.of("kvart", "b")));

        // el motor falla sólo en la mitad izquierda
        TessellationPipeline pipeline = new TessellationPipeline(cfg) {
            @Override
            List<Polygon> tessellate(List<Coordinate> points, Polygon region, Geometry removeAfter) {
                if (region.getEnvelopeInternal().getMinX() < 5) {
                    throw new TopologyException("side location conflict", new Coordinate(0, 0));
                }
                return super.tessellate(points, region, removeAfter);
            }
        };
        TessellationResult res = pipeline.run(in, Collections.emptyList());

        assertEquals(1, res.report.regionsSkipped);
        assertEquals(1, res.report.regionsProcessed);
        assertFalse(res.cells().isEmpty());
        double area = 0;
        for (Cell c : res.cells()) {
            assertEquals(1, c.splitIndex);
            assertEquals("b", c.splitFields.get("kvart"));
            area += c.areaFraction;
            assertTrue(res.chops().finalChopNumber(c.index) >= 0);
        }
        assertEquals(100, area, 1e-6);
        assertEquals(1, res.chops().groupCount());
        assertNotNull(res.chops().graph(List.of("b")));
        assertTrue(res.chops().conflicts().isEmpty());
    }

    @Test
    public void testSplitIncludeAndRemoveBefore() {
        TessellationConfig cfg = TessellationConfig.parse(
                "tessellation {\n"
                + "  point { method = direct, min-distance = 0 }\n"
                + "  polygon { min-area = 0, simplify-tolerance = 0, split-add-fields = [kvart], split-include { kvart = a } }\n"
                + "  priority { optimize-field = split_area_percentile }\n"
                + "}");
        GeometryInput in = square();
        in.splits.add(new SplitPolygon("a", rect(0, 0, 5, 10), Map.of("kvart", "a")));
        in.splits.add(new SplitPolygon("b", rect(5, 0, 10, 10), Map.of("kvart", "b")));
        in.removeBefore = rect(0, 0, 5, 5);

        TessellationResult res = new TessellationPipeline(cfg).run(in, Collections.emptyList());
        assertEquals(25, totalArea(res), 1e-6);
        for (Cell c : res.cells()) {
            assertEquals(0, c.splitIndex);
            assertTrue(c.geometry.getEnvelopeInternal().getMinY() >= 5 - 1e-9);
        }
    }

    @Test
    public void testRemoveAfter() {
        TessellationConfig cfg = TessellationConfig.parse(RANDOM_RUN);
        GeometryInput in = square();
        in.removeAfter = rect(0, 0, 10, 2);
        TessellationResult res = new TessellationPipeline(cfg).run(in, layers());
        assertEquals(80, totalArea(res), 1e-6);
    }

    @Test
    public void testMissingPointRaster() {
        TessellationConfig cfg = TessellationConfig.defaults();
        assertThrows(IllegalArgumentException.class,
                () -> new TessellationPipeline(cfg).run(square(), Collections.emptyList()));
    }

    @Test
    public void testUnknownOptimizeField() {
        TessellationConfig cfg = TessellationConfig.parse(
                "tessellation { point.method = random_uniform, priority.optimize-field = lidar_mean }");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new TessellationPipeline(cfg).run(square(), layers()));
        assertTrue(e.getMessage().contains("lidar_mean"));
    }

    @Test
    public void testWriteCellTable(@TempDir Path dir) throws Exception {
        TessellationResult res = new TessellationPipeline(TessellationConfig.parse(RANDOM_RUN)).run(square(), layers());
        CellTableWriter.write(dir.toString(), "prueba", res, Collections.emptyList());

        List<String> cells = Files.readAllLines(dir.resolve("prueba_cells.csv"), StandardCharsets.UTF_8);
        assertEquals(res.cells().size() + 1, cells.size());
        assertTrue(cells.get(0).startsWith("cell,split_index,split_area_percentile,chm_mean,chm_std,chm_50_percentile"));
        assertTrue(cells.get(0).endsWith("initial_chop,final_chop,wkt"));
        assertTrue(cells.get(1).contains("\"POLYGON"));

        List<String> points = Files.readAllLines(dir.resolve("prueba_points.csv"), StandardCharsets.UTF_8);
        assertEquals(res.points().size() + 1, points.size());
    }
}
