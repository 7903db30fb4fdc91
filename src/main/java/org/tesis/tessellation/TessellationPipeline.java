package org.tesis.tessellation;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Región → puntos → celdas → estadísticas zonales → chops.
 * Toda la configuración se valida en el constructor / al inicio de
 * {@link #run}, antes de procesar geometrías.
 */
public class TessellationPipeline {

    private static final Logger log = LoggerFactory.getLogger(TessellationPipeline.class);

    static final String AREA_FIELD = "split_area_percentile";

    final TessellationConfig cfg;
    final ZonalStatsEngine stats;
    final ChopPartitioner partitioner;

    public TessellationPipeline(TessellationConfig cfg) {
        this.cfg = cfg;
        this.stats = ZonalStatsEngine.of(cfg);
        this.partitioner = ChopPartitioner.of(cfg);
    }

    // unidad de procesamiento: una parte poligonal de región ∩ split
    static class SplitRegion {
        final int splitIndex;
        final Polygon poly;
        final Map<String, String> fields;
        final double parentArea;

        SplitRegion(int splitIndex, Polygon poly, Map<String, String> fields, double parentArea) {
            this.splitIndex = splitIndex;
            this.poly = poly;
            this.fields = fields;
            this.parentArea = parentArea;
        }
    }

    public TessellationResult run(GeometryInput input, List<RasterSource> rasters) {
        long t0 = System.currentTimeMillis();

        // ---- validación de configuración ----
        RasterSource pointRaster = null;
        if (cfg.pointMethod == SamplingMethod.RASTER_WEIGHTED) {
            pointRaster = rasters.stream().filter(r -> r.name().equals(cfg.pointRaster)).findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("No existe la capa '" + cfg.pointRaster
                            + "' para raster_weighted"));
        }
        List<String> layerNames = new ArrayList<>();
        for (RasterSource r : rasters) layerNames.add(r.name());
        List<String> columns = stats.columnsFor(layerNames);
        if (!AREA_FIELD.equals(cfg.optimizeField) && !columns.contains(cfg.optimizeField)) {
            throw new IllegalArgumentException("priority.optimize-field '" + cfg.optimizeField
                    + "' no es una columna generada; columnas: " + columns);
        }

        log.info("==== Teselado {} | START ====", cfg.name);
        log.info("{}", cfg);

        // ---- regiones ----
        List<SplitRegion> units = splitRegions(input);
        PointSampler.Params sp = PointSampler.Params.of(cfg, pointRaster);

        List<Cell> cells = new ArrayList<>();
        List<Coordinate> points = new ArrayList<>();
        int processed = 0, skipped = 0;
        int pos = 0;
        for (SplitRegion u : units) {
            pos++;
            Polygon poly = u.poly;
            if (cfg.simplifyTolerance > 0) {
                List<Polygon> simplified = GeomUtils.polygons(TopologyPreservingSimplifier.simplify(poly, cfg.simplifyTolerance));
                if (simplified.isEmpty()) continue;
                poly = simplified.get(0);
            }
            if (poly.getArea() < cfg.minArea) continue;

            List<Coordinate> pts = PointSampler.sample(poly, sp);
            List<Polygon> parts;
            try {
                parts = tessellate(pts, poly, input.removeAfter);
            } catch (RuntimeException e) {
                log.warn("Error '{}' en el teselado {} del split {} ({} puntos), se saltea",
                        e.getMessage(), cfg.polygonMethod.key, u.splitIndex, pts.size(), e);
                skipped++;
                continue;
            }
            points.addAll(pts);
            double onePercent = 0.01 * u.parentArea;
            for (Polygon p : parts) {
                cells.add(new Cell(cells.size(), p, u.splitIndex, u.fields, p.getArea() / onePercent));
            }
            processed++;
            log.debug("Región {}/{} split={} puntos={} celdas={}", pos, units.size(), u.splitIndex, pts.size(), parts.size());
        }
        log.info("Teselado listo: {} celdas, {} puntos, {} regiones salteadas", cells.size(), points.size(), skipped);

        // ---- estadísticas ----
        AttributeTable table = stats.compute(cells, rasters);

        // ---- chops ----
        double[] values = new double[cells.size()];
        for (Cell c : cells) {
            values[c.index] = AREA_FIELD.equals(cfg.optimizeField) ? c.areaFraction : table.get(c.index, cfg.optimizeField);
        }
        ChopResult chops = partitioner.partition(cells, values, cfg.splitKey);

        TessellationReport rep = report(cells, points.size(), processed, skipped, chops, t0);
        log.info("\n{}", rep.formatResumen());
        return new TessellationResult(cells, points, table, chops, rep);
    }

    // teselado de una región; las fallas del motor geométrico se propagan a run()
    List<Polygon> tessellate(List<Coordinate> points, Polygon region, Geometry removeAfter) {
        return CellBuilder.build(points, region, cfg.polygonMethod, cfg.minArea, removeAfter);
    }

    // región menos exclusiones, cortada por cada polígono de split incluido
    List<SplitRegion> splitRegions(GeometryInput input) {
        Geometry region = input.region;
        if (input.removeBefore != null && !input.removeBefore.isEmpty()) {
            region = region.buffer(0).difference(input.removeBefore.buffer(0));
        }

        List<SplitRegion> out = new ArrayList<>();
        if (input.splits.isEmpty()) {
            double area = region.getArea();
            for (Polygon p : GeomUtils.polygons(region)) out.add(new SplitRegion(0, p, Collections.emptyMap(), area));
            return out;
        }
        for (int i = 0; i < input.splits.size(); i++) {
            SplitPolygon s = input.splits.get(i);
            if (!included(s)) continue;
            Map<String, String> fields = new LinkedHashMap<>();
            for (String f : cfg.splitAddFields) fields.put(f, s.attributes.get(f));
            Geometry part = region.intersection(s.poly).buffer(0);
            for (Polygon p : GeomUtils.polygons(part)) out.add(new SplitRegion(i, p, fields, s.poly.getArea()));
        }
        return out;
    }

    boolean included(SplitPolygon s) {
        for (Map.Entry<String, String> rule : cfg.splitInclude.entrySet()) {
            if (!rule.getValue().equals(s.attributes.get(rule.getKey()))) return false;
        }
        return true;
    }

    TessellationReport report(List<Cell> cells, int points, int processed, int skipped, ChopResult chops, long t0) {
        TessellationReport rep = new TessellationReport();
        rep.name = cfg.name;
        rep.seed = cfg.seed;
        rep.regionsProcessed = processed;
        rep.regionsSkipped = skipped;
        rep.points = points;
        rep.cells = cells.size();
        rep.splitGroups = chops.groupCount();
        rep.finalAreaByChop = new double[chops.overflow + 1];
        rep.finalCellsByChop = new int[chops.overflow + 1];
        for (Cell c : cells) {
            int k = chops.finalChop[c.index];
            rep.finalAreaByChop[k] += c.areaFraction;
            rep.finalCellsByChop[k]++;
        }
        rep.conflicts = chops.conflicts().size();
        rep.tiempoMs = System.currentTimeMillis() - t0;
        return rep;
    }
}
