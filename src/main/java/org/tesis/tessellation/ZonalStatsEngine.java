package org.tesis.tessellation;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Estadísticas zonales por celda y capa raster. Las columnas se nombran
 * {@code <capa>_<estadístico>}, {@code <capa>_<p>_percentile},
 * {@code <capa>_<fórmula>} y {@code <capa>_value_<v>_percentile}.
 * Los píxeles nodata no cuentan; una celda sin píxeles válidos da NaN.
 */
public class ZonalStatsEngine {

    private static final Logger log = LoggerFactory.getLogger(ZonalStatsEngine.class);

    final List<ZonalStat>   stats;
    final double[]          percentiles;
    final List<CellFormula> formulas;
    final Map<String, double[]> valuePercentiles;

    ZonalStatsEngine(List<ZonalStat> stats, double[] percentiles, List<CellFormula> formulas,
                     Map<String, double[]> valuePercentiles) {
        this.stats = List.copyOf(stats);
        this.percentiles = percentiles.clone();
        List<CellFormula> sorted = new ArrayList<>(formulas);
        sorted.sort(Comparator.comparing(f -> f.key));
        this.formulas = Collections.unmodifiableList(sorted);
        this.valuePercentiles = valuePercentiles;
    }

    static ZonalStatsEngine of(TessellationConfig cfg) {
        return new ZonalStatsEngine(cfg.stats, cfg.percentiles, cfg.formulas, cfg.valuePercentiles);
    }

    // ======= esquema =======

    List<String> columnsFor(String layer) {
        List<String> cols = new ArrayList<>();
        for (ZonalStat s : stats) cols.add(layer + "_" + s.key);
        for (double p : percentiles) cols.add(layer + "_" + formatNumber(p) + "_percentile");
        for (CellFormula f : formulas) cols.add(layer + "_" + f.key);
        for (double v : valuesFor(layer)) cols.add(layer + "_value_" + formatNumber(v) + "_percentile");
        return cols;
    }

    List<String> columnsFor(List<String> layers) {
        List<String> cols = new ArrayList<>();
        for (String l : layers) cols.addAll(columnsFor(l));
        return cols;
    }

    double[] valuesFor(String layer) {
        double[] v = valuePercentiles.get(layer);
        return v == null ? new double[0] : v;
    }

    // 50.0 -> "50", 12.5 -> "12.5"
    static String formatNumber(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
        return Double.toString(v);
    }

    // ======= cálculo =======

    /** Calcula todas las columnas para todas las celdas; la caché de ventanas vive sólo durante esta llamada. */
    AttributeTable compute(List<Cell> cells, List<RasterSource> layers) {
        List<String> names = new ArrayList<>();
        for (RasterSource r : layers) names.add(r.name());
        AttributeTable table = new AttributeTable(columnsFor(names), cells.size());
        SampleCache cache = new SampleCache();

        int col0 = 0;
        for (RasterSource raster : layers) {
            int width = columnsFor(raster.name()).size();
            log.info("Estadísticas de '{}' para {} celdas", raster.name(), cells.size());
            for (int row = 0; row < cells.size(); row++) {
                double[] values = cellValues(cells.get(row), raster, cache);
                if (values == null) continue; // queda NaN
                for (int k = 0; k < width; k++) table.set(row, col0 + k, values[k]);
            }
            col0 += width;
        }
        log.debug("Ventanas en caché: {}", cache.size());
        return table;
    }

    // valores de un bloque capa/celda, null si no hay píxeles válidos
    double[] cellValues(Cell cell, RasterSource raster, SampleCache cache) {
        if (cell.geometry.isEmpty()) return null;
        SampleCache.RasterSample sample = cache.get(cell, raster);
        if (sample.window.isEmpty()) return null;
        raster.readWindow(sample.window, sample.buffer);

        double[] tmp = new double[sample.buffer.length];
        int n = 0;
        for (int i = 0; i < sample.mask.length; i++) {
            if (sample.mask[i] && !raster.isNodata(sample.buffer[i])) tmp[n++] = sample.buffer[i];
        }
        if (n == 0) return null;
        double[] data = Arrays.copyOf(tmp, n);
        return reduce(raster.name(), data, sample.mask);
    }

    double[] reduce(String layer, double[] data, boolean[] mask) {
        double[] vp = valuesFor(layer);
        double[] out = new double[stats.size() + percentiles.length + formulas.size() + vp.length];
        int k = 0;
        for (ZonalStat s : stats) out[k++] = s.apply(data);
        if (percentiles.length > 0) {
            double[] sorted = data.clone();
            Arrays.sort(sorted);
            for (double p : percentiles) out[k++] = percentile(sorted, p);
        }
        for (CellFormula f : formulas) out[k++] = f.apply(data, mask);
        for (double v : vp) {
            int eq = 0;
            for (double d : data) if (d == v) eq++;
            out[k++] = 100.0 * eq / data.length;
        }
        return out;
    }

    // percentil con interpolación lineal entre rangos vecinos; sorted no vacío
    static double percentile(double[] sorted, double p) {
        double rank = p / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        if (lo == hi) return sorted[lo];
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }

    // ======= caché de ventanas =======

    /**
     * Ventana, buffer y máscara por (celda, transformación afín). Capas que
     * comparten la transformación reutilizan la misma máscara.
     */
    static final class SampleCache {

        static final class RasterSample {
            final RasterWindow window;
            final double[] buffer;
            final boolean[] mask; // centro de píxel dentro de la celda

            RasterSample(RasterWindow window, boolean[] mask) {
                this.window = window;
                this.buffer = new double[window.size()];
                this.mask = mask;
            }
        }

        private final Map<Integer, Map<RasterTransform, RasterSample>> byCell = new HashMap<>();

        RasterSample get(Cell cell, RasterSource raster) {
            Map<RasterTransform, RasterSample> m = byCell.computeIfAbsent(cell.index, k -> new HashMap<>());
            return m.computeIfAbsent(raster.transform(), t -> build(cell, raster));
        }

        private static RasterSample build(Cell cell, RasterSource raster) {
            Envelope bbox = new Envelope(cell.bounds);
            bbox.expandBy(1);
            RasterWindow window = raster.window(bbox);
            Coordinate[] centers = raster.samplePoints(window);
            PreparedGeometry prep = PreparedGeometryFactory.prepare(cell.geometry);
            GeometryFactory gf = cell.geometry.getFactory();
            boolean[] mask = new boolean[centers.length];
            for (int i = 0; i < centers.length; i++) mask[i] = prep.intersects(gf.createPoint(centers[i]));
            return new RasterSample(window, mask);
        }

        int size() {
            int n = 0;
            for (Map<RasterTransform, RasterSample> m : byCell.values()) n += m.size();
            return n;
        }
    }
}
