package org.tesis.tessellation;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;

import java.io.File;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Configuración tipada del teselado, leída una sola vez desde HOCON
 * (raíz {@code tessellation}) sobre los valores de {@code reference.conf}.
 * Los errores de configuración se reportan con IllegalArgumentException
 * antes de tocar cualquier geometría.
 */
public final class TessellationConfig {

    static final String ROOT = "tessellation";

    final String name;
    final long   seed;

    // puntos
    final SamplingMethod pointMethod;
    final String  pointRaster;
    final double  minDistance;
    final boolean includeBorder;
    final boolean includeBorderBeforeFilter;

    // polígonos
    final TessellationMethod polygonMethod;
    final double minArea;
    final double simplifyTolerance;
    final List<String> splitAddFields;
    final Map<String, String> splitInclude;

    // estadísticas
    final List<ZonalStat>   stats;
    final double[]          percentiles;
    final List<CellFormula> formulas;          // ordenadas por nombre
    final Map<String, double[]> valuePercentiles; // valores ordenados

    // prioridad / chops
    final List<String> splitKey;
    final double[] areaDivisions;
    final String   optimizeField;
    final boolean  neighborCorners;
    final int      maxClusterSize;
    final int      maxCandidates;

    // entrada / salida
    final String geometryCsv;
    final Map<String, String> rasters;
    final String outputDir;

    private TessellationConfig(Config root) {
        Config c = root.getConfig(ROOT);
        name = c.getString("name");
        seed = c.getLong("seed");

        pointMethod = SamplingMethod.fromKey(c.getString("point.method"));
        pointRaster = c.getString("point.raster");
        minDistance = c.getDouble("point.min-distance");
        if (minDistance < 0) throw new IllegalArgumentException("point.min-distance negativo: " + minDistance);
        if (pointMethod == SamplingMethod.RANDOM_UNIFORM && minDistance <= 0) {
            throw new IllegalArgumentException("random_uniform requiere point.min-distance > 0: " + minDistance);
        }
        includeBorder = c.getBoolean("point.include-border");
        includeBorderBeforeFilter = c.getBoolean("point.include-border-before-distance-filter");

        polygonMethod = TessellationMethod.fromKey(c.getString("polygon.method"));
        minArea = c.getDouble("polygon.min-area");
        simplifyTolerance = c.getDouble("polygon.simplify-tolerance");
        splitAddFields = List.copyOf(c.getStringList("polygon.split-add-fields"));
        splitInclude = unwrapStrings(c, "polygon.split-include");

        stats = c.getStringList("stats").stream().map(ZonalStat::fromKey).collect(Collectors.toUnmodifiableList());
        percentiles = toArray(c.getDoubleList("percentiles"));
        for (double p : percentiles) {
            if (p < 0 || p > 100) throw new IllegalArgumentException("Percentil fuera de [0, 100]: " + p);
        }
        formulas = c.getStringList("formulas").stream().map(CellFormula::fromKey)
                .sorted(Comparator.comparing(f -> f.key)).distinct()
                .collect(Collectors.toUnmodifiableList());
        valuePercentiles = unwrapNumberLists(c, "value-percentiles");

        splitKey = List.copyOf(c.getStringList("priority.split-key"));
        for (String k : splitKey) {
            if (!splitAddFields.contains(k)) {
                throw new IllegalArgumentException("priority.split-key '" + k + "' no está en polygon.split-add-fields " + splitAddFields);
            }
        }
        areaDivisions = toArray(c.getDoubleList("priority.area-divisions"));
        for (double d : areaDivisions) {
            if (d < 0) throw new IllegalArgumentException("priority.area-divisions con cuota negativa: " + d);
        }
        optimizeField = c.getString("priority.optimize-field");
        neighborCorners = c.getBoolean("priority.neighbor-corners");
        maxClusterSize = c.getInt("priority.max-cluster-size");
        maxCandidates = c.getInt("priority.max-candidates");
        if (maxClusterSize < 2 || maxCandidates < 1) {
            throw new IllegalArgumentException("priority.max-cluster-size >= 2 y priority.max-candidates >= 1");
        }

        geometryCsv = c.getString("input.geometry-csv");
        rasters = unwrapStrings(c, "input.rasters");
        outputDir = c.getString("output.dir");
    }

    // ======= fábricas =======

    public static TessellationConfig from(Config config) {
        return new TessellationConfig(config.withFallback(ConfigFactory.defaultReference()).resolve());
    }

    public static TessellationConfig load(String path) {
        return from(ConfigFactory.parseFile(new File(path)));
    }

    public static TessellationConfig parse(String hocon) {
        return from(ConfigFactory.parseString(hocon));
    }

    public static TessellationConfig defaults() {
        return from(ConfigFactory.empty());
    }

    // ======= helpers =======

    // objeto HOCON clave -> valor escalar, claves ordenadas para que la salida sea estable
    static Map<String, String> unwrapStrings(Config c, String path) {
        Map<String, String> out = new TreeMap<>();
        for (Map.Entry<String, ConfigValue> e : c.getObject(path).entrySet()) {
            out.put(e.getKey(), String.valueOf(e.getValue().unwrapped()));
        }
        return Collections.unmodifiableMap(out);
    }

    static Map<String, double[]> unwrapNumberLists(Config c, String path) {
        Map<String, double[]> out = new TreeMap<>();
        for (Map.Entry<String, ConfigValue> e : c.getObject(path).entrySet()) {
            Object raw = e.getValue().unwrapped();
            if (!(raw instanceof List)) {
                throw new IllegalArgumentException(path + "." + e.getKey() + " debe ser una lista de números");
            }
            List<?> list = (List<?>) raw;
            double[] values = new double[list.size()];
            for (int i = 0; i < values.length; i++) {
                Object v = list.get(i);
                if (!(v instanceof Number)) {
                    throw new IllegalArgumentException(path + "." + e.getKey() + " contiene un valor no numérico: " + v);
                }
                values[i] = ((Number) v).doubleValue();
            }
            Arrays.sort(values);
            out.put(e.getKey(), values);
        }
        return Collections.unmodifiableMap(out);
    }

    static double[] toArray(List<Double> list) {
        double[] a = new double[list.size()];
        for (int i = 0; i < a.length; i++) a[i] = list.get(i);
        return a;
    }

    @Override
    public String toString() {
        return "TessellationConfig{name=" + name + ", seed=" + seed
                + ", point=" + pointMethod.key + "/" + minDistance
                + ", polygon=" + polygonMethod.key + "/" + minArea
                + ", stats=" + stats + ", percentiles=" + Arrays.toString(percentiles)
                + ", formulas=" + formulas + ", divisions=" + Arrays.toString(areaDivisions)
                + ", optimize=" + optimizeField + ", splitKey=" + splitKey + "}";
    }
}
