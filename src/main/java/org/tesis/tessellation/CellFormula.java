package org.tesis.tessellation;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Métricas derivadas con nombre. Reciben los píxeles válidos de la celda y
 * la máscara de centros de píxel dentro de la celda.
 */
public enum CellFormula {
    MEAN_DIV_STD("mean_div_std") {
        @Override double apply(double[] data, boolean[] mask) {
            return ZonalStat.mean(data) / Math.sqrt(ZonalStat.variance(data));
        }
    },
    CV("cv") {
        @Override double apply(double[] data, boolean[] mask) {
            return Math.sqrt(ZonalStat.variance(data)) / ZonalStat.mean(data);
        }
    },
    RANGE("range") {
        @Override double apply(double[] data, boolean[] mask) {
            return ZonalStat.MAX.apply(data) - ZonalStat.MIN.apply(data);
        }
    },
    VALID_FRACTION("valid_fraction") {
        @Override double apply(double[] data, boolean[] mask) {
            int inside = 0;
            for (boolean b : mask) if (b) inside++;
            return inside == 0 ? Double.NaN : (double) data.length / inside;
        }
    };

    final String key;

    CellFormula(String key) { this.key = key; }

    abstract double apply(double[] data, boolean[] mask);

    static CellFormula fromKey(String s) {
        String k = s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
        for (CellFormula f : values()) if (f.key.equals(k)) return f;
        throw new IllegalArgumentException("Fórmula desconocida: '" + s + "', conocidas: "
                + Arrays.stream(values()).map(f -> f.key).collect(Collectors.joining(", ")));
    }
}
