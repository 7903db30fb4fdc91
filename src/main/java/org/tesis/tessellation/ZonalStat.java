package org.tesis.tessellation;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Estadísticos agregados sobre los píxeles válidos de una celda. std y var son poblacionales. */
public enum ZonalStat {
    MIN("min"),
    MAX("max"),
    MEAN("mean"),
    STD("std"),
    VAR("var"),
    SUM("sum"),
    COUNT("count");

    final String key;

    ZonalStat(String key) { this.key = key; }

    double apply(double[] data) {
        if (this == COUNT) return data.length;
        if (this == MIN) return Arrays.stream(data).min().orElse(Double.NaN);
        if (this == MAX) return Arrays.stream(data).max().orElse(Double.NaN);
        if (this == SUM) return sum(data);
        if (this == MEAN) return mean(data);
        if (this == VAR) return variance(data);
        return Math.sqrt(variance(data));
    }

    static double sum(double[] data) {
        double s = 0;
        for (double v : data) s += v;
        return s;
    }

    static double mean(double[] data) {
        return data.length == 0 ? Double.NaN : sum(data) / data.length;
    }

    static double variance(double[] data) {
        if (data.length == 0) return Double.NaN;
        double m = mean(data), acc = 0;
        for (double v : data) acc += (v - m) * (v - m);
        return acc / data.length;
    }

    static ZonalStat fromKey(String s) {
        String k = s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
        for (ZonalStat z : values()) if (z.key.equals(k)) return z;
        throw new IllegalArgumentException("Estadístico desconocido: '" + s + "', conocidos: "
                + Arrays.stream(values()).map(z -> z.key).collect(Collectors.joining(", ")));
    }
}
