package org.tesis.tessellation;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

// estrategia de generación de puntos
public enum SamplingMethod {
    DIRECT("direct"),
    RASTER_WEIGHTED("raster_weighted"),
    RANDOM_UNIFORM("random_uniform");

    final String key;

    SamplingMethod(String key) { this.key = key; }

    static SamplingMethod fromKey(String s) {
        String k = s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
        for (SamplingMethod m : values()) if (m.key.equals(k)) return m;
        throw new IllegalArgumentException("Método de puntos desconocido: '" + s + "', conocidos: "
                + Arrays.stream(values()).map(m -> m.key).collect(Collectors.joining(", ")));
    }
}
