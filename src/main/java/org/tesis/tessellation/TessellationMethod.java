package org.tesis.tessellation;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

// tipo de teselado de los puntos
public enum TessellationMethod {
    VORONOI("voronoi"),
    DELAUNAY("delaunay");

    final String key;

    TessellationMethod(String key) { this.key = key; }

    static TessellationMethod fromKey(String s) {
        String k = s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
        for (TessellationMethod m : values()) if (m.key.equals(k)) return m;
        throw new IllegalArgumentException("Método de polígonos desconocido: '" + s + "', conocidos: "
                + Arrays.stream(values()).map(m -> m.key).collect(Collectors.joining(", ")));
    }
}
