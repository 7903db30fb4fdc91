package org.tesis.tessellation;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;

import java.util.*;

/**
 * Celda del teselado. El índice es su identidad en la lista global de celdas;
 * geometría y campos no cambian después de crearla.
 */
public final class Cell {
    final int index;
    final Polygon geometry;
    final Envelope bounds;
    final int splitIndex;
    final Map<String, String> splitFields; // campos heredados del split, orden de configuración
    final double areaFraction;             // área / (1% del área del split)

    Cell(int index, Polygon geometry, int splitIndex, Map<String, String> splitFields, double areaFraction) {
        this.index = index;
        this.geometry = geometry;
        this.bounds = geometry.getEnvelopeInternal();
        this.splitIndex = splitIndex;
        this.splitFields = Collections.unmodifiableMap(new LinkedHashMap<>(splitFields));
        this.areaFraction = areaFraction;
    }

    // clave de agrupamiento para los chops; campos ausentes quedan como null
    List<String> splitKey(List<String> fields) {
        List<String> key = new ArrayList<>(fields.size());
        for (String f : fields) key.add(splitFields.get(f));
        return key;
    }

    @Override
    public String toString() {
        return "Cell#" + index + "(split=" + splitIndex + ", area%=" + areaFraction + ")";
    }
}
