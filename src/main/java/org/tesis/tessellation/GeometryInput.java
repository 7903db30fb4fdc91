package org.tesis.tessellation;

import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.List;

// geometrías de entrada de una corrida; removeBefore/removeAfter pueden ser null
public class GeometryInput {
    Geometry region;
    List<SplitPolygon> splits = new ArrayList<>(); // vacío = toda la región es un solo split
    Geometry removeBefore;
    Geometry removeAfter;
}
