package org.tesis.tessellation;

import org.locationtech.jts.geom.Polygon;

import java.util.LinkedHashMap;
import java.util.Map;

// polígono de la capa de división con sus atributos
public class SplitPolygon {
    String id;
    Polygon poly;
    Map<String, String> attributes = new LinkedHashMap<>();

    SplitPolygon(String id, Polygon poly, Map<String, String> attributes) {
        this.id = id;
        this.poly = poly;
        this.attributes.putAll(attributes);
    }
}
