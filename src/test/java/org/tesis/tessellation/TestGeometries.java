package org.tesis.tessellation;

import org.locationtech.jts.geom.*;

import java.util.*;

// fixtures compartidas por los tests
final class TestGeometries {

    static final GeometryFactory GF = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    private TestGeometries() {}

    static Polygon rect(double x0, double y0, double x1, double y1) {
        return GF.createPolygon(new Coordinate[]{
                new Coordinate(x0, y0), new Coordinate(x1, y0), new Coordinate(x1, y1),
                new Coordinate(x0, y1), new Coordinate(x0, y0)});
    }

    static Cell cell(int index, Polygon p, double areaFraction) {
        return new Cell(index, p, 0, Collections.emptyMap(), areaFraction);
    }

    static Cell cell(int index, Polygon p, double areaFraction, String splitValue) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("kvart", splitValue);
        return new Cell(index, p, 0, fields, areaFraction);
    }

    // raster de 10x10 píxeles de lado 1 sobre (0,0)-(10,10)
    static GridRaster grid(String name, double[] data, double nodata) {
        return new GridRaster(name, new RasterTransform(0, 10, 1, 1), 10, 10, data, nodata);
    }

    static double[] filled(int n, double v) {
        double[] a = new double[n];
        Arrays.fill(a, v);
        return a;
    }
}
