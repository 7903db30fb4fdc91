package org.tesis.tessellation;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.io.WKTWriter;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/** Exporta la tabla de celdas y los puntos a CSV; la geometría va en WKT. */
public class CellTableWriter {

    static void writeCells(Writer w, TessellationResult res, List<String> splitFields) throws IOException {
        WKTWriter wkt = new WKTWriter();
        List<String> cols = res.stats.columns();

        StringBuilder h = new StringBuilder("cell,split_index");
        for (String f : splitFields) h.append(',').append(f);
        h.append(',').append(TessellationPipeline.AREA_FIELD);
        for (String c : cols) h.append(',').append(c);
        h.append(",initial_chop,final_chop,wkt\n");
        w.write(h.toString());

        for (Cell c : res.cells) {
            StringBuilder sb = new StringBuilder();
            sb.append(c.index).append(',').append(c.splitIndex);
            for (String f : splitFields) sb.append(',').append(escape(c.splitFields.get(f)));
            sb.append(',').append(fmt(c.areaFraction));
            for (int k = 0; k < cols.size(); k++) sb.append(',').append(fmt(res.stats.get(c.index, k)));
            sb.append(',').append(res.chops.initialChopNumber(c.index));
            sb.append(',').append(res.chops.finalChopNumber(c.index));
            sb.append(",\"").append(wkt.write(c.geometry)).append("\"\n");
            w.write(sb.toString());
        }
    }

    static void writePoints(Writer w, List<Coordinate> points) throws IOException {
        w.write("x,y\n");
        for (Coordinate c : points) w.write(fmt(c.x) + "," + fmt(c.y) + "\n");
    }

    static void write(String dir, String name, TessellationResult res, List<String> splitFields) throws IOException {
        new File(dir).mkdirs();
        try (Writer w = new OutputStreamWriter(new FileOutputStream(new File(dir, name + "_cells.csv")), StandardCharsets.UTF_8)) {
            writeCells(w, res, splitFields);
        }
        try (Writer w = new OutputStreamWriter(new FileOutputStream(new File(dir, name + "_points.csv")), StandardCharsets.UTF_8)) {
            writePoints(w, res.points);
        }
    }

    // NaN queda vacío
    static String fmt(double d) {
        if (Double.isNaN(d)) return "";
        return String.format(Locale.US, "%.6f", d);
    }

    static String escape(String s) {
        if (s == null) return "";
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0) return s;
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }
}
