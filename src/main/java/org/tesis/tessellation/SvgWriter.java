package org.tesis.tessellation;

import org.locationtech.jts.geom.*;
import java.util.List;
import java.util.Locale;

class SvgWriter {

    // un color por chop final; el desborde va en gris
    static final String[] FILLS = {"#6baed6","#74c476","#fd8d3c","#9e9ac8","#fdd0a2","#a1d99b","#9ecae1","#fdae6b"};
    static final String OVERFLOW_FILL = "#d9d9d9";

    static String toSVG(Geometry region, TessellationResult res) {
        Envelope env = region.getEnvelopeInternal();
        double minX = env.getMinX(), minY = env.getMinY(), w = env.getWidth(), h = env.getHeight();

        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(fmt(w))
          .append("\" height=\"").append(fmt(h)).append("\" viewBox=\"")
          .append(fmt(minX)).append(" ").append(fmt(minY)).append(" ").append(fmt(w)).append(" ").append(fmt(h)).append("\">\n");

        // Fondo
        sb.append("  <rect x=\"").append(fmt(minX)).append("\" y=\"").append(fmt(minY))
          .append("\" width=\"").append(fmt(w)).append("\" height=\"").append(fmt(h))
          .append("\" fill=\"white\"/>\n");

        // Grupo invertido en Y (SVG tiene Y hacia abajo)
        sb.append("  <g transform=\"translate(0,").append(fmt(2 * minY + h)).append(") scale(1,-1)\">\n");

        // Región
        for (Polygon p : GeomUtils.polygons(region)) {
            sb.append("    <path d=\"").append(pathFor(p))
              .append("\" fill=\"#f0f0f0\" stroke=\"#333\" stroke-width=\"1\"/>\n");
        }

        // Celdas
        for (Cell c : res.cells) {
            int chop = res.chops.finalChopNumber(c.index);
            String fill = chop == 0 ? OVERFLOW_FILL : FILLS[(chop - 1) % FILLS.length];
            emitPolygon(sb, c, chop, fill);
        }

        // Puntos
        for (Coordinate p : res.points) {
            sb.append("    <circle cx=\"").append(fmt(p.x)).append("\" cy=\"").append(fmt(p.y))
              .append("\" r=\"0.8\" fill=\"#111\"/>\n");
        }

        sb.append("  </g>\n</svg>\n");
        return sb.toString();
    }

    // ---------- helpers de dibujo ----------

    static void emitPolygon(StringBuilder sb, Cell cell, int chop, String fill) {
        sb.append("    <path d=\"").append(pathFor(cell.geometry))
          .append("\" fill=\"").append(fill)
          .append("\" fill-opacity=\"0.85\" stroke=\"#111\" stroke-width=\"0.4\">\n");
        sb.append("      <title>celda ").append(cell.index)
          .append(" | split=").append(cell.splitIndex)
          .append(" | chop=").append(chop)
          .append("</title>\n");
        sb.append("    </path>\n");
    }

    // Genera el atributo "d" de un path SVG a partir de un Polygon (exterior + huecos)
    static String pathFor(Polygon poly) {
        StringBuilder sb = new StringBuilder();
        appendLineString(sb, poly.getExteriorRing());
        for (int i = 0; i < poly.getNumInteriorRing(); i++) {
            appendLineString(sb, poly.getInteriorRingN(i));
        }
        return sb.toString();
    }

    // Agrega comandos M/L/Z para una LineString cerrada
    static void appendLineString(StringBuilder sb, LineString ls) {
        Coordinate[] c = ls.getCoordinates();
        if (c.length == 0) return;
        sb.append("M ").append(fmt(c[0].x)).append(" ").append(fmt(c[0].y)).append(" ");
        for (int i = 1; i < c.length; i++) {
            sb.append("L ").append(fmt(c[i].x)).append(" ").append(fmt(c[i].y)).append(" ");
        }
        sb.append("Z ");
    }

    static String fmt(double d) {
        return String.format(Locale.US, "%.3f", d);
    }
}
