package org.tesis.tessellation;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.Locale;

/**
 * Transformación afín norte-arriba de un raster: esquina superior izquierda
 * y tamaño de píxel. Se usa como clave de caché, por eso es inmutable y
 * define equals/hashCode.
 */
public final class RasterTransform {
    final double originX;     // x del borde izquierdo
    final double originY;     // y del borde superior
    final double pixelWidth;
    final double pixelHeight; // positivo, las filas crecen hacia el sur

    public RasterTransform(double originX, double originY, double pixelWidth, double pixelHeight) {
        if (pixelWidth <= 0 || pixelHeight <= 0) {
            throw new IllegalArgumentException("Tamaño de píxel inválido: " + pixelWidth + " x " + pixelHeight);
        }
        this.originX = originX;
        this.originY = originY;
        this.pixelWidth = pixelWidth;
        this.pixelHeight = pixelHeight;
    }

    // ventana de píxeles (sin recortar a la extensión del raster) que cubre el envelope
    RasterWindow window(Envelope env) {
        int colStart = (int) Math.floor((env.getMinX() - originX) / pixelWidth);
        int colStop  = (int) Math.ceil((env.getMaxX() - originX) / pixelWidth);
        int rowStart = (int) Math.floor((originY - env.getMaxY()) / pixelHeight);
        int rowStop  = (int) Math.ceil((originY - env.getMinY()) / pixelHeight);
        return new RasterWindow(rowStart, colStart,
                Math.max(0, rowStop - rowStart), Math.max(0, colStop - colStart));
    }

    // centro del píxel (row, col)
    Coordinate pixelCenter(int row, int col) {
        return new Coordinate(originX + (col + 0.5) * pixelWidth, originY - (row + 0.5) * pixelHeight);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RasterTransform)) return false;
        RasterTransform t = (RasterTransform) o;
        return Double.compare(originX, t.originX) == 0
                && Double.compare(originY, t.originY) == 0
                && Double.compare(pixelWidth, t.pixelWidth) == 0
                && Double.compare(pixelHeight, t.pixelHeight) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(originX);
        h = 31 * h + Double.hashCode(originY);
        h = 31 * h + Double.hashCode(pixelWidth);
        h = 31 * h + Double.hashCode(pixelHeight);
        return h;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Affine(x0=%.3f, y0=%.3f, px=%.3f x %.3f)",
                originX, originY, pixelWidth, pixelHeight);
    }
}
