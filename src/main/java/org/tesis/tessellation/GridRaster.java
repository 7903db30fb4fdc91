package org.tesis.tessellation;

import java.util.Arrays;

/** Raster en memoria, valores en orden fila mayor desde la esquina superior izquierda. */
public class GridRaster implements RasterSource {

    private final String name;
    private final RasterTransform transform;
    private final int width, height;
    private final double[] data;
    private final double nodata;

    public GridRaster(String name, RasterTransform transform, int width, int height, double[] data, double nodata) {
        if (data.length != width * height) {
            throw new IllegalArgumentException("Raster " + name + ": se esperaban " + (width * height)
                    + " valores y hay " + data.length);
        }
        this.name = name;
        this.transform = transform;
        this.width = width;
        this.height = height;
        this.data = data;
        this.nodata = nodata;
    }

    @Override public String name() { return name; }
    @Override public RasterTransform transform() { return transform; }
    @Override public double nodata() { return nodata; }

    public int width() { return width; }
    public int height() { return height; }

    public double get(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) return nodata;
        return data[row * width + col];
    }

    @Override
    public void readWindow(RasterWindow window, double[] buf) {
        if (buf.length < window.size()) {
            throw new IllegalArgumentException("Buffer chico para " + window);
        }
        Arrays.fill(buf, 0, window.size(), nodata);
        for (int r = 0; r < window.rows; r++) {
            int row = window.rowOff + r;
            if (row < 0 || row >= height) continue;
            int c0 = Math.max(0, -window.colOff);
            int c1 = Math.min(window.cols, width - window.colOff);
            if (c1 <= c0) continue;
            System.arraycopy(data, row * width + window.colOff + c0, buf, r * window.cols + c0, c1 - c0);
        }
    }

    @Override
    public String toString() {
        return "GridRaster(" + name + ", " + width + "x" + height + ", " + transform + ")";
    }
}
