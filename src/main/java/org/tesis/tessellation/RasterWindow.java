package org.tesis.tessellation;

// ventana rectangular de píxeles; puede salirse de la extensión del raster
final class RasterWindow {
    final int rowOff, colOff;
    final int rows, cols;

    RasterWindow(int rowOff, int colOff, int rows, int cols) {
        this.rowOff = rowOff;
        this.colOff = colOff;
        this.rows = rows;
        this.cols = cols;
    }

    int size() { return rows * cols; }

    boolean isEmpty() { return rows == 0 || cols == 0; }

    @Override
    public String toString() {
        return "Window(row=" + rowOff + ", col=" + colOff + ", " + rows + "x" + cols + ")";
    }
}
