package org.tesis.tessellation;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Capa raster de una sola banda leída por ventanas. Las lecturas son
 * "boundless": los píxeles fuera de la extensión valen {@link #nodata()}.
 */
public interface RasterSource {

    // nombre de la capa, prefijo de las columnas de estadísticas
    String name();

    RasterTransform transform();

    double nodata();

    // lee la ventana en buf (fila mayor); buf debe tener window.size() elementos
    void readWindow(RasterWindow window, double[] buf);

    default RasterWindow window(Envelope bbox) {
        return transform().window(bbox);
    }

    default double[] readWindow(RasterWindow window) {
        double[] buf = new double[window.size()];
        readWindow(window, buf);
        return buf;
    }

    // centros de píxel de la ventana, en el mismo orden que readWindow
    default Coordinate[] samplePoints(RasterWindow window) {
        RasterTransform t = transform();
        Coordinate[] out = new Coordinate[window.size()];
        int k = 0;
        for (int r = 0; r < window.rows; r++) {
            for (int c = 0; c < window.cols; c++) {
                out[k++] = t.pixelCenter(window.rowOff + r, window.colOff + c);
            }
        }
        return out;
    }

    default boolean isNodata(double v) {
        return Double.isNaN(v) || v == nodata();
    }
}
