package org.tesis.tessellation;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/** Lector de ESRI ASCII grid (.asc) a {@link GridRaster}. */
public class AsciiGridReader {

    static final double DEFAULT_NODATA = -9999;

    // lee el archivo y nombra la capa con el nombre dado
    static GridRaster read(String name, String path) throws IOException {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8))) {
            return read(name, br);
        }
    }

    static GridRaster read(String name, BufferedReader br) throws IOException {
        Integer ncols = null, nrows = null;
        Double xll = null, yll = null, cellSize = null;
        boolean center = false;
        double nodata = DEFAULT_NODATA;

        // cabecera: pares clave valor hasta la primera línea numérica
        String line;
        String pending = null;
        while ((line = br.readLine()) != null) {
            String t = line.trim();
            if (t.isEmpty()) continue;
            String[] kv = t.split("\\s+");
            String key = kv[0].toLowerCase(Locale.ROOT);
            if (!Character.isLetter(key.charAt(0))) { pending = t; break; }
            if (kv.length < 2) throw new IOException("Cabecera ASCII inválida: " + t);
            if (key.equals("ncols")) ncols = Integer.parseInt(kv[1]);
            else if (key.equals("nrows")) nrows = Integer.parseInt(kv[1]);
            else if (key.equals("xllcorner")) xll = Double.parseDouble(kv[1]);
            else if (key.equals("yllcorner")) yll = Double.parseDouble(kv[1]);
            else if (key.equals("xllcenter")) { xll = Double.parseDouble(kv[1]); center = true; }
            else if (key.equals("yllcenter")) { yll = Double.parseDouble(kv[1]); center = true; }
            else if (key.equals("cellsize")) cellSize = Double.parseDouble(kv[1]);
            else if (key.equals("nodata_value")) nodata = Double.parseDouble(kv[1]);
            else throw new IOException("Clave de cabecera desconocida: " + kv[0]);
        }
        if (ncols == null || nrows == null || xll == null || yll == null || cellSize == null) {
            throw new IOException("Cabecera ASCII incompleta (ncols, nrows, xll, yll, cellsize)");
        }
        if (center) {
            xll -= cellSize / 2;
            yll -= cellSize / 2;
        }

        double[] data = new double[ncols * nrows];
        int k = 0;
        while (pending != null || (line = br.readLine()) != null) {
            String t = pending != null ? pending : line.trim();
            pending = null;
            if (t.isEmpty()) continue;
            for (String v : t.split("\\s+")) {
                if (k >= data.length) throw new IOException("Sobran valores en el grid " + name);
                data[k++] = Double.parseDouble(v);
            }
        }
        if (k != data.length) {
            throw new IOException("Grid " + name + " incompleto: " + k + " de " + data.length + " valores");
        }
        RasterTransform t = new RasterTransform(xll, yll + nrows * cellSize, cellSize, cellSize);
        return new GridRaster(name, t, ncols, nrows, data, nodata);
    }
}
