package org.tesis.tessellation;

import org.locationtech.jts.geom.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;


public class TesisTessellation {

    private static final Logger log = LoggerFactory.getLogger(TesisTessellation.class);

    public static void main(String[] args) throws Exception {
        // sin argumentos se usan sólo los valores de reference.conf
        TessellationConfig cfg = args.length >= 1 ? TessellationConfig.load(args[0]) : TessellationConfig.defaults();
        String outputDir = args.length >= 2 ? args[1] : cfg.outputDir;

        // 1) Leer CSV de geometrías
        List<VertexRow> rows = CsvGeometryReader.readCsv(cfg.geometryCsv);

        // 2) Reconstruir geometrías
        GeometryFactory gf = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);
        GeometryInput input = GeomUtils.buildInput(rows, gf);

        // 3) Capas raster
        List<RasterSource> rasters = new ArrayList<>();
        for (Map.Entry<String, String> e : cfg.rasters.entrySet()) {
            log.info("Leyendo capa '{}' de '{}'", e.getKey(), e.getValue());
            rasters.add(AsciiGridReader.read(e.getKey(), e.getValue()));
        }

        // 4) Teselado, estadísticas y chops
        TessellationResult res = new TessellationPipeline(cfg).run(input, rasters);

        // 5) Exportar CSV y SVG
        CellTableWriter.write(outputDir, cfg.name, res, cfg.splitAddFields);
        String outputSvg = new File(outputDir, cfg.name + "_cells.svg").getPath();
        try (Writer w = new OutputStreamWriter(new FileOutputStream(outputSvg), StandardCharsets.UTF_8)) {
            w.write(SvgWriter.toSVG(input.region, res));
        }
        log.info("Salida escrita en: {}", outputDir);
    }
}
