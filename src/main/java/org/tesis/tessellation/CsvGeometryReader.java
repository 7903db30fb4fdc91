package org.tesis.tessellation;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class CsvGeometryReader {

    // función para leer un CSV y devolver la lista de vértices
    static List<VertexRow> readCsv(String path) throws IOException {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8))) {
            return readCsv(br, path);
        }
    }

    static List<VertexRow> readCsv(BufferedReader br, String source) throws IOException {
        List<VertexRow> out = new ArrayList<>();
        String header = br.readLine();
        if (header == null) throw new IOException("CSV vacío: " + source);
        String[] h = VertexRow.splitCsv(header);
        String line;
        while ((line = br.readLine()) != null) {
            if (line.trim().isEmpty()) continue;
            String[] v = VertexRow.splitCsv(line);
            out.add(VertexRow.fromCsv(h, v));
        }
        return out;
    }
}
