package org.tesis.tessellation;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.triangulate.DelaunayTriangulationBuilder;
import org.locationtech.jts.triangulate.VoronoiDiagramBuilder;

import java.util.*;

/**
 * Convierte un conjunto de puntos en polígonos (Voronoi o Delaunay)
 * recortados a la región, descompuestos en partes simples y sin
 * fragmentos menores al área mínima.
 */
public class CellBuilder {

    // margen del envelope de recorte del Voronoi, relativo al tamaño de la región
    static final double CLIP_MARGIN = 0.1;

    /**
     * Los errores del motor geométrico (TopologyException y afines) se
     * propagan; quien llama decide si saltea la región.
     *
     * @param removeAfter geometría a restar de cada cara antes del recorte, puede ser null
     */
    static List<Polygon> build(List<Coordinate> points, Polygon region, TessellationMethod method,
                               double minArea, Geometry removeAfter) {
        GeometryFactory gf = region.getFactory();
        List<Geometry> faces = faces(points, region, method, gf);

        List<Polygon> out = new ArrayList<>();
        for (Geometry face : faces) {
            Geometry f = face;
            if (removeAfter != null && !removeAfter.isEmpty()) f = f.buffer(0).difference(removeAfter);
            Geometry clipped = region.intersection(f).buffer(0);
            for (Polygon part : GeomUtils.polygons(clipped)) {
                if (part.getArea() >= minArea) out.add(part);
            }
        }
        return out;
    }

    // caras crudas del teselado
    static List<Geometry> faces(List<Coordinate> points, Polygon region, TessellationMethod method, GeometryFactory gf) {
        Set<Coordinate> unique = new LinkedHashSet<>(points);
        Geometry diagram;
        if (method == TessellationMethod.VORONOI) {
            // con un solo sitio la celda es la región completa
            if (unique.size() == 1) return Collections.singletonList(region);
            VoronoiDiagramBuilder vb = new VoronoiDiagramBuilder();
            vb.setSites(unique);
            Envelope clip = new Envelope(region.getEnvelopeInternal());
            clip.expandToInclude(gf.createMultiPointFromCoords(unique.toArray(new Coordinate[0])).getEnvelopeInternal());
            clip.expandBy(Math.max(clip.getWidth(), clip.getHeight()) * CLIP_MARGIN + 1);
            vb.setClipEnvelope(clip);
            diagram = vb.getDiagram(gf);
        } else if (method == TessellationMethod.DELAUNAY) {
            DelaunayTriangulationBuilder db = new DelaunayTriangulationBuilder();
            db.setSites(unique);
            diagram = db.getTriangles(gf);
        } else {
            throw new IllegalArgumentException("Método de polígonos no soportado: " + method);
        }

        List<Geometry> faces = new ArrayList<>(diagram.getNumGeometries());
        for (int i = 0; i < diagram.getNumGeometries(); i++) faces.add(diagram.getGeometryN(i));
        return faces;
    }
}
