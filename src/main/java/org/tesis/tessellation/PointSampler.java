package org.tesis.tessellation;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Genera los puntos semilla de un polígono con una de tres estrategias
 * y los raleía por distancia mínima.
 */
public class PointSampler {

    private static final Logger log = LoggerFactory.getLogger(PointSampler.class);

    // cantidad de candidatos aleatorios por celda de min_distance
    static final int RANDOM_OVERSAMPLING = 10;
    static final int MAX_RANDOM_CANDIDATES = 50_000_000;

    // ======= parámetros de una corrida =======
    static class Params {
        SamplingMethod method = SamplingMethod.DIRECT;
        double  minDistance;
        boolean includeBorder;
        boolean includeBorderBeforeFilter;
        long    seed;
        RasterSource raster; // sólo para RASTER_WEIGHTED

        static Params of(TessellationConfig cfg, RasterSource raster) {
            Params p = new Params();
            p.method = cfg.pointMethod;
            p.minDistance = cfg.minDistance;
            p.includeBorder = cfg.includeBorder;
            p.includeBorderBeforeFilter = cfg.includeBorderBeforeFilter;
            p.seed = cfg.seed;
            p.raster = raster;
            return p;
        }
    }

    // candidato con su valor (para el orden de prioridad)
    static class Candidate {
        final Coordinate xy;
        final double value;
        Candidate(Coordinate xy, double value) { this.xy = xy; this.value = value; }
    }

    // ======= API =======

    static List<Coordinate> sample(Polygon region, Params p) {
        List<Coordinate> points;
        if (p.method == SamplingMethod.DIRECT) {
            points = GeomUtils.vertices(region);
        } else if (p.method == SamplingMethod.RASTER_WEIGHTED) {
            List<Coordinate> cands = rasterCandidates(region, p.raster);
            if (p.includeBorder && p.includeBorderBeforeFilter) cands.addAll(GeomUtils.vertices(region));
            points = distanceFilter(cands, p.minDistance);
        } else if (p.method == SamplingMethod.RANDOM_UNIFORM) {
            List<Coordinate> cands = insideOnly(region, randomCandidates(region.getEnvelopeInternal(), p.minDistance, p.seed));
            if (p.includeBorder && p.includeBorderBeforeFilter) cands.addAll(GeomUtils.vertices(region));
            points = distanceFilter(cands, p.minDistance);
        } else {
            throw new IllegalArgumentException("Método de puntos no soportado: " + p.method);
        }

        // sin puntos: un único punto en el centroide
        if (points.isEmpty()) {
            Coordinate c = region.getCentroid().getCoordinate();
            log.debug("Sin puntos tras el filtrado, se usa el centroide {}", c);
            points = new ArrayList<>();
            points.add(c);
        }

        // borde agregado después del filtro: nunca se ralea
        if (p.includeBorder && !p.includeBorderBeforeFilter) {
            LinkedHashSet<Coordinate> all = new LinkedHashSet<>(points);
            all.addAll(GeomUtils.vertices(region));
            points = new ArrayList<>(all);
        }
        return points;
    }

    // ======= candidatos =======

    // centros de píxel dentro de la región con valor válido, de mayor a menor valor
    static List<Coordinate> rasterCandidates(Polygon region, RasterSource raster) {
        if (raster == null) throw new IllegalArgumentException("raster_weighted requiere una capa raster");
        Envelope bbox = new Envelope(region.getEnvelopeInternal());
        bbox.expandBy(1);
        RasterWindow window = raster.window(bbox);
        double[] values = raster.readWindow(window);
        Coordinate[] centers = raster.samplePoints(window);

        PreparedGeometry prep = PreparedGeometryFactory.prepare(region);
        GeometryFactory gf = region.getFactory();
        List<Candidate> cands = new ArrayList<>();
        for (int i = 0; i < centers.length; i++) {
            if (raster.isNodata(values[i])) continue;
            if (!prep.intersects(gf.createPoint(centers[i]))) continue;
            cands.add(new Candidate(centers[i], values[i]));
        }
        // List.sort es estable: a igual valor se conserva el orden de barrido
        cands.sort((a, b) -> Double.compare(b.value, a.value));

        List<Coordinate> out = new ArrayList<>(cands.size());
        for (Candidate c : cands) out.add(c.xy);
        return out;
    }

    // puntos uniformes sobre el envelope, reproducibles con la semilla
    static List<Coordinate> randomCandidates(Envelope env, double minDistance, long seed) {
        if (minDistance <= 0) throw new IllegalArgumentException("random_uniform requiere distancia mínima > 0: " + minDistance);
        double count = Math.ceil((env.getWidth() / minDistance + 1) * (env.getHeight() / minDistance + 1) * RANDOM_OVERSAMPLING);
        if (count > MAX_RANDOM_CANDIDATES) {
            throw new IllegalArgumentException("random_uniform generaría " + (long) count + " candidatos; aumentar la distancia mínima");
        }
        Random rnd = new Random(seed);
        int n = (int) count;
        List<Coordinate> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double x = env.getMinX() + rnd.nextDouble() * env.getWidth();
            double y = env.getMinY() + rnd.nextDouble() * env.getHeight();
            out.add(new Coordinate(x, y));
        }
        return out;
    }

    static List<Coordinate> insideOnly(Polygon region, List<Coordinate> cands) {
        PreparedGeometry prep = PreparedGeometryFactory.prepare(region);
        GeometryFactory gf = region.getFactory();
        List<Coordinate> out = new ArrayList<>();
        for (Coordinate c : cands) if (prep.contains(gf.createPoint(c))) out.add(c);
        return out;
    }

    // ======= filtro de distancia mínima =======
    // una pasada codiciosa: cada punto conservado descarta a los siguientes a menos de minDistance
    static List<Coordinate> distanceFilter(List<Coordinate> cands, double minDistance) {
        if (minDistance <= 0) return new ArrayList<>(cands);
        int n = cands.size();
        double[] xs = new double[n], ys = new double[n];
        for (int i = 0; i < n; i++) { xs[i] = cands.get(i).x; ys[i] = cands.get(i).y; }
        boolean[] keep = new boolean[n];
        Arrays.fill(keep, true);
        double d2 = minDistance * minDistance;

        List<Coordinate> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (!keep[i]) continue;
            out.add(cands.get(i));
            for (int j = i + 1; j < n; j++) {
                if (!keep[j]) continue;
                double dx = xs[j] - xs[i], dy = ys[j] - ys[i];
                if (dx * dx + dy * dy < d2) keep[j] = false;
            }
        }
        return out;
    }
}
