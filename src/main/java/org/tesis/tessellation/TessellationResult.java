package org.tesis.tessellation;

import org.locationtech.jts.geom.Coordinate;

import java.util.List;

// salida completa de una corrida: celdas, puntos, atributos y chops
public class TessellationResult {
    final List<Cell> cells;
    final List<Coordinate> points;
    final AttributeTable stats;
    final ChopResult chops;
    final TessellationReport report;

    TessellationResult(List<Cell> cells, List<Coordinate> points, AttributeTable stats,
                       ChopResult chops, TessellationReport report) {
        this.cells = cells;
        this.points = points;
        this.stats = stats;
        this.chops = chops;
        this.report = report;
    }

    public List<Cell> cells() { return cells; }
    public List<Coordinate> points() { return points; }
    public AttributeTable stats() { return stats; }
    public ChopResult chops() { return chops; }
}
