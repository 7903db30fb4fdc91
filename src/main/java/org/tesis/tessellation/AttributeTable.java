package org.tesis.tessellation;

import java.util.*;

/**
 * Tabla numérica de atributos por celda con esquema fijo: las columnas se
 * definen al crearla y cada fila corresponde al índice de una celda.
 */
public final class AttributeTable {

    private final List<String> columns;
    private final Map<String, Integer> columnIndex = new HashMap<>();
    private final double[][] rows;

    AttributeTable(List<String> columns, int rowCount) {
        this.columns = List.copyOf(columns);
        for (int i = 0; i < this.columns.size(); i++) {
            if (columnIndex.put(this.columns.get(i), i) != null) {
                throw new IllegalArgumentException("Columna repetida: " + this.columns.get(i));
            }
        }
        rows = new double[rowCount][this.columns.size()];
        for (double[] r : rows) Arrays.fill(r, Double.NaN);
    }

    public List<String> columns() { return columns; }

    public int rowCount() { return rows.length; }

    public boolean hasColumn(String name) { return columnIndex.containsKey(name); }

    int column(String name) {
        Integer i = columnIndex.get(name);
        if (i == null) throw new IllegalArgumentException("Columna inexistente: " + name);
        return i;
    }

    public double get(int row, String column) { return rows[row][column(column)]; }

    double get(int row, int column) { return rows[row][column]; }

    void set(int row, int column, double value) { rows[row][column] = value; }

    // columna completa, en orden de celdas
    public double[] values(String column) {
        int c = column(column);
        double[] out = new double[rows.length];
        for (int r = 0; r < rows.length; r++) out[r] = rows[r][c];
        return out;
    }
}
