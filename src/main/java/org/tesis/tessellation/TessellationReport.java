package org.tesis.tessellation;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/* Resumen de una corrida para el log. */
public final class TessellationReport {
    String name;
    long seed;
    int regionsProcessed;
    int regionsSkipped;
    int points;
    int cells;
    int splitGroups;
    double[] finalAreaByChop;   // suma de área % por chop final (el último es el desborde)
    int[] finalCellsByChop;
    int conflicts;
    long tiempoMs;

    String formatResumen() {
        DecimalFormatSymbols sym = new DecimalFormatSymbols(Locale.US);
        DecimalFormat f3 = new DecimalFormat("#,##0.000", sym);
        DecimalFormat f0 = new DecimalFormat("#,##0", sym);

        StringBuilder sb = new StringBuilder();
        sb.append("------------------------------\n");
        sb.append("RESUMEN FINAL (").append(name).append(")\n");
        sb.append("Seed               : ").append(seed).append("\n");
        sb.append("Regiones teseladas : ").append(regionsProcessed).append("\n");
        sb.append("Regiones salteadas : ").append(regionsSkipped).append("\n");
        sb.append("Puntos             : ").append(f0.format(points)).append("\n");
        sb.append("Celdas             : ").append(f0.format(cells)).append("\n");
        sb.append("Grupos de split    : ").append(splitGroups).append("\n");
        if (finalAreaByChop != null) {
            int k = finalAreaByChop.length - 1;
            for (int c = 0; c <= k; c++) {
                String label = c < k ? "Chop " + (c + 1) : "Sin asignar";
                sb.append(String.format(Locale.US, "%-19s: ", label))
                  .append(finalCellsByChop[c]).append(" celdas, área ")
                  .append(f3.format(finalAreaByChop[c])).append(" %\n");
            }
        }
        sb.append("Conflictos adyac.  : ").append(conflicts).append("\n");
        sb.append("Tiempo total       : ").append(f0.format(tiempoMs)).append(" ms (")
          .append(f3.format(tiempoMs / 1000.0)).append(" s)\n");
        sb.append("------------------------------");
        return sb.toString();
    }

    @Override
    public String toString() { return formatResumen(); }
}
