package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;
import java.util.Comparator;
import java.util.function.IntUnaryOperator;

/**
 * ProcessOrdering
 *
 * Órdenes totales sobre índices de la {@link ProcessTable}. Cada comparador
 * recibe explícitamente la tabla y la clave de rango que necesita, de modo que
 * ningún algoritmo depende de estado global para ordenar.
 */
public final class ProcessOrdering {

    private ProcessOrdering() {
    }

    /**
     * Orden de llegada: arrival ascendente y, en empate, pid ascendente.
     *
     * @param table tabla de procesos
     * @return comparador de índices
     */
    public static Comparator<Integer> byArrival(ProcessTable table) {
        return (a, b) -> {
            int cmp = Integer.compare(table.arrival(a), table.arrival(b));
            if (cmp != 0) {
                return cmp;
            }
            return Integer.compare(table.pid(a), table.pid(b));
        };
    }

    /**
     * Orden por rango: clave ascendente, luego arrival ascendente y por último
     * pid ascendente.
     *
     * @param table   tabla de procesos
     * @param rankKey función índice -> clave (burst o remaining)
     * @return comparador de índices
     */
    public static Comparator<Integer> byRank(ProcessTable table, IntUnaryOperator rankKey) {
        return (a, b) -> {
            int cmp = Integer.compare(rankKey.applyAsInt(a), rankKey.applyAsInt(b));
            if (cmp != 0) {
                return cmp;
            }
            return byArrival(table).compare(a, b);
        };
    }

    /**
     * Orden por ráfaga total (SJF).
     *
     * @param table tabla de procesos
     * @return comparador de índices
     */
    public static Comparator<Integer> byBurst(ProcessTable table) {
        return byRank(table, table::burst);
    }

    /**
     * Orden por tiempo restante (SRTF). El vector se consulta en cada
     * comparación, así que sus valores solo deben cambiar mientras el índice no
     * esté dentro de una estructura ordenada.
     *
     * @param table     tabla de procesos
     * @param remaining vector de ráfaga restante por índice
     * @return comparador de índices
     */
    public static Comparator<Integer> byRemaining(ProcessTable table, int[] remaining) {
        return byRank(table, i -> remaining[i]);
    }
}
