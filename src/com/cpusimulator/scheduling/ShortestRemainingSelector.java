package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;

/**
 * ShortestRemainingSelector
 *
 * Selector de SRTF: ordena por el tiempo restante actual, luego llegada y pid.
 * El vector {@code remaining} es compartido con el algoritmo; sus valores solo
 * pueden cambiar para índices fuera del selector (ver {@link #reinsert}).
 */
public class ShortestRemainingSelector extends RankedReadySet {
    private final int[] remaining;

    /**
     * @param table     tabla de procesos
     * @param remaining vector de ráfaga restante, indexado como la tabla
     */
    public ShortestRemainingSelector(ProcessTable table, int[] remaining) {
        super(ProcessOrdering.byRemaining(table, remaining));
        this.remaining = remaining;
    }

    /**
     * Extrae el índice, actualiza su restante y lo vuelve a insertar con la
     * nueva clave.
     *
     * @param index        índice presente en el selector
     * @param newRemaining nuevo tiempo restante (> 0)
     */
    public void reinsert(int index, int newRemaining) {
        if (!contains(index)) {
            throw new IllegalStateException("index " + index + " is not in ready set");
        }
        if (peekMin() != index) {
            throw new IllegalStateException("only the best-ranked entry can be rekeyed");
        }
        extractMin();
        remaining[index] = newRemaining;
        insert(index);
    }
}
