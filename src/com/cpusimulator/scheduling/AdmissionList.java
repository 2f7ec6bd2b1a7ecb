package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * AdmissionList
 *
 * Lista de admisión: todos los índices ordenados una única vez por orden de
 * llegada (arrival, pid), con un cursor que avanza a medida que los procesos
 * se admiten en el conjunto de listos.
 */
public class AdmissionList {
    /** Valor devuelto por {@link #nextArrivalTime()} cuando no quedan llegadas. */
    public static final int NO_ARRIVAL = Integer.MAX_VALUE;

    private final ProcessTable table;
    private final List<Integer> order;
    private int cursor = 0;

    /**
     * Construye la lista ordenando los índices de la tabla.
     *
     * @param table tabla de procesos
     */
    public AdmissionList(ProcessTable table) {
        this.table = table;
        this.order = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            order.add(i);
        }
        order.sort(ProcessOrdering.byArrival(table));
    }

    /**
     * Indica si quedan procesos sin admitir.
     *
     * @return true si hay procesos pendientes
     */
    public boolean hasPending() {
        return cursor < order.size();
    }

    /**
     * Llegada del siguiente proceso sin admitir.
     *
     * @return tiempo de llegada o {@link #NO_ARRIVAL} si no quedan
     */
    public int nextArrivalTime() {
        return hasPending() ? table.arrival(order.get(cursor)) : NO_ARRIVAL;
    }

    /**
     * Extrae el siguiente índice en orden de llegada, sin mirar el reloj.
     * Usado por FCFS, que despacha en este orden fijo.
     *
     * @return índice del siguiente proceso
     */
    public int next() {
        if (!hasPending()) {
            throw new SchedulerInvariantException("admission list exhausted");
        }
        return order.get(cursor++);
    }

    /**
     * Admite, en orden de llegada, todos los procesos pendientes con
     * {@code arrival <= clock}.
     *
     * @param clock reloj simulado actual
     * @param sink  destino de los índices admitidos
     */
    public void admitUpTo(int clock, IntConsumer sink) {
        while (hasPending() && table.arrival(order.get(cursor)) <= clock) {
            sink.accept(order.get(cursor++));
        }
    }
}
