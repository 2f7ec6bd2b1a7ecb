package com.cpusimulator.process;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ProcessTable
 *
 * Tabla inmutable de procesos, direccionada por índice. Los algoritmos
 * trabajan siempre con índices de esta tabla y nunca copian los datos del
 * proceso; el pid solo se consulta para desempates y para la salida.
 */
public final class ProcessTable {
    private final List<Proceso> processes;

    /**
     * Construye la tabla a partir de una lista (se copia internamente).
     *
     * @param processes procesos en el orden de entrada
     */
    public ProcessTable(List<Proceso> processes) {
        this.processes = Collections.unmodifiableList(new ArrayList<>(processes));
    }

    public int size() {
        return processes.size();
    }

    public Proceso get(int index) {
        return processes.get(index);
    }

    public int pid(int index) {
        return processes.get(index).getPid();
    }

    public int arrival(int index) {
        return processes.get(index).getArrivalTime();
    }

    public int burst(int index) {
        return processes.get(index).getBurstTime();
    }
}
