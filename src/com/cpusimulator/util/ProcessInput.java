package com.cpusimulator.util;

import com.cpusimulator.process.Proceso;
import java.util.List;
import java.util.OptionalInt;

/**
 * ProcessInput
 *
 * Resultado de leer una definición de procesos: la lista en orden de entrada
 * y, si la fuente lo incluye, el quantum.
 */
public final class ProcessInput {
    private final List<Proceso> processes;
    private final Integer quantum;

    /**
     * @param processes procesos leídos (se copia)
     * @param quantum   quantum leído o {@code null} si la fuente no lo define
     */
    public ProcessInput(List<Proceso> processes, Integer quantum) {
        this.processes = List.copyOf(processes);
        this.quantum = quantum;
    }

    public List<Proceso> getProcesses() {
        return processes;
    }

    public OptionalInt getQuantum() {
        return quantum == null ? OptionalInt.empty() : OptionalInt.of(quantum);
    }
}
