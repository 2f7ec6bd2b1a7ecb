package com.cpusimulator.util;

import com.cpusimulator.process.Proceso;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * InputValidator
 *
 * Comprobaciones previas a la simulación. Se detiene en el primer error
 * encontrado.
 */
public final class InputValidator {

    private InputValidator() {
    }

    /**
     * Valida la lista de procesos y el quantum.
     *
     * @param processes procesos leídos
     * @param quantum   quantum de Round Robin
     * @throws InvalidInputException si algún valor no es válido
     */
    public static void validate(List<Proceso> processes, int quantum) {
        validateProcesses(processes);
        validateQuantum(quantum);
    }

    /**
     * Valida la lista de procesos.
     *
     * @param processes procesos leídos
     * @throws InvalidInputException si algún valor no es válido
     */
    public static void validateProcesses(List<Proceso> processes) {
        if (processes == null || processes.isEmpty()) {
            throw new InvalidInputException(ErrorKind.INVALID_PROCESS_COUNT, "no processes defined");
        }
        Set<Integer> seen = new HashSet<>();
        for (Proceso p : processes) {
            if (p.getArrivalTime() < 0) {
                throw new InvalidInputException(ErrorKind.INVALID_ARRIVAL,
                        "P" + p.getPid() + " arrival=" + p.getArrivalTime());
            }
            if (p.getBurstTime() <= 0) {
                throw new InvalidInputException(ErrorKind.INVALID_BURST,
                        "P" + p.getPid() + " burst=" + p.getBurstTime());
            }
            if (!seen.add(p.getPid())) {
                throw new InvalidInputException(ErrorKind.DUPLICATE_PID, "P" + p.getPid());
            }
        }
        long makespan = makespanOf(processes);
        if (makespan > Integer.MAX_VALUE) {
            throw new InvalidInputException(ErrorKind.CLOCK_OVERFLOW,
                    "last completion at " + makespan + " > " + Integer.MAX_VALUE);
        }
    }

    /**
     * Instante de la última finalización. Es el mismo para cualquier
     * política que no deje la CPU ociosa con procesos listos.
     */
    private static long makespanOf(List<Proceso> processes) {
        List<Proceso> byArrival = new ArrayList<>(processes);
        Collections.sort(byArrival);
        long clock = 0;
        for (Proceso p : byArrival) {
            clock = Math.max(clock, p.getArrivalTime()) + p.getBurstTime();
        }
        return clock;
    }

    public static void validateQuantum(int quantum) {
        if (quantum <= 0) {
            throw new InvalidInputException(ErrorKind.INVALID_QUANTUM, "quantum=" + quantum);
        }
    }
}
