package com.cpusimulator.process;

/**
 * Proceso
 *
 * Modelo inmutable de un proceso de la tabla de entrada:
 * - Identificador (pid) arbitrario, no necesariamente contiguo ni 1-based.
 * - Tiempo de llegada (>= 0).
 * - Ráfaga de CPU total requerida (> 0).
 *
 * El estado mutable de cada simulación (restante, inicio, fin) no vive aquí,
 * sino en el estado de ejecución de cada algoritmo.
 */
public final class Proceso implements Comparable<Proceso> {
    private final int pid;
    private final int arrivalTime;
    private final int burstTime;

    /**
     * Construye un proceso.
     *
     * @param pid         identificador
     * @param arrivalTime tiempo de llegada
     * @param burstTime   ráfaga de CPU total
     */
    public Proceso(int pid, int arrivalTime, int burstTime) {
        this.pid = pid;
        this.arrivalTime = arrivalTime;
        this.burstTime = burstTime;
    }

    /**
     * Devuelve el identificador del proceso.
     *
     * @return pid
     */
    public int getPid() {
        return pid;
    }

    /**
     * Devuelve el tiempo de llegada.
     *
     * @return arrival time en ticks
     */
    public int getArrivalTime() {
        return arrivalTime;
    }

    /**
     * Devuelve la ráfaga total de CPU.
     *
     * @return burst en ticks
     */
    public int getBurstTime() {
        return burstTime;
    }

    /**
     * Orden natural: llegada ascendente y, en empate, pid ascendente.
     */
    @Override
    public int compareTo(Proceso other) {
        if (this.arrivalTime != other.arrivalTime) {
            return Integer.compare(this.arrivalTime, other.arrivalTime);
        }
        return Integer.compare(this.pid, other.pid);
    }

    @Override
    public String toString() {
        return "P" + pid + " [arrival=" + arrivalTime + ", burst=" + burstTime + "]";
    }
}
