package com.cpusimulator.simulator;

import com.cpusimulator.process.Proceso;

/**
 * ProcessMetrics
 *
 * Tiempos de un proceso en una ejecución concreta. Response, waiting y
 * turnaround se calculan cada uno a partir de start/end/burst, sin asumir
 * ninguna identidad entre ellos.
 */
public final class ProcessMetrics {
    private final Proceso process;
    private final int startTime;
    private final int endTime;

    /**
     * @param process   proceso de la tabla
     * @param startTime primer despacho
     * @param endTime   instante de finalización
     */
    public ProcessMetrics(Proceso process, int startTime, int endTime) {
        this.process = process;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public int getPid() {
        return process.getPid();
    }

    public int getArrivalTime() {
        return process.getArrivalTime();
    }

    public int getBurstTime() {
        return process.getBurstTime();
    }

    public int getStartTime() {
        return startTime;
    }

    public int getEndTime() {
        return endTime;
    }

    /**
     * Tiempo desde la llegada hasta el primer despacho.
     *
     * @return start - arrival
     */
    public int getResponseTime() {
        return startTime - process.getArrivalTime();
    }

    /**
     * Tiempo desde la llegada hasta la finalización.
     *
     * @return end - arrival
     */
    public int getTurnaroundTime() {
        return endTime - process.getArrivalTime();
    }

    /**
     * Tiempo total sin ejecutar dentro del turnaround.
     *
     * @return turnaround - burst
     */
    public int getWaitingTime() {
        return getTurnaroundTime() - process.getBurstTime();
    }

    @Override
    public String toString() {
        return "P" + getPid() + " start=" + startTime + " end=" + endTime
                + " response=" + getResponseTime() + " waiting=" + getWaitingTime()
                + " turnaround=" + getTurnaroundTime();
    }
}
