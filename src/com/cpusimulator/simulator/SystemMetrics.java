package com.cpusimulator.simulator;

import java.util.ArrayList;
import java.util.List;

/**
 * SystemMetrics
 *
 * Recolecta métricas de una ejecución: procesos completados, tiempos medios,
 * utilización de CPU y cambios de contexto. Proporciona getters para la capa
 * de presentación.
 */
public class SystemMetrics {
    private final List<ProcessMetrics> completedProcesses;
    private int totalCPUTime;
    private int totalIdleTime;
    private int contextSwitches;

    /**
     * Construye un SystemMetrics vacío.
     */
    public SystemMetrics() {
        this.completedProcesses = new ArrayList<>();
        this.totalCPUTime = 0;
        this.totalIdleTime = 0;
        this.contextSwitches = 0;
    }

    /**
     * Reduce el resultado de una ejecución a sus métricas.
     *
     * @param result resultado de un algoritmo
     * @return métricas por proceso y agregadas
     */
    public static SystemMetrics reduce(ScheduleResult result) {
        SystemMetrics metrics = new SystemMetrics();
        for (int i = 0; i < result.getTable().size(); i++) {
            metrics.addCompletedProcess(new ProcessMetrics(result.getTable().get(i),
                    result.getStartTime(i), result.getEndTime(i)));
        }

        int busy = 0;
        int idle = 0;
        int switches = 0;
        Integer lastOwner = null;
        for (Segment s : result.getSegments()) {
            if (s.isIdle()) {
                idle += s.length();
                continue;
            }
            busy += s.length();
            if (lastOwner != null && !lastOwner.equals(s.getOwner())) {
                switches++;
            }
            lastOwner = s.getOwner();
        }
        metrics.setTotalCPUTime(busy);
        metrics.setTotalIdleTime(idle);
        metrics.setContextSwitches(switches);
        return metrics;
    }

    /**
     * Añade un proceso completado a la lista de métricas.
     *
     * @param process métricas del proceso completado
     */
    public void addCompletedProcess(ProcessMetrics process) {
        completedProcesses.add(process);
    }

    /**
     * Calcula el tiempo medio de respuesta entre los procesos completados.
     *
     * @return average response time o 0 si no hay procesos completados
     */
    public double getAverageResponseTime() {
        if (completedProcesses.isEmpty()) {
            return 0;
        }
        double totalResponse = 0;
        for (ProcessMetrics p : completedProcesses) {
            totalResponse += p.getResponseTime();
        }
        return totalResponse / completedProcesses.size();
    }

    /**
     * Calcula el tiempo medio de espera entre los procesos completados.
     *
     * @return average waiting time o 0 si no hay procesos completados
     */
    public double getAverageWaitingTime() {
        if (completedProcesses.isEmpty()) {
            return 0;
        }
        double totalWait = 0;
        for (ProcessMetrics p : completedProcesses) {
            totalWait += p.getWaitingTime();
        }
        return totalWait / completedProcesses.size();
    }

    /**
     * Calcula el turnaround medio entre los procesos completados.
     *
     * @return average turnaround time o 0 si no hay procesos completados
     */
    public double getAverageTurnaroundTime() {
        if (completedProcesses.isEmpty()) {
            return 0;
        }
        double totalTurnaround = 0;
        for (ProcessMetrics p : completedProcesses) {
            totalTurnaround += p.getTurnaroundTime();
        }
        return totalTurnaround / completedProcesses.size();
    }

    /**
     * Calcula la utilización de CPU (porcentaje).
     *
     * @return porcentaje de utilización (0-100)
     */
    public double getCPUUtilization() {
        if (totalCPUTime + totalIdleTime == 0) {
            return 0;
        }
        return (double) totalCPUTime / (totalCPUTime + totalIdleTime) * 100;
    }

    public int getContextSwitches() {
        return contextSwitches;
    }

    public int getTotalCPUTime() {
        return totalCPUTime;
    }

    public int getTotalIdleTime() {
        return totalIdleTime;
    }

    /**
     * Duración total de la línea de tiempo.
     *
     * @return tiempo de CPU más tiempo ocioso
     */
    public int getMakespan() {
        return totalCPUTime + totalIdleTime;
    }

    public void setTotalCPUTime(int time) {
        this.totalCPUTime = time;
    }

    public void setTotalIdleTime(int time) {
        this.totalIdleTime = time;
    }

    public void setContextSwitches(int switches) {
        this.contextSwitches = switches;
    }

    /**
     * Devuelve una copia de la lista de procesos completados para uso externo.
     *
     * @return lista de métricas por proceso, en orden de la tabla
     */
    public List<ProcessMetrics> getCompletedProcesses() {
        return new ArrayList<>(completedProcesses);
    }
}
