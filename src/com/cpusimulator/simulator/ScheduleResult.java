package com.cpusimulator.simulator;

import com.cpusimulator.process.ProcessTable;
import java.util.ArrayList;
import java.util.List;

/**
 * ScheduleResult
 *
 * Resultado de ejecutar un algoritmo sobre una tabla: línea de tiempo
 * coalescida y tiempos de inicio/fin por índice de la tabla.
 */
public class ScheduleResult {
    private final String algorithmName;
    private final ProcessTable table;
    private final List<Segment> segments;
    private final int[] startTimes;
    private final int[] endTimes;
    private SystemMetrics metrics;

    /**
     * @param algorithmName nombre corto del algoritmo (FCFS, SJF, SRTF, RR)
     * @param table         tabla simulada
     * @param segments      línea de tiempo coalescida
     * @param startTimes    primer despacho por índice
     * @param endTimes      finalización por índice
     */
    public ScheduleResult(String algorithmName, ProcessTable table, List<Segment> segments,
            int[] startTimes, int[] endTimes) {
        this.algorithmName = algorithmName;
        this.table = table;
        this.segments = List.copyOf(segments);
        this.startTimes = startTimes.clone();
        this.endTimes = endTimes.clone();
    }

    public String getAlgorithmName() {
        return algorithmName;
    }

    public ProcessTable getTable() {
        return table;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public int getStartTime(int index) {
        return startTimes[index];
    }

    public int getEndTime(int index) {
        return endTimes[index];
    }

    /**
     * Secuencia de pids despachados (propietarios de los segmentos no IDLE, en
     * orden).
     *
     * @return lista de pids
     */
    public List<Integer> getDispatchSequence() {
        List<Integer> sequence = new ArrayList<>();
        for (Segment s : segments) {
            if (!s.isIdle()) {
                sequence.add(s.getOwner());
            }
        }
        return sequence;
    }

    /**
     * Pids en orden de finalización (empates por orden de la tabla).
     *
     * @return lista de pids
     */
    public List<Integer> getCompletionOrder() {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < table.size(); i++) {
            indices.add(i);
        }
        indices.sort((a, b) -> Integer.compare(endTimes[a], endTimes[b]));
        List<Integer> pids = new ArrayList<>();
        for (int i : indices) {
            pids.add(table.pid(i));
        }
        return pids;
    }

    /**
     * Métricas derivadas, calculadas en la primera llamada.
     *
     * @return métricas de la ejecución
     */
    public synchronized SystemMetrics getMetrics() {
        if (metrics == null) {
            metrics = SystemMetrics.reduce(this);
        }
        return metrics;
    }
}
