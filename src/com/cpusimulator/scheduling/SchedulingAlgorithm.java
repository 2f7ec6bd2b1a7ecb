package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;
import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;

/**
 * SchedulingAlgorithm
 *
 * Interfaz que deben implementar los algoritmos de planificación. Cada
 * ejecución simula la tabla completa, desde el instante 0 hasta la última
 * finalización, y devuelve la línea de tiempo y los tiempos por proceso.
 * La tabla debe estar validada; el algoritmo no vuelve a comprobarla.
 */
public interface SchedulingAlgorithm {
    /**
     * Simula la tabla completa con esta política.
     *
     * @param table  tabla de procesos validada (al menos un proceso)
     * @param logger registro de eventos de la simulación
     * @return resultado con segmentos y tiempos de inicio/fin
     */
    ScheduleResult schedule(ProcessTable table, EventLogger logger);

    /**
     * Devuelve un nombre descriptivo del algoritmo (usado en los informes).
     *
     * @return nombre del algoritmo
     */
    String getName();

    /**
     * Nombre corto usado en CSV y tablas (FCFS, SJF, SRTF, RR).
     *
     * @return nombre corto
     */
    String getShortName();

    /**
     * Indica si la política puede expulsar a un proceso antes de terminar.
     *
     * @return true si es expropiativa
     */
    boolean isPreemptive();
}
