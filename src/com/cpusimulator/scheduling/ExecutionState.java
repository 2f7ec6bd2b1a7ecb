package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;
import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;
import com.cpusimulator.simulator.TimelineBuilder;
import java.util.Arrays;

/**
 * ExecutionState
 *
 * Estado mutable de una única ejecución de un algoritmo: ráfaga restante,
 * inicio y fin por índice, y la línea de tiempo en construcción. Se crea
 * nuevo para cada ejecución y nunca se comparte entre algoritmos.
 */
class ExecutionState {
    private final String algorithmName;
    private final ProcessTable table;
    private final EventLogger logger;
    private final int[] remaining;
    private final int[] startTimes;
    private final int[] endTimes;
    private final TimelineBuilder timeline = new TimelineBuilder(0);
    private int completed = 0;
    private int running = -1;

    ExecutionState(String algorithmName, ProcessTable table, EventLogger logger) {
        this.algorithmName = algorithmName;
        this.table = table;
        this.logger = logger;
        this.remaining = new int[table.size()];
        this.startTimes = new int[table.size()];
        this.endTimes = new int[table.size()];
        for (int i = 0; i < table.size(); i++) {
            remaining[i] = table.burst(i);
        }
        Arrays.fill(startTimes, -1);
        Arrays.fill(endTimes, -1);
    }

    /**
     * Vector de ráfaga restante, compartido con el selector de SRTF.
     */
    int[] remaining() {
        return remaining;
    }

    int completedCount() {
        return completed;
    }

    boolean allCompleted() {
        return completed == table.size();
    }

    /**
     * Asigna la CPU al índice en {@code clock}: registra el inicio si es el
     * primer despacho y abre su segmento si cambia el propietario.
     */
    void dispatch(int index, int clock) {
        if (endTimes[index] != -1) {
            throw new SchedulerInvariantException(algorithmName + ": P" + table.pid(index) + " already completed");
        }
        if (table.arrival(index) > clock) {
            throw new SchedulerInvariantException(algorithmName + ": P" + table.pid(index)
                    + " dispatched at " + clock + " before its arrival " + table.arrival(index));
        }
        if (startTimes[index] == -1) {
            startTimes[index] = clock;
        }
        if (running != index) {
            if (running != -1) {
                log(clock, "P" + table.pid(running) + " preempted by P" + table.pid(index)
                        + " (remaining=" + remaining[running] + ")");
            }
            log(clock, "P" + table.pid(index) + " dispatched (remaining=" + remaining[index] + ")");
            running = index;
        }
        timeline.switchTo(table.pid(index), clock);
    }

    /**
     * Descuenta {@code units} de la ráfaga restante del índice.
     */
    void consume(int index, int units) {
        if (units <= 0 || units > remaining[index]) {
            throw new SchedulerInvariantException(algorithmName + ": invalid run of " + units
                    + " units for P" + table.pid(index) + " (remaining=" + remaining[index] + ")");
        }
        remaining[index] -= units;
    }

    /**
     * Avanza el reloj {@code units} ticks.
     *
     * @return nuevo valor del reloj
     * @throws SchedulerInvariantException si el reloj desborda un int
     */
    int advance(int clock, int units) {
        try {
            return Math.addExact(clock, units);
        } catch (ArithmeticException e) {
            throw new SchedulerInvariantException(algorithmName + ": clock overflow advancing " + units
                    + " units from T=" + clock, e);
        }
    }

    /**
     * Registra la finalización del índice en {@code clock}.
     */
    void complete(int index, int clock) {
        if (endTimes[index] != -1) {
            throw new SchedulerInvariantException(algorithmName + ": P" + table.pid(index) + " completed twice");
        }
        endTimes[index] = clock;
        completed++;
        if (running == index) {
            running = -1;
        }
        log(clock, "P" + table.pid(index) + " terminated");
    }

    /**
     * Salta el reloj hasta la siguiente llegada pendiente, dejando la CPU
     * ociosa durante el hueco.
     *
     * @return nuevo valor del reloj
     * @throws SchedulerInvariantException si no quedan llegadas pendientes
     */
    int jumpToNextArrival(int clock, AdmissionList admission) {
        if (!admission.hasPending()) {
            throw new SchedulerInvariantException(algorithmName + ": ready set empty at T=" + clock
                    + " with " + (table.size() - completed) + " incomplete processes and no pending arrival");
        }
        return idleUntil(clock, admission.nextArrivalTime());
    }

    /**
     * Deja la CPU ociosa desde {@code clock} hasta {@code target}.
     *
     * @return target
     */
    int idleUntil(int clock, int target) {
        if (target <= clock) {
            throw new SchedulerInvariantException(algorithmName + ": idle jump must move forward (" + clock
                    + " -> " + target + ")");
        }
        timeline.switchToIdle(clock);
        log(clock, "CPU idle until T=" + target);
        return target;
    }

    void log(int clock, String message) {
        logger.log(clock, algorithmName + ": " + message);
    }

    /**
     * Cierra la línea de tiempo y construye el resultado.
     */
    ScheduleResult finish(int clock) {
        if (!allCompleted()) {
            throw new SchedulerInvariantException(algorithmName + ": finished with "
                    + (table.size() - completed) + " incomplete processes");
        }
        log(clock, "simulation complete");
        return new ScheduleResult(algorithmName, table, timeline.finish(clock), startTimes, endTimes);
    }
}
