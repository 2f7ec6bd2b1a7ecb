package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;
import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;
import com.cpusimulator.util.ErrorKind;
import com.cpusimulator.util.InvalidInputException;

/**
 * RoundRobin
 *
 * Round-Robin con quantum fijo sobre una cola FIFO. Tras cada porción de
 * tiempo, los procesos que llegaron durante ella se encolan antes de
 * reencolar al proceso expulsado.
 */
public class RoundRobin implements SchedulingAlgorithm {
    private final int quantum;

    /**
     * Construye un RoundRobin con el quantum especificado.
     *
     * @param quantum tamaño del quantum en ticks (debe ser >= 1)
     */
    public RoundRobin(int quantum) {
        if (quantum <= 0) {
            throw new InvalidInputException(ErrorKind.INVALID_QUANTUM, "quantum must be > 0");
        }
        this.quantum = quantum;
    }

    @Override
    public ScheduleResult schedule(ProcessTable table, EventLogger logger) {
        ExecutionState state = new ExecutionState(getShortName(), table, logger);
        int[] remaining = state.remaining();
        AdmissionList admission = new AdmissionList(table);
        ReadyQueue queue = new ReadyQueue();
        int clock = 0;

        admission.admitUpTo(clock, queue::insert);
        while (!state.allCompleted()) {
            if (queue.isEmpty()) {
                clock = state.jumpToNextArrival(clock, admission);
                admission.admitUpTo(clock, queue::insert);
                continue;
            }

            int i = queue.extract();
            state.dispatch(i, clock);
            int slice = Math.min(remaining[i], quantum);
            clock = state.advance(clock, slice);
            state.consume(i, slice);

            // llegadas en (clock - slice, clock] antes de reencolar
            admission.admitUpTo(clock, queue::insert);
            if (remaining[i] == 0) {
                state.complete(i, clock);
            } else {
                state.log(clock, "P" + table.pid(i) + " quantum expired, moved to Ready queue");
                queue.insert(i);
            }
        }
        return state.finish(clock);
    }

    /**
     * Nombre legible del algoritmo, incluyendo el valor de quantum.
     *
     * @return nombre descriptivo
     */
    @Override
    public String getName() {
        return "Round Robin (Quantum: " + quantum + ")";
    }

    @Override
    public String getShortName() {
        return "RR";
    }

    @Override
    public boolean isPreemptive() {
        return true;
    }
}
