package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;
import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;

/**
 * FCFS (First Come, First Served)
 *
 * Despacha en orden de llegada (arrival, pid). Cada proceso se ejecuta hasta
 * terminar; si el siguiente aún no ha llegado, la CPU queda ociosa y el reloj
 * salta directamente a su llegada.
 */
public class FCFS implements SchedulingAlgorithm {

    @Override
    public ScheduleResult schedule(ProcessTable table, EventLogger logger) {
        ExecutionState state = new ExecutionState(getShortName(), table, logger);
        AdmissionList admission = new AdmissionList(table);
        int clock = 0;

        while (admission.hasPending()) {
            int arrival = admission.nextArrivalTime();
            if (clock < arrival) {
                clock = state.idleUntil(clock, arrival);
            }
            int i = admission.next();
            state.dispatch(i, clock);
            clock = state.advance(clock, table.burst(i));
            state.complete(i, clock);
        }
        return state.finish(clock);
    }

    @Override
    public String getName() {
        return "FCFS (First Come, First Served)";
    }

    @Override
    public String getShortName() {
        return "FCFS";
    }

    @Override
    public boolean isPreemptive() {
        return false;
    }
}
