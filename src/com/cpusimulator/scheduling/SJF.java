package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;
import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;

/**
 * SJF (Shortest Job First)
 *
 * Versión no expropiativa: en cada punto de decisión elige, entre los procesos
 * ya llegados, el de menor ráfaga total (desempate por llegada y pid) y lo
 * ejecuta hasta terminar.
 */
public class SJF implements SchedulingAlgorithm {

    @Override
    public ScheduleResult schedule(ProcessTable table, EventLogger logger) {
        ExecutionState state = new ExecutionState(getShortName(), table, logger);
        AdmissionList admission = new AdmissionList(table);
        ShortestJobSelector ready = new ShortestJobSelector(table);
        int clock = 0;

        while (!state.allCompleted()) {
            admission.admitUpTo(clock, ready::insert);
            if (ready.isEmpty()) {
                clock = state.jumpToNextArrival(clock, admission);
                continue;
            }
            int i = ready.extractMin();
            state.dispatch(i, clock);
            clock = state.advance(clock, table.burst(i));
            state.complete(i, clock);
        }
        return state.finish(clock);
    }

    @Override
    public String getName() {
        return "SJF (Shortest Job First, non-preemptive)";
    }

    @Override
    public String getShortName() {
        return "SJF";
    }

    @Override
    public boolean isPreemptive() {
        return false;
    }
}
