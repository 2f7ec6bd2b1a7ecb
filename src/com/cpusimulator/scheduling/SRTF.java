package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;
import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;

/**
 * SRTF (Shortest Remaining Time First)
 *
 * SJF expropiativo. El reloj no avanza tick a tick: el proceso con menor
 * restante se ejecuta hasta terminar o hasta la siguiente llegada, lo que
 * ocurra antes, que es el único instante en el que puede ser superado.
 */
public class SRTF implements SchedulingAlgorithm {

    @Override
    public ScheduleResult schedule(ProcessTable table, EventLogger logger) {
        ExecutionState state = new ExecutionState(getShortName(), table, logger);
        int[] remaining = state.remaining();
        AdmissionList admission = new AdmissionList(table);
        ShortestRemainingSelector ready = new ShortestRemainingSelector(table, remaining);
        int clock = 0;

        while (!state.allCompleted()) {
            admission.admitUpTo(clock, ready::insert);
            if (ready.isEmpty()) {
                clock = state.jumpToNextArrival(clock, admission);
                continue;
            }

            int i = ready.peekMin();
            state.dispatch(i, clock);

            int nextArrival = admission.nextArrivalTime();
            if (!admission.hasPending() || (long) clock + remaining[i] <= nextArrival) {
                ready.extractMin();
                int run = remaining[i];
                state.consume(i, run);
                clock = state.advance(clock, run);
                state.complete(i, clock);
            } else {
                // hay una llegada pendiente posterior a clock: run > 0
                int run = nextArrival - clock;
                clock = nextArrival;
                ready.reinsert(i, remaining[i] - run);
            }
        }
        return state.finish(clock);
    }

    @Override
    public String getName() {
        return "SRTF (Shortest Remaining Time First, preemptive SJF)";
    }

    @Override
    public String getShortName() {
        return "SRTF";
    }

    @Override
    public boolean isPreemptive() {
        return true;
    }
}
