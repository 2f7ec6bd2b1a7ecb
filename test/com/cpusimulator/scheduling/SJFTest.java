package com.cpusimulator.scheduling;

import static com.cpusimulator.Fixtures.assertWellFormed;
import static com.cpusimulator.Fixtures.startOf;
import static com.cpusimulator.Fixtures.table;
import static org.junit.Assert.assertEquals;

import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;
import com.cpusimulator.simulator.Segment;
import com.cpusimulator.simulator.SystemMetrics;
import java.util.List;
import org.junit.Test;

public class SJFTest {

    private ScheduleResult run(int[]... triples) {
        ScheduleResult result = new SJF().schedule(table(triples), new EventLogger());
        assertWellFormed(result);
        return result;
    }

    @Test
    public void testPicksShortestAmongArrived() {
        ScheduleResult result = run(
                new int[] {1, 0, 7},
                new int[] {2, 2, 4},
                new int[] {3, 4, 1},
                new int[] {4, 5, 4});

        assertEquals(List.of(
                Segment.of(1, 0, 7),
                Segment.of(3, 7, 8),
                Segment.of(2, 8, 12),
                Segment.of(4, 12, 16)), result.getSegments());
        SystemMetrics metrics = result.getMetrics();
        assertEquals(4.00, metrics.getAverageResponseTime(), 0.001);
        assertEquals(4.00, metrics.getAverageWaitingTime(), 0.001);
        assertEquals(8.00, metrics.getAverageTurnaroundTime(), 0.001);
    }

    @Test
    public void testEqualBurstsTieBreakByArrivalThenPid() {
        ScheduleResult result = run(
                new int[] {1, 0, 3},
                new int[] {3, 1, 2},
                new int[] {2, 1, 2});

        assertEquals(List.of(1, 2, 3), result.getDispatchSequence());
        assertEquals(3, startOf(result, 2));
        assertEquals(5, startOf(result, 3));
    }

    @Test
    public void testDoesNotPickProcessThatHasNotArrived() {
        ScheduleResult result = run(
                new int[] {1, 0, 5},
                new int[] {2, 6, 1});

        assertEquals(List.of(
                Segment.of(1, 0, 5),
                Segment.idle(5, 6),
                Segment.of(2, 6, 7)), result.getSegments());
    }

    @Test
    public void testSingleLateProcessGetsLeadingIdle() {
        ScheduleResult result = run(new int[] {1, 5, 3});

        assertEquals(List.of(Segment.idle(0, 5), Segment.of(1, 5, 8)), result.getSegments());
    }
}
