package com.cpusimulator.scheduling;

import static com.cpusimulator.Fixtures.assertWellFormed;
import static com.cpusimulator.Fixtures.endOf;
import static com.cpusimulator.Fixtures.startOf;
import static com.cpusimulator.Fixtures.table;
import static org.junit.Assert.assertEquals;

import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;
import com.cpusimulator.simulator.Segment;
import com.cpusimulator.simulator.SystemMetrics;
import java.util.List;
import org.junit.Test;

public class FCFSTest {

    private ScheduleResult run(int[]... triples) {
        ScheduleResult result = new FCFS().schedule(table(triples), new EventLogger());
        assertWellFormed(result);
        return result;
    }

    @Test
    public void testRunsInArrivalOrder() {
        ScheduleResult result = run(
                new int[] {1, 0, 7},
                new int[] {2, 2, 4},
                new int[] {3, 4, 1},
                new int[] {4, 5, 4});

        assertEquals(List.of(
                Segment.of(1, 0, 7),
                Segment.of(2, 7, 11),
                Segment.of(3, 11, 12),
                Segment.of(4, 12, 16)), result.getSegments());
        SystemMetrics metrics = result.getMetrics();
        assertEquals(4.75, metrics.getAverageResponseTime(), 0.001);
        assertEquals(4.75, metrics.getAverageWaitingTime(), 0.001);
        assertEquals(8.75, metrics.getAverageTurnaroundTime(), 0.001);
    }

    @Test
    public void testSingleLateProcessGetsLeadingIdle() {
        ScheduleResult result = run(new int[] {1, 5, 3});

        assertEquals(List.of(Segment.idle(0, 5), Segment.of(1, 5, 8)), result.getSegments());
        assertEquals(5, startOf(result, 1));
        assertEquals(8, endOf(result, 1));
    }

    @Test
    public void testIdleGapBetweenProcesses() {
        ScheduleResult result = run(
                new int[] {1, 0, 2},
                new int[] {2, 5, 3});

        assertEquals(List.of(
                Segment.of(1, 0, 2),
                Segment.idle(2, 5),
                Segment.of(2, 5, 8)), result.getSegments());
    }

    @Test
    public void testUnsortedInputAndArbitraryPids() {
        ScheduleResult result = run(
                new int[] {42, 3, 2},
                new int[] {7, 0, 3},
                new int[] {-5, 0, 1});

        assertEquals(List.of(
                Segment.of(-5, 0, 1),
                Segment.of(7, 1, 4),
                Segment.of(42, 4, 6)), result.getSegments());
        assertEquals(4, startOf(result, 42));
    }

    @Test
    public void testEachProcessRunsExactlyItsBurst() {
        ScheduleResult result = run(
                new int[] {1, 1, 3},
                new int[] {2, 1, 2},
                new int[] {3, 20, 1});

        for (int i = 0; i < result.getTable().size(); i++) {
            assertEquals(result.getTable().burst(i), result.getEndTime(i) - result.getStartTime(i));
        }
    }
}
