package com.cpusimulator.simulator;

import static com.cpusimulator.Fixtures.table;
import static org.junit.Assert.assertEquals;

import com.cpusimulator.process.ProcessTable;
import java.util.List;
import org.junit.Test;

public class SystemMetricsTest {

    @Test
    public void testReduceComputesEachMetricFromStartAndEnd() {
        ProcessTable table = table(
                new int[] {1, 0, 5},
                new int[] {2, 1, 1});
        ScheduleResult result = new ScheduleResult("SRTF", table,
                List.of(Segment.of(1, 0, 1), Segment.of(2, 1, 2), Segment.of(1, 2, 6)),
                new int[] {0, 1}, new int[] {6, 2});

        SystemMetrics metrics = SystemMetrics.reduce(result);
        ProcessMetrics p1 = metrics.getCompletedProcesses().get(0);

        assertEquals(0, p1.getResponseTime());
        assertEquals(1, p1.getWaitingTime());
        assertEquals(6, p1.getTurnaroundTime());
        assertEquals(0.0, metrics.getAverageResponseTime(), 0.001);
        assertEquals(0.5, metrics.getAverageWaitingTime(), 0.001);
        assertEquals(3.5, metrics.getAverageTurnaroundTime(), 0.001);
        assertEquals(2, metrics.getContextSwitches());
    }

    @Test
    public void testUtilizationCountsIdleSegments() {
        ProcessTable table = table(
                new int[] {1, 0, 2},
                new int[] {2, 4, 2});
        ScheduleResult result = new ScheduleResult("FCFS", table,
                List.of(Segment.of(1, 0, 2), Segment.idle(2, 4), Segment.of(2, 4, 6)),
                new int[] {0, 4}, new int[] {2, 6});

        SystemMetrics metrics = result.getMetrics();

        assertEquals(4, metrics.getTotalCPUTime());
        assertEquals(2, metrics.getTotalIdleTime());
        assertEquals(6, metrics.getMakespan());
        assertEquals(66.666, metrics.getCPUUtilization(), 0.01);
        // el hueco ocioso entre dos procesos distintos cuenta como un cambio
        assertEquals(1, metrics.getContextSwitches());
    }

    @Test
    public void testEmptyMetricsAreZero() {
        SystemMetrics metrics = new SystemMetrics();

        assertEquals(0.0, metrics.getAverageResponseTime(), 0.0);
        assertEquals(0.0, metrics.getAverageWaitingTime(), 0.0);
        assertEquals(0.0, metrics.getAverageTurnaroundTime(), 0.0);
        assertEquals(0.0, metrics.getCPUUtilization(), 0.0);
    }

    @Test
    public void testResultCopiesArrays() {
        int[] start = {0};
        int[] end = {3};
        ScheduleResult result = new ScheduleResult("FCFS", table(new int[] {1, 0, 3}),
                List.of(Segment.of(1, 0, 3)), start, end);
        start[0] = 99;

        assertEquals(0, result.getStartTime(0));
    }
}
