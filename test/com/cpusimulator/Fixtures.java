package com.cpusimulator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import com.cpusimulator.process.Proceso;
import com.cpusimulator.process.ProcessTable;
import com.cpusimulator.simulator.Segment;
import com.cpusimulator.simulator.ScheduleResult;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the test classes.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * @param triples {pid, arrival, burst} per process
     */
    public static List<Proceso> processes(int[]... triples) {
        List<Proceso> list = new ArrayList<>();
        for (int[] t : triples) {
            list.add(new Proceso(t[0], t[1], t[2]));
        }
        return list;
    }

    public static ProcessTable table(int[]... triples) {
        return new ProcessTable(processes(triples));
    }

    public static int indexOfPid(ProcessTable table, int pid) {
        for (int i = 0; i < table.size(); i++) {
            if (table.pid(i) == pid) {
                return i;
            }
        }
        throw new IllegalArgumentException("no pid " + pid);
    }

    public static int startOf(ScheduleResult result, int pid) {
        return result.getStartTime(indexOfPid(result.getTable(), pid));
    }

    public static int endOf(ScheduleResult result, int pid) {
        return result.getEndTime(indexOfPid(result.getTable(), pid));
    }

    /**
     * Structural checks every timeline must pass: starts at 0, contiguous,
     * owner-coalesced, each process runs exactly its burst between its start
     * and end and never before its arrival.
     */
    public static void assertWellFormed(ScheduleResult result) {
        List<Segment> segments = result.getSegments();
        ProcessTable table = result.getTable();
        assertFalse("timeline is empty", segments.isEmpty());
        assertEquals("timeline must start at 0", 0, segments.get(0).getStart());

        for (int k = 0; k + 1 < segments.size(); k++) {
            Segment a = segments.get(k);
            Segment b = segments.get(k + 1);
            assertEquals("gap or overlap between " + a + " and " + b, a.getEnd(), b.getStart());
            assertNotEquals("adjacent segments share owner: " + a + " " + b, a.getOwner(), b.getOwner());
        }

        int lastEnd = segments.get(segments.size() - 1).getEnd();
        int maxEnd = 0;
        for (int i = 0; i < table.size(); i++) {
            int pid = table.pid(i);
            int start = result.getStartTime(i);
            int end = result.getEndTime(i);
            assertTrue("P" + pid + " start before arrival", start >= table.arrival(i));
            assertTrue("P" + pid + " end - start < burst", end - start >= table.burst(i));
            maxEnd = Math.max(maxEnd, end);

            int executed = 0;
            int first = Integer.MAX_VALUE;
            int last = Integer.MIN_VALUE;
            for (Segment s : segments) {
                if (!s.isIdle() && s.getOwner() == pid) {
                    assertTrue("P" + pid + " runs before arrival", s.getStart() >= table.arrival(i));
                    executed += s.length();
                    first = Math.min(first, s.getStart());
                    last = Math.max(last, s.getEnd());
                }
            }
            assertEquals("P" + pid + " executed time", table.burst(i), executed);
            assertEquals("P" + pid + " first segment", start, first);
            assertEquals("P" + pid + " last segment", end, last);
        }
        assertEquals("timeline ends at last completion", maxEnd, lastEnd);
    }
}
