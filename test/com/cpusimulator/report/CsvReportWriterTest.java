package com.cpusimulator.report;

import static com.cpusimulator.Fixtures.processes;
import static org.junit.Assert.assertEquals;

import com.cpusimulator.simulator.EventLogger;
import com.cpusimulator.simulator.ScheduleResult;
import com.cpusimulator.simulator.SchedulingSimulator;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.Test;

public class CsvReportWriterTest {

    @Test
    public void testOneRowPerProcessPerAlgorithm() throws Exception {
        List<ScheduleResult> results = new SchedulingSimulator(
                processes(new int[] {1, 0, 5}, new int[] {2, 1, 1}), 2, new EventLogger(), false).runAll();
        StringWriter out = new StringWriter();

        CsvReportWriter.write(results, out);

        String[] lines = out.toString().split("\n");
        assertEquals(9, lines.length);
        assertEquals(CsvReportWriter.HEADER, lines[0]);
        assertEquals("FCFS,1,0,5,0,5,0,0,5", lines[1]);
        assertEquals("FCFS,2,1,1,5,6,4,4,5", lines[2]);
        assertEquals("SRTF,1,0,5,0,6,0,1,6", lines[5]);
        assertEquals("SRTF,2,1,1,1,2,0,0,1", lines[6]);
        assertEquals("RR,2,1,1,2,3,1,1,2", lines[8]);
    }

    @Test
    public void testWritesFile() throws Exception {
        Path tmp = Files.createTempFile("results", ".csv");
        try {
            List<ScheduleResult> results = new SchedulingSimulator(
                    processes(new int[] {1, 5, 3}), 1, new EventLogger(), false).runAll();
            CsvReportWriter.writeToFile(results, tmp.toString());

            List<String> lines = Files.readAllLines(tmp);
            assertEquals(5, lines.size());
            assertEquals("RR,1,5,3,5,8,0,0,3", lines.get(4));
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
