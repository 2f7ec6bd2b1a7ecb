package com.cpusimulator.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class SimulationConfigTest {

    @Test
    public void testDefaults() {
        SimulationConfig config = SimulationConfig.fromArgs(new String[0]);

        assertNull(config.getInputFile());
        assertNull(config.getQuantum());
        assertNull(config.getCsvFile());
        assertFalse(config.isTrace());
        assertFalse(config.isVerbose());
        assertFalse(config.isParallel());
        assertFalse(config.isHelp());
    }

    @Test
    public void testAllOptions() {
        SimulationConfig config = SimulationConfig.fromArgs(new String[] {
            "--file", "procs.txt", "--quantum", "4", "--csv", "out.csv", "--trace", "--verbose", "--parallel"
        });

        assertEquals("procs.txt", config.getInputFile());
        assertEquals(Integer.valueOf(4), config.getQuantum());
        assertEquals("out.csv", config.getCsvFile());
        assertTrue(config.isTrace());
        assertTrue(config.isVerbose());
        assertTrue(config.isParallel());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownOptionIsRejected() {
        SimulationConfig.fromArgs(new String[] {"--fast"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingValueIsRejected() {
        SimulationConfig.fromArgs(new String[] {"--file", "--trace"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonNumericQuantumIsRejected() {
        SimulationConfig.fromArgs(new String[] {"--quantum", "two"});
    }

    @Test
    public void testQuantumIsNotRangeCheckedHere() {
        assertEquals(Integer.valueOf(-1), SimulationConfig.fromArgs(new String[] {"--quantum", "-1"}).getQuantum());
    }
}
