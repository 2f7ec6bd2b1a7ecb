package com.cpusimulator.util;

import static com.cpusimulator.Fixtures.processes;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import com.cpusimulator.process.Proceso;
import java.util.List;
import org.junit.Test;

public class InputValidatorTest {

    private static ErrorKind failureOf(List<Proceso> input, int quantum) {
        try {
            InputValidator.validate(input, quantum);
        } catch (InvalidInputException e) {
            return e.getKind();
        }
        fail("Expected InvalidInputException");
        return null;
    }

    @Test
    public void testAcceptsValidInput() {
        InputValidator.validate(processes(new int[] {5, 0, 1}, new int[] {-2, 3, 4}), 1);
    }

    @Test
    public void testRejectsEmptyTable() {
        assertEquals(ErrorKind.INVALID_PROCESS_COUNT, failureOf(List.of(), 2));
    }

    @Test
    public void testRejectsNegativeArrival() {
        assertEquals(ErrorKind.INVALID_ARRIVAL, failureOf(processes(new int[] {1, -1, 2}), 2));
    }

    @Test
    public void testRejectsNonPositiveBurst() {
        assertEquals(ErrorKind.INVALID_BURST, failureOf(processes(new int[] {1, 0, 0}), 2));
        assertEquals(ErrorKind.INVALID_BURST, failureOf(processes(new int[] {1, 0, -3}), 2));
    }

    @Test
    public void testRejectsNonPositiveQuantum() {
        assertEquals(ErrorKind.INVALID_QUANTUM, failureOf(processes(new int[] {1, 0, 2}), 0));
    }

    @Test
    public void testRejectsDuplicatePid() {
        assertEquals(ErrorKind.DUPLICATE_PID, failureOf(processes(new int[] {1, 0, 2}, new int[] {1, 4, 2}), 2));
    }

    @Test
    public void testAcceptsLastCompletionAtIntMax() {
        InputValidator.validateProcesses(processes(new int[] {1, Integer.MAX_VALUE - 5, 5}));
        InputValidator.validateProcesses(processes(
                new int[] {1, 0, Integer.MAX_VALUE - 10},
                new int[] {2, 10, 10}));
        // P2 llega cuando la CPU aún está ocupada con P1
        InputValidator.validateProcesses(processes(
                new int[] {1, Integer.MAX_VALUE - 10, 8},
                new int[] {2, Integer.MAX_VALUE - 8, 2}));
    }

    @Test
    public void testRejectsLastCompletionPastIntMax() {
        assertEquals(ErrorKind.CLOCK_OVERFLOW,
                failureOf(processes(new int[] {1, Integer.MAX_VALUE - 5, 6}), 2));
        assertEquals(ErrorKind.CLOCK_OVERFLOW,
                failureOf(processes(new int[] {1, 2000000000, 2000000000}), 2));
    }

    @Test
    public void testBurstSumIsNotTruncated() {
        // la suma desborda un int pero no un long
        assertEquals(ErrorKind.CLOCK_OVERFLOW, failureOf(processes(
                new int[] {1, 0, Integer.MAX_VALUE},
                new int[] {2, 0, Integer.MAX_VALUE},
                new int[] {3, 0, 2}), 2));
    }

    @Test
    public void testOverflowMessageNamesCompletionTime() {
        try {
            InputValidator.validateProcesses(processes(new int[] {1, Integer.MAX_VALUE - 5, 6}));
            fail("Expected InvalidInputException");
        } catch (InvalidInputException e) {
            assertEquals("Last completion time must fit in an int: last completion at 2147483648 > 2147483647",
                    e.getMessage());
        }
    }

    @Test
    public void testMessageNamesProcess() {
        try {
            InputValidator.validateProcesses(processes(new int[] {9, -4, 2}));
            fail("Expected InvalidInputException");
        } catch (InvalidInputException e) {
            assertEquals("Arrival must be >= 0: P9 arrival=-4", e.getMessage());
        }
    }
}
