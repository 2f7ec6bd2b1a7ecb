package com.cpusimulator.scheduling;

import com.cpusimulator.process.ProcessTable;

/**
 * ShortestJobSelector
 *
 * Selector de SJF: ordena por ráfaga total (estática), luego llegada y pid.
 */
public class ShortestJobSelector extends RankedReadySet {

    public ShortestJobSelector(ProcessTable table) {
        super(ProcessOrdering.byBurst(table));
    }
}
