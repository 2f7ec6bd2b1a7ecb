package com.cpusimulator.scheduling;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

/**
 * ReadyQueue
 *
 * Cola FIFO de listos usada por Round Robin. Crece dinámicamente; la única
 * restricción es una entrada como máximo por proceso no terminado.
 */
public class ReadyQueue implements ReadySet {
    private final Deque<Integer> queue = new ArrayDeque<>();
    private final BitSet members = new BitSet();

    @Override
    public void insert(int index) {
        if (members.get(index)) {
            throw new IllegalStateException("index " + index + " already queued");
        }
        members.set(index);
        queue.addLast(index);
    }

    @Override
    public int extract() {
        if (queue.isEmpty()) {
            throw new IllegalStateException("ready queue is empty");
        }
        int index = queue.removeFirst();
        members.clear(index);
        return index;
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
