package com.cpusimulator.scheduling;

import java.util.BitSet;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * RankedReadySet
 *
 * Base de los selectores por rango: un min-heap binario de índices
 * ({@link PriorityQueue}) con inserción y extracción O(log k). El comparador lo
 * aporta cada subclase. Las claves no se modifican dentro del heap: para
 * cambiar la clave de un índice se extrae, se actualiza y se reinserta.
 */
public abstract class RankedReadySet implements ReadySet {
    private final PriorityQueue<Integer> heap;
    private final BitSet members = new BitSet();

    /**
     * @param ranking orden total sobre índices
     */
    protected RankedReadySet(Comparator<Integer> ranking) {
        this.heap = new PriorityQueue<>(ranking);
    }

    @Override
    public void insert(int index) {
        if (members.get(index)) {
            throw new IllegalStateException("index " + index + " already in ready set");
        }
        members.set(index);
        heap.add(index);
    }

    /**
     * Extrae el índice mejor clasificado.
     *
     * @return índice con menor rango
     */
    public int extractMin() {
        Integer index = heap.poll();
        if (index == null) {
            throw new IllegalStateException("ready set is empty");
        }
        members.clear(index);
        return index;
    }

    /**
     * Observa el índice mejor clasificado sin extraerlo.
     *
     * @return índice con menor rango
     */
    public int peekMin() {
        Integer index = heap.peek();
        if (index == null) {
            throw new IllegalStateException("ready set is empty");
        }
        return index;
    }

    @Override
    public int extract() {
        return extractMin();
    }

    @Override
    public boolean isEmpty() {
        return heap.isEmpty();
    }

    boolean contains(int index) {
        return members.get(index);
    }
}
