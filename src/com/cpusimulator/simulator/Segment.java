package com.cpusimulator.simulator;

import java.util.Objects;

/**
 * Segment
 *
 * Intervalo [start, end) de la línea de tiempo con un único propietario: un
 * pid o la CPU ociosa (propietario {@code null}).
 */
public final class Segment {
    private final Integer owner;
    private final int start;
    private final int end;

    /**
     * Construye un segmento inmutable.
     *
     * @param owner pid propietario o {@code null} para IDLE
     * @param start inicio (inclusive)
     * @param end   fin (exclusive), mayor que start
     */
    public Segment(Integer owner, int start, int end) {
        if (end <= start) {
            throw new IllegalArgumentException("segment end must be > start: [" + start + ", " + end + ")");
        }
        this.owner = owner;
        this.start = start;
        this.end = end;
    }

    public static Segment idle(int start, int end) {
        return new Segment(null, start, end);
    }

    public static Segment of(int pid, int start, int end) {
        return new Segment(pid, start, end);
    }

    /**
     * Devuelve el pid propietario.
     *
     * @return pid o {@code null} si el segmento es IDLE
     */
    public Integer getOwner() {
        return owner;
    }

    public boolean isIdle() {
        return owner == null;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    /**
     * Etiqueta para los diagramas: "P&lt;pid&gt;" o "IDLE".
     *
     * @return etiqueta legible
     */
    public String getLabel() {
        return owner == null ? "IDLE" : "P" + owner;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Segment)) {
            return false;
        }
        Segment other = (Segment) o;
        return start == other.start && end == other.end && Objects.equals(owner, other.owner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, start, end);
    }

    @Override
    public String toString() {
        return getLabel() + "[" + start + "," + end + ")";
    }
}
