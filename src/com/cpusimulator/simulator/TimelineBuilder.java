package com.cpusimulator.simulator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * TimelineBuilder
 *
 * Acumula la línea de tiempo de una simulación como segmentos contiguos.
 * Mantiene un único segmento abierto (propietario, inicio); su fin queda
 * implícito hasta que cambia el propietario o se llama a {@link #finish(int)}.
 *
 * Garantías sobre la lista resultante:
 * - segmentos contiguos y sin solapes, ordenados por inicio;
 * - ningún segmento de longitud cero;
 * - nunca dos segmentos adyacentes con el mismo propietario.
 */
public class TimelineBuilder {
    private final List<Segment> segments = new ArrayList<>();
    private Integer openOwner;
    private int openStart;
    private boolean finished = false;

    /**
     * Construye el builder con un segmento IDLE abierto en {@code startTime}.
     *
     * @param startTime instante inicial de la simulación
     */
    public TimelineBuilder(int startTime) {
        this.openOwner = null;
        this.openStart = startTime;
    }

    /**
     * Cambia el propietario de la CPU en {@code clock}. Si el propietario es el
     * mismo que el del segmento abierto no hace nada.
     *
     * @param owner pid o {@code null} para IDLE
     * @param clock instante del cambio
     */
    public void switchTo(Integer owner, int clock) {
        checkOpen();
        if (Objects.equals(owner, openOwner)) {
            return;
        }
        if (clock < openStart) {
            throw new IllegalArgumentException("clock " + clock + " precedes open segment start " + openStart);
        }
        closeOpen(clock);

        // el segmento abierto tenía longitud cero: se reabre el anterior si es del mismo dueño
        if (!segments.isEmpty()) {
            Segment last = segments.get(segments.size() - 1);
            if (last.getEnd() == clock && Objects.equals(last.getOwner(), owner)) {
                segments.remove(segments.size() - 1);
                openOwner = owner;
                openStart = last.getStart();
                return;
            }
        }
        openOwner = owner;
        openStart = clock;
    }

    /**
     * Marca la CPU como ociosa a partir de {@code clock}.
     *
     * @param clock instante del cambio
     */
    public void switchToIdle(int clock) {
        switchTo(null, clock);
    }

    /**
     * Cierra el segmento abierto en {@code clock} y devuelve la línea de tiempo.
     *
     * @param clock instante final de la simulación
     * @return lista inmutable de segmentos
     */
    public List<Segment> finish(int clock) {
        checkOpen();
        if (clock < openStart) {
            throw new IllegalArgumentException("clock " + clock + " precedes open segment start " + openStart);
        }
        closeOpen(clock);
        finished = true;
        return Collections.unmodifiableList(new ArrayList<>(segments));
    }

    private void closeOpen(int clock) {
        if (clock > openStart) {
            segments.add(new Segment(openOwner, openStart, clock));
        }
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("timeline already finished");
        }
    }
}
