package com.cpusimulator.scheduling;

/**
 * ReadySet
 *
 * Conjunto de procesos listos, identificados por índice de la tabla. Cada
 * índice puede estar presente como máximo una vez.
 */
public interface ReadySet {
    /**
     * Inserta un índice recién admitido o reencolado.
     *
     * @param index índice de la tabla
     * @throws IllegalStateException si el índice ya está presente
     */
    void insert(int index);

    /**
     * Extrae el siguiente índice según la política del conjunto.
     *
     * @return índice extraído
     * @throws IllegalStateException si el conjunto está vacío
     */
    int extract();

    boolean isEmpty();
}
