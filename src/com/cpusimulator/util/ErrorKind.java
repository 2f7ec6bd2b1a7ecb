package com.cpusimulator.util;

/**
 * ErrorKind
 *
 * Clases de error de validación de la entrada. Cualquiera de ellas aborta la
 * ejecución completa antes de simular ningún algoritmo.
 */
public enum ErrorKind {
    INVALID_PROCESS_COUNT("Number of processes must be positive"),
    INVALID_ARRIVAL("Arrival must be >= 0"),
    INVALID_BURST("Burst must be > 0"),
    INVALID_QUANTUM("Quantum must be > 0"),
    DUPLICATE_PID("PID must be unique"),
    CLOCK_OVERFLOW("Last completion time must fit in an int");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Devuelve la descripción legible del error.
     *
     * @return descripción
     */
    public String getDisplayName() {
        return displayName;
    }
}
