package com.cpusimulator.scheduling;

/**
 * SchedulerInvariantException
 *
 * Violación de un invariante interno de un algoritmo (por ejemplo, conjunto de
 * listos vacío con procesos incompletos y sin llegadas pendientes). Nunca debe
 * ocurrir con una entrada válida; indica un defecto de lógica y es fatal.
 */
public class SchedulerInvariantException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public SchedulerInvariantException(String message) {
        super(message);
    }

    public SchedulerInvariantException(String message, Throwable cause) {
        super(message, cause);
    }
}
