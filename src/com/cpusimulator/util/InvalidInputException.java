package com.cpusimulator.util;

/**
 * InvalidInputException
 *
 * Entrada rechazada por la validación previa a la simulación.
 */
public class InvalidInputException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    /**
     * @param kind    clase de error
     * @param message detalle (proceso o valor afectado)
     */
    public InvalidInputException(ErrorKind kind, String message) {
        super(kind.getDisplayName() + ": " + message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
