package com.cpusimulator.util;

import java.io.IOException;

/**
 * ParseException
 *
 * Error de formato al leer la definición de procesos.
 */
public class ParseException extends IOException {
    private static final long serialVersionUID = 1L;

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
