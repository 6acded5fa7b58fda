package com.csd.formulary.exception;

/**
 * Base class for failures raised by package operations.
 */
public class FormularyException extends RuntimeException {
    public FormularyException(String message) {
        super(message);
    }

    public FormularyException(String message, Throwable cause) {
        super(message, cause);
    }
}
