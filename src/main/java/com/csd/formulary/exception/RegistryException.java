package com.csd.formulary.exception;

/**
 * Transport or format failure talking to the registry.
 */
public class RegistryException extends FormularyException {
    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
