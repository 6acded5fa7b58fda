package com.csd.formulary.exception;

public class FunctionStoreException extends FormularyException {
    public FunctionStoreException(String message) {
        super(message);
    }

    public FunctionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
