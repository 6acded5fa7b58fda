package com.csd.formulary.exception;

public class ArchiveCorruptException extends FormularyException {
    public ArchiveCorruptException(String message) {
        super(message);
    }

    public ArchiveCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
