package com.csd.formulary.exception;

/**
 * A local dependency points at an archive that does not exist.
 */
public class LocalPackageMissingException extends FormularyException {
    private final String path;

    public LocalPackageMissingException(String path) {
        super("Local package not found: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
