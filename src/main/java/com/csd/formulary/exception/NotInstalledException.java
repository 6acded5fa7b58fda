package com.csd.formulary.exception;

public class NotInstalledException extends FormularyException {
    private final String packageName;

    public NotInstalledException(String packageName) {
        super("Package '" + packageName + "' is not installed");
        this.packageName = packageName;
    }

    public String getPackageName() {
        return packageName;
    }
}
