package com.csd.formulary.exception;

public class PackageNotFoundException extends FormularyException {
    private final String packageName;

    public PackageNotFoundException(String packageName) {
        super("Package '" + packageName + "' not found");
        this.packageName = packageName;
    }

    public String getPackageName() {
        return packageName;
    }
}
