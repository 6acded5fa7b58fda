package com.csd.formulary.exception;

public class VersionNotFoundException extends FormularyException {
    private final String packageName;
    private final String version;

    public VersionNotFoundException(String packageName, String version) {
        super("Version " + version + " not found for package " + packageName);
        this.packageName = packageName;
        this.version = version;
    }

    public String getPackageName() {
        return packageName;
    }

    public String getVersion() {
        return version;
    }
}
