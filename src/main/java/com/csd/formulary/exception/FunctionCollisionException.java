package com.csd.formulary.exception;

import com.csd.formulary.model.CollisionReport;

import java.util.List;

/**
 * Thrown when installed packages would introduce function names owned by someone else.
 * Recoverable: retry with an alias for every name in {@link #getReport()}.
 */
public class FunctionCollisionException extends FormularyException {
    private final CollisionReport report;

    public FunctionCollisionException(CollisionReport report) {
        super("Package '" + report.firstPackage() + "' has conflicting functions: "
                + String.join(", ", report.conflictsFor(report.firstPackage())));
        this.report = report;
    }

    public String getPackageName() {
        return report.firstPackage();
    }

    public List<String> getConflicts() {
        return report.conflictsFor(report.firstPackage());
    }

    public CollisionReport getReport() {
        return report;
    }
}
