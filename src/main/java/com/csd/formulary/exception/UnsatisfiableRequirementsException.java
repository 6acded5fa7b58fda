package com.csd.formulary.exception;

import com.csd.formulary.model.Dependency;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when no assignment of versions satisfies the requirements.
 */
public class UnsatisfiableRequirementsException extends FormularyException {
    private final List<Dependency> requirements;

    public UnsatisfiableRequirementsException(List<Dependency> requirements) {
        super("Could not find a version that satisfies the requirements: " + requirements.stream()
                .map(d -> d.getName() + " (" + d.getSpecifier() + ")")
                .collect(Collectors.joining(", ")));
        this.requirements = List.copyOf(requirements);
    }

    public List<Dependency> getRequirements() {
        return requirements;
    }
}
