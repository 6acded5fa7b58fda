package com.csd.formulary.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResolutionResult {
    private final boolean resolved;
    private final List<Package> packages;
    private final List<Dependency> unsatisfied;

    public static ResolutionResult success(List<Package> packages) {
        return new ResolutionResult(true, List.copyOf(packages), List.of());
    }

    public static ResolutionResult failure(List<Dependency> unsatisfied) {
        return new ResolutionResult(false, List.of(), List.copyOf(unsatisfied));
    }
}
