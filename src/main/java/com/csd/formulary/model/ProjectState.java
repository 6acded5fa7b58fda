package com.csd.formulary.model;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a project taken before an operation: manifest, previous lockfile
 * and the functions currently present in the store (reserved entries excluded).
 */
@Data
@Builder
public class ProjectState {
    private ProjectMetadata metadata;
    @Builder.Default
    private Lockfile lockfile = Lockfile.empty();
    @Builder.Default
    private Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
}
