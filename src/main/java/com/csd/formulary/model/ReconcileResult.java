package com.csd.formulary.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Target state computed by an install, upgrade or remove. Nothing has been written when this exists.
 */
@Data
@Builder
public class ReconcileResult {
    private ProjectMetadata metadata;
    private Lockfile lockfile;
    @Builder.Default
    private Map<String, FunctionDefinition> functions = new LinkedHashMap<>(); // final package-owned set
    @Builder.Default
    private List<String> functionsToDelete = new ArrayList<>();
    @Builder.Default
    private Map<String, VersionChange> upgrades = new LinkedHashMap<>();
    private boolean noop;
}
