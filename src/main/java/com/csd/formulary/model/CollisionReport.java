package com.csd.formulary.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conflicting function names grouped by the package that introduces them.
 */
@Getter
public class CollisionReport {
    private final Map<String, List<String>> conflicts = new LinkedHashMap<>();

    public void add(String packageName, String functionName) {
        List<String> names = conflicts.computeIfAbsent(packageName, k -> new ArrayList<>());
        if (!names.contains(functionName)) names.add(functionName);
    }

    public boolean isEmpty() {
        return conflicts.isEmpty();
    }

    public List<String> conflictsFor(String packageName) {
        return Collections.unmodifiableList(conflicts.getOrDefault(packageName, List.of()));
    }

    public String firstPackage() {
        return conflicts.isEmpty() ? null : conflicts.keySet().iterator().next();
    }
}
