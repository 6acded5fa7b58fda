package com.csd.formulary.model;

import com.csd.formulary.resolution.VersionUtil;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A resolution candidate: one concrete version of a named package.
 * Ordering follows version precedence, so {@code 1.0} and {@code 1.0.0} sort as equal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Package implements Comparable<Package> {
    private String name;
    private String version;
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
    private String description;

    @JsonIgnore
    public List<Dependency> getParsedDependencies() {
        return dependencies.stream().map(Dependency::parse).collect(Collectors.toList());
    }

    @Override
    public int compareTo(Package other) {
        int byName = name.compareTo(other.name);
        if (byName != 0) return byName;
        return VersionUtil.compare(version, other.version);
    }

    @Override
    public String toString() {
        return name + "@" + version;
    }
}
