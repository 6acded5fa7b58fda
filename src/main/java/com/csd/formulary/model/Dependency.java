package com.csd.formulary.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Dependency {
    private static final Pattern REQUIREMENT = Pattern.compile("^([A-Za-z0-9_\\-]+)(.*)$", Pattern.DOTALL);
    public static final String FILE_MARKER = "@file:";

    private String name;
    @Builder.Default
    private String specifier = ""; // empty matches any version
    private String localPath;      // only set for name@file:<path>

    /**
     * Parses a requirement string such as {@code pkg-a>=1.0.0,<2.0.0} or {@code pkg@file:/abs/pkg.gspkg}.
     * The leading {@code [A-Za-z0-9_-]+} run is the name, the trimmed remainder the specifier.
     */
    public static Dependency parse(String requirement) {
        String trimmed = requirement == null ? "" : requirement.trim();
        int marker = trimmed.indexOf(FILE_MARKER);
        if (marker > 0) {
            return Dependency.builder()
                    .name(trimmed.substring(0, marker))
                    .localPath(trimmed.substring(marker + FILE_MARKER.length()))
                    .build();
        }
        Matcher m = REQUIREMENT.matcher(trimmed);
        if (m.matches()) {
            return Dependency.builder().name(m.group(1)).specifier(m.group(2).trim()).build();
        }
        return Dependency.builder().name(trimmed).build();
    }

    public static Dependency local(String name, String path) {
        return Dependency.builder().name(name).localPath(path).build();
    }

    @JsonIgnore
    public boolean isLocal() {
        return localPath != null;
    }

    /** Inverse of {@link #parse(String)}. */
    public String toRequirement() {
        if (isLocal()) return name + FILE_MARKER + localPath;
        return specifier == null ? name : name + specifier;
    }

    @Override
    public String toString() {
        return toRequirement();
    }
}
