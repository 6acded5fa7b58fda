package com.csd.formulary.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Project manifest kept in the reserved {@code __GSPROJECT__} function.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProjectMetadata {
    private String name;
    private String version;
    @Builder.Default
    private String description = "";
    @Builder.Default
    private List<String> dependencies = new ArrayList<>(); // requirement strings
    @Builder.Default
    private Map<String, String> extra = new LinkedHashMap<>();

    public static ProjectMetadata defaults() {
        return ProjectMetadata.builder().name("my-project").version("0.1.0").build();
    }

    public ProjectMetadata copy() {
        return toBuilder()
                .dependencies(new ArrayList<>(dependencies))
                .extra(new LinkedHashMap<>(extra))
                .build();
    }
}
