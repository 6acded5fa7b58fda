package com.csd.formulary.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of a package archive.
 */
@Data
@Builder
public class ExtractedPackage {
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
    @Builder.Default
    private Lockfile lockfile = Lockfile.empty();
    @Builder.Default
    private Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
    private String integrity;

    public String getName() {
        Object name = metadata.get("name");
        return name == null ? null : name.toString();
    }

    public String getVersion() {
        Object version = metadata.get("version");
        return version == null ? null : version.toString();
    }

    public List<String> getDependencies() {
        Object deps = metadata.get("dependencies");
        List<String> result = new ArrayList<>();
        if (deps instanceof List<?> list) {
            for (Object d : list) {
                if (d != null && !d.toString().isBlank()) result.add(d.toString().trim());
            }
        }
        return result;
    }
}
