package com.csd.formulary.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

@Data
@Builder
public class MaterializedPackage {
    private String name;
    private String version;
    private String resolved;
    private Path path;
    private boolean local;
    private ExtractedPackage contents; // filled once extracted
}
