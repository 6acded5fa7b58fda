package com.csd.formulary.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PackageInfo {
    private String name;
    private String version;
    private String description;
    private String author;
    private String license;
    private String homepage;
    private List<String> dependencies;
    private String latest;             // only when no version was requested
    private List<String> otherVersions; // newest first, at most five
}
