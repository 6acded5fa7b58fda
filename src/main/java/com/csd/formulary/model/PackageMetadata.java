package com.csd.formulary.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Per-version registry entry. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackageMetadata {
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
    private String description;
    private String path; // relative to the registry root
}
