package com.csd.formulary.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PackageLock {
    private String version;
    private String resolved;  // registry:<name>/<version> or file:<path>
    private String integrity; // sha256:<hex>, may be null
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();
    @Builder.Default
    private List<String> functions = new ArrayList<>(); // owned function names
}
