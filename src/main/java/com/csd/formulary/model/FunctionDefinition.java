package com.csd.formulary.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FunctionDefinition {
    private String name;
    private String definition; // formula text
    private String description;
    @Builder.Default
    private List<String> arguments = new ArrayList<>();
    @Builder.Default
    private Map<String, ArgumentMetadata> argumentMetadata = new LinkedHashMap<>();
}
