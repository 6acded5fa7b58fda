package com.csd.formulary.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArgumentMetadata {
    public static final String NO_DESCRIPTION = "No description provided.";
    public static final String NO_EXAMPLE = "No example provided.";

    @Builder.Default
    private String description = NO_DESCRIPTION;
    @Builder.Default
    private String example = NO_EXAMPLE;
}
