package com.healthrevo.pipeline.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VocabularyImportRequest {
    @Schema(allowableValues = {"REPLACE", "MERGE"}, example = "MERGE")
    private String mode;

    @Schema(description = "CSV with header id,name,aliases,mechanisms; list cells separated by ';'")
    private String drugsCsv;

    @Schema(description = "CSV with header drug_a,drug_b,severity,description,mechanism,management")
    private String interactionsCsv;
}
