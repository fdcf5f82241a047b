package com.healthrevo.pipeline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VocabularyImportResult {
    private String mode;
    private int importedDrugs;
    private int importedInteractions;
    private int skippedRows;
    private int drugCount;
    private int interactionCount;
    private long version;
}
