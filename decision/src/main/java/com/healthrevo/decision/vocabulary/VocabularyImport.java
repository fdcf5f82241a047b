package com.healthrevo.decision.vocabulary;

import com.healthrevo.decision.model.CanonicalDrug;
import com.healthrevo.decision.model.InteractionRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VocabularyImport {
    List<CanonicalDrug> drugs;
    List<InteractionRecord> interactions;
    int skippedRows;
}
