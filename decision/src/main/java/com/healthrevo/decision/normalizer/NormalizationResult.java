package com.healthrevo.decision.normalizer;

import com.healthrevo.decision.model.MedicationMention;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of normalizing one mention. For {@link MatchStatus#UNMATCHED} results the drug fields
 * describe the best candidate found (if any) so a reviewer can confirm or reject it.
 */
@Value
@Builder
public class NormalizationResult {
    MedicationMention mention;
    String cleanedName;
    MatchStatus status;
    String drugId;
    String drugName;
    String matchedTerm;
    double confidence;

    public boolean isMatched() {
        return status == MatchStatus.MATCHED;
    }

    public boolean hasCandidate() {
        return drugId != null;
    }
}
