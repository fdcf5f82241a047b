package com.healthrevo.decision.interaction;

import com.healthrevo.decision.model.InteractionSeverity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class InteractionReport {
    @Singular
    List<String> checkedDrugIds;
    /** Ids that were not in the vocabulary snapshot; kept for traceability only. */
    @Singular
    List<String> excludedDrugIds;
    @Singular
    List<InteractionFinding> findings;
    @Singular
    List<CumulativeFinding> cumulativeFindings;
    /** Highest severity across findings and rule-backed cumulative findings, {@code null} if none. */
    InteractionSeverity overallSeverity;
    String recommendation;

    public boolean isEmpty() {
        return findings.isEmpty() && cumulativeFindings.isEmpty();
    }
}
