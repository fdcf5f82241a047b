package com.healthrevo.decision.interaction;

import com.healthrevo.decision.model.InteractionSeverity;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Three or more drugs of one medication list share a mechanism tag. Without a configured
 * {@link CumulativeRule} the finding only asks for review and carries no severity.
 */
@Value
@Builder
public class CumulativeFinding {
    String mechanism;
    List<String> drugIds;
    InteractionSeverity ruleSeverity;
    String note;

    public boolean isReviewRequired() {
        return ruleSeverity == null;
    }
}
