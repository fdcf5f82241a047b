package com.healthrevo.decision.interaction;

import com.healthrevo.decision.model.InteractionSeverity;
import lombok.Builder;
import lombok.Value;

/**
 * Clinician-authored severity for drugs that share a mechanism, e.g. several QT-prolonging
 * agents prescribed together.
 */
@Value
@Builder
public class CumulativeRule {
    String mechanism;
    InteractionSeverity severity;
    String note;
}
