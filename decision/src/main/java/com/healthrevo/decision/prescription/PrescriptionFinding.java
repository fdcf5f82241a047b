package com.healthrevo.decision.prescription;

import lombok.Builder;
import lombok.Value;

/**
 * A flag stored on a prescription for reviewers. Findings are informational; alerts are raised
 * separately by the interaction alert policy.
 */
@Value
@Builder
public class PrescriptionFinding {
    FindingSeverity severity;
    FindingType type;
    String message;
}
