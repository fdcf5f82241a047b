package com.healthrevo.decision.prescription;

import lombok.Builder;
import lombok.Value;

/**
 * Single doses at or above {@code reviewAtMg} of the given drug are flagged for review.
 */
@Value
@Builder
public class DoseLimit {
    String drugId;
    double reviewAtMg;
}
