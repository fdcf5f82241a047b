package com.healthrevo.decision.anomaly;

import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.AlertState;
import lombok.Value;

@Value
public class AlertTransition {
    TransitionKind kind;
    AlertCandidate candidate;
    /** The open alert being re-affirmed or upgraded; {@code null} for {@link TransitionKind#OPEN}. */
    AlertState existing;

    public AlertSeverity resultingSeverity() {
        return kind == TransitionKind.REAFFIRM ? existing.getSeverity() : candidate.getSeverity();
    }
}
