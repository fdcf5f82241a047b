package com.healthrevo.decision.anomaly;

public enum EvaluationStatus {
    EVALUATED,
    /** Historical values exist but fewer than the configured minimum. */
    INSUFFICIENT_HISTORY,
    /** The input needed for this part was unavailable. Never read as "no risk". */
    NOT_EVALUATED
}
