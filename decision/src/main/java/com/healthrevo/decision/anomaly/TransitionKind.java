package com.healthrevo.decision.anomaly;

public enum TransitionKind {
    /** none to open: a new alert is created. */
    OPEN,
    /** open to open at the same or a lower severity: only the evaluation time moves. */
    REAFFIRM,
    /** open to open at a higher severity: severity and text are replaced, id and first detection kept. */
    UPGRADE
}
