package com.healthrevo.decision.prescription;

public enum FindingType {
    INTERACTION,
    CUMULATIVE,
    DOSE,
    DUPLICATE,
    UNMATCHED
}
