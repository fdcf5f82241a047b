package com.healthrevo.decision.prescription;

public enum FindingSeverity {
    LOW,
    MEDIUM,
    HIGH
}
