package com.healthrevo.decision.risk;

public enum RiskLevel {
    LOW,
    MODERATE,
    HIGH,
    CRITICAL
}
