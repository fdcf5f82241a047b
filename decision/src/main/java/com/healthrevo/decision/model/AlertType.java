package com.healthrevo.decision.model;

public enum AlertType {
    ANOMALY,
    DRUG_INTERACTION
}
