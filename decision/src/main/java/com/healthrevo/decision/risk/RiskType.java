package com.healthrevo.decision.risk;

import java.util.Locale;

public enum RiskType {
    HYPERTENSION("Hypertension"),
    DIABETES("Diabetes"),
    HEART_DISEASE("Heart Disease");

    private final String label;

    RiskType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static RiskType fromLabel(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
    }
}
