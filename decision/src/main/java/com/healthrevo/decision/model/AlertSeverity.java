package com.healthrevo.decision.model;

import java.util.Locale;

/**
 * Ordered alert urgency; declaration order is the severity order.
 */
public enum AlertSeverity {
    MILD,
    SERIOUS,
    URGENT,
    CRITICAL;

    public boolean isHigherThan(AlertSeverity other) {
        return compareTo(other) > 0;
    }

    public static AlertSeverity max(AlertSeverity a, AlertSeverity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static AlertSeverity fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
