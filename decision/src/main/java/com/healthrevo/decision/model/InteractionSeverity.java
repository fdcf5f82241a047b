package com.healthrevo.decision.model;

import java.util.Locale;

public enum InteractionSeverity {
    MINOR(AlertSeverity.MILD, "Minor interaction; no change usually needed, inform the patient."),
    MODERATE(AlertSeverity.SERIOUS, "Monitor the patient closely and consider dose adjustment or an alternative."),
    MAJOR(AlertSeverity.URGENT, "Avoid the combination unless benefits outweigh risks; review with the prescriber."),
    CONTRAINDICATED(AlertSeverity.CRITICAL, "Do not co-administer; contact the prescriber immediately.");

    private final AlertSeverity alertSeverity;
    private final String recommendation;

    InteractionSeverity(AlertSeverity alertSeverity, String recommendation) {
        this.alertSeverity = alertSeverity;
        this.recommendation = recommendation;
    }

    public AlertSeverity toAlertSeverity() {
        return alertSeverity;
    }

    public String recommendation() {
        return recommendation;
    }

    public boolean isAtLeast(InteractionSeverity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Lenient parse used for imported datasets. Unknown or empty labels fall back to
     * {@link #MODERATE}.
     */
    public static InteractionSeverity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MODERATE;
        }
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "minor":
            case "low":
                return MINOR;
            case "moderate":
            case "medium":
                return MODERATE;
            case "major":
            case "high":
                return MAJOR;
            case "contraindicated":
            case "contra-indicated":
            case "contra":
                return CONTRAINDICATED;
            default:
                return MODERATE;
        }
    }
}
