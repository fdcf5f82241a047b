package com.healthrevo.decision.exception;

public class AlertAlreadyAcknowledgedException extends RuntimeException {

    private final String alertId;

    public AlertAlreadyAcknowledgedException(String alertId) {
        super("Alert " + alertId + " is already acknowledged");
        this.alertId = alertId;
    }

    public String getAlertId() {
        return alertId;
    }
}
