package com.healthrevo.decision.anomaly;

import com.healthrevo.decision.exception.AlertAlreadyAcknowledgedException;
import com.healthrevo.decision.exception.InvariantViolationException;
import com.healthrevo.decision.model.AlertState;

import java.util.Objects;
import java.util.Optional;

/**
 * Alert lifecycle per (patient, type, root cause): none, open, acknowledged. Acknowledged is
 * terminal; a later qualifying condition opens a new alert.
 */
public class AlertStateMachine {

    public AlertTransition decide(AlertCandidate candidate, Optional<AlertState> open) {
        if (open.isEmpty()) {
            return new AlertTransition(TransitionKind.OPEN, candidate, null);
        }
        AlertState existing = open.get();
        if (existing.isAcknowledged()) {
            throw new InvariantViolationException("Alert " + existing.getAlertId()
                + " is acknowledged but was returned as the open alert for " + candidate.getRootCauseKey());
        }
        if (existing.getType() != candidate.getType()
            || !Objects.equals(existing.getRootCauseKey(), candidate.getRootCauseKey())) {
            throw new InvariantViolationException("Open alert " + existing.getAlertId() + " (" + existing.getType()
                + ", " + existing.getRootCauseKey() + ") does not match candidate (" + candidate.getType()
                + ", " + candidate.getRootCauseKey() + ")");
        }
        if (candidate.getSeverity().isHigherThan(existing.getSeverity())) {
            return new AlertTransition(TransitionKind.UPGRADE, candidate, existing);
        }
        return new AlertTransition(TransitionKind.REAFFIRM, candidate, existing);
    }

    public AlertState acknowledge(AlertState state, String reviewerId) {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new IllegalArgumentException("Reviewer id is required");
        }
        if (state.isAcknowledged()) {
            throw new AlertAlreadyAcknowledgedException(state.getAlertId());
        }
        return AlertState.builder()
            .alertId(state.getAlertId())
            .patientId(state.getPatientId())
            .type(state.getType())
            .rootCauseKey(state.getRootCauseKey())
            .severity(state.getSeverity())
            .generatedAt(state.getGeneratedAt())
            .acknowledged(true)
            .build();
    }
}
