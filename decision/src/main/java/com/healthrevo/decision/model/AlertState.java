package com.healthrevo.decision.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * The lifecycle-relevant view of a stored alert.
 */
@Value
@Builder
public class AlertState {
    String alertId;
    String patientId;
    AlertType type;
    String rootCauseKey;
    AlertSeverity severity;
    LocalDateTime generatedAt;
    boolean acknowledged;
}
