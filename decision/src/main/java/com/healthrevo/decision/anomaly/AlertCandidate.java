package com.healthrevo.decision.anomaly;

import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.AlertType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A condition that qualifies for an alert. The lifecycle decides whether it opens a new alert or
 * re-affirms an open one.
 */
@Value
@Builder
public class AlertCandidate {
    AlertType type;
    String rootCauseKey;
    AlertSeverity severity;
    String title;
    String message;
    String recommendation;
    Map<String, Object> metadata;
}
