package com.healthrevo.decision.anomaly;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnomalyEvaluation {
    EvaluationStatus status;
    /** Status of the relative (trend) rule. Absolute limits are checked whenever a sample exists. */
    EvaluationStatus trendStatus;
    @Singular
    List<AlertCandidate> candidates;
    String reason;

    public static AnomalyEvaluation notEvaluated(String reason) {
        return AnomalyEvaluation.builder()
            .status(EvaluationStatus.NOT_EVALUATED)
            .trendStatus(EvaluationStatus.NOT_EVALUATED)
            .reason(reason)
            .build();
    }
}
