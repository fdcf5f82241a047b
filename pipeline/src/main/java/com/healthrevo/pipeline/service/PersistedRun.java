package com.healthrevo.pipeline.service;

import com.healthrevo.pipeline.dto.AlertOutcome;
import com.healthrevo.pipeline.model.RiskScore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PersistedRun {
    /** Current score per risk type after the run, whether or not a row was appended. */
    @Singular
    List<RiskScore> riskScores;
    int appendedScores;
    @Singular
    List<AlertOutcome> alerts;
}
