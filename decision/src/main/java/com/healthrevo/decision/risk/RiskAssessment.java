package com.healthrevo.decision.risk;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class RiskAssessment {
    RiskType riskType;
    /** 0..100, two decimals. */
    double score;
    RiskLevel level;
    /** Driver name to aggregated observed value, one decimal, sorted by name. */
    Map<String, Double> drivers;
    int sampleCount;
    boolean insufficientData;
    /** 0..100, grows with the number of samples in the window. */
    int confidence;
    String method;
    List<String> recommendations;
}
