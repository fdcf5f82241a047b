package com.healthrevo.decision.risk;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RiskModel {
    RiskType riskType;
    @Singular
    List<DriverRule> drivers;
    /** Checked in order; every entry the score exceeds applies. */
    @Singular
    List<Recommendation> recommendations;
}
