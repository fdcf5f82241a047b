package com.healthrevo.decision.risk;

import lombok.Builder;
import lombok.Value;

/**
 * Advice attached to a risk score strictly above {@code above}.
 */
@Value
@Builder
public class Recommendation {
    double above;
    String text;

    public boolean appliesTo(double score) {
        return score > above;
    }
}
