package com.healthrevo.decision.anomaly;

import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.VitalMetric;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AbsoluteThreshold {
    VitalMetric metric;
    Bound bound;
    double limit;
    AlertSeverity severity;
    String title;
    String recommendation;

    public boolean isCrossedBy(double value) {
        return bound.isCrossedBy(value, limit);
    }
}
