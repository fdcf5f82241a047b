package com.healthrevo.decision.risk;

import com.healthrevo.decision.model.VitalMetric;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DriverRule {
    String name;
    VitalMetric metric;
    @Builder.Default
    Aggregation aggregation = Aggregation.MEAN;
    double baseline;
    double coefficient;
    @Builder.Default
    Direction direction = Direction.ABOVE;

    public double contribution(double observed) {
        return Math.max(0, direction.deviation(observed, baseline) * coefficient);
    }
}
