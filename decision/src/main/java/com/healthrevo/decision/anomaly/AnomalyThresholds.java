package com.healthrevo.decision.anomaly;

import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.VitalMetric;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Relative (trend) and absolute limits applied to each new vitals sample.
 */
@Value
@Builder
public class AnomalyThresholds {
    /** Fractional deviation from the trailing mean that counts as a trend anomaly. */
    @Builder.Default
    double relativeDeviation = 0.20;
    /** Historical values of a metric needed before the trend rule applies. */
    @Builder.Default
    int minimumHistory = 3;
    @Builder.Default
    AlertSeverity relativeSeverity = AlertSeverity.MILD;
    @Builder.Default
    Duration trendWindow = Duration.ofDays(7);
    @Singular
    List<AbsoluteThreshold> absoluteThresholds;

    public static AnomalyThresholds defaults() {
        return AnomalyThresholds.builder()
            .absoluteThreshold(limit(VitalMetric.SYSTOLIC, Bound.ABOVE, 180, AlertSeverity.URGENT,
                "Hypertensive Crisis", "Seek immediate medical attention"))
            .absoluteThreshold(limit(VitalMetric.DIASTOLIC, Bound.ABOVE, 120, AlertSeverity.URGENT,
                "Diastolic Hypertensive Crisis", "Seek immediate medical attention"))
            .absoluteThreshold(limit(VitalMetric.HEART_RATE, Bound.ABOVE, 120, AlertSeverity.SERIOUS,
                "Tachycardia Detected", "Monitor closely and consult healthcare provider"))
            .absoluteThreshold(limit(VitalMetric.HEART_RATE, Bound.BELOW, 50, AlertSeverity.SERIOUS,
                "Bradycardia Detected", "Monitor closely and consult healthcare provider"))
            .absoluteThreshold(limit(VitalMetric.OXYGEN_SATURATION, Bound.BELOW, 92, AlertSeverity.SERIOUS,
                "Reduced Oxygen Saturation", "Evaluate respiratory status"))
            .absoluteThreshold(limit(VitalMetric.OXYGEN_SATURATION, Bound.BELOW, 88, AlertSeverity.CRITICAL,
                "Low Oxygen Saturation", "Seek immediate medical attention"))
            .absoluteThreshold(limit(VitalMetric.BLOOD_GLUCOSE, Bound.ABOVE, 300, AlertSeverity.URGENT,
                "Severe Hyperglycemia", "Seek immediate medical attention"))
            .absoluteThreshold(limit(VitalMetric.BLOOD_GLUCOSE, Bound.BELOW, 70, AlertSeverity.URGENT,
                "Hypoglycemia", "Consume fast-acting carbohydrates and monitor"))
            .absoluteThreshold(limit(VitalMetric.TEMPERATURE, Bound.ABOVE, 39.0, AlertSeverity.SERIOUS,
                "High Fever", "Monitor temperature and consider medical consultation"))
            .absoluteThreshold(limit(VitalMetric.TEMPERATURE, Bound.BELOW, 35.0, AlertSeverity.SERIOUS,
                "Hypothermia Risk", "Seek warming measures and medical attention"))
            .build();
    }

    private static AbsoluteThreshold limit(VitalMetric metric, Bound bound, double limit, AlertSeverity severity,
                                           String title, String recommendation) {
        return AbsoluteThreshold.builder()
            .metric(metric)
            .bound(bound)
            .limit(limit)
            .severity(severity)
            .title(title)
            .recommendation(recommendation)
            .build();
    }
}
