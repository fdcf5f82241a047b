package com.healthrevo.decision.risk;

import com.healthrevo.decision.model.VitalMetric;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Risk models and scoring bands. {@link #defaults()} reproduces the heuristic weights used
 * in production since the first release ({@code heuristic-v1}).
 */
@Value
@Builder
public class RiskScoringConfig {
    @Builder.Default
    String method = "heuristic-v1";
    @Builder.Default
    Duration window = Duration.ofDays(7);
    @Builder.Default
    double moderateAt = 20;
    @Builder.Default
    double highAt = 50;
    @Builder.Default
    double criticalAt = 80;
    @Builder.Default
    int confidencePerSample = 20;
    @Singular
    List<RiskModel> models;

    public Optional<RiskModel> modelFor(RiskType riskType) {
        return models.stream().filter(model -> model.getRiskType() == riskType).findFirst();
    }

    public RiskLevel levelOf(double score) {
        if (score >= criticalAt) {
            return RiskLevel.CRITICAL;
        }
        if (score >= highAt) {
            return RiskLevel.HIGH;
        }
        if (score >= moderateAt) {
            return RiskLevel.MODERATE;
        }
        return RiskLevel.LOW;
    }

    public static RiskScoringConfig defaults() {
        return RiskScoringConfig.builder()
            .model(RiskModel.builder()
                .riskType(RiskType.HYPERTENSION)
                .driver(rule("avg_systolic", VitalMetric.SYSTOLIC, Aggregation.MEAN, 120, 1.2, Direction.ABOVE))
                .driver(rule("avg_diastolic", VitalMetric.DIASTOLIC, Aggregation.MEAN, 80, 1.5, Direction.ABOVE))
                .recommendation(advice(50, "Monitor blood pressure daily"))
                .recommendation(advice(50, "Reduce sodium intake"))
                .recommendation(advice(50, "Increase physical activity"))
                .recommendation(advice(75, "Consult healthcare provider immediately"))
                .recommendation(advice(75, "Consider medication review"))
                .build())
            .model(RiskModel.builder()
                .riskType(RiskType.DIABETES)
                .driver(rule("avg_glucose", VitalMetric.BLOOD_GLUCOSE, Aggregation.MEAN, 100, 1.5, Direction.ABOVE))
                .driver(rule("max_glucose", VitalMetric.BLOOD_GLUCOSE, Aggregation.MAX, 200, 1.0, Direction.ABOVE))
                .recommendation(advice(30, "Monitor blood glucose regularly"))
                .recommendation(advice(30, "Follow diabetic diet guidelines"))
                .recommendation(advice(30, "Maintain regular exercise routine"))
                .recommendation(advice(70, "Urgent medical consultation required"))
                .recommendation(advice(70, "Review medication adherence"))
                .build())
            .model(RiskModel.builder()
                .riskType(RiskType.HEART_DISEASE)
                .driver(rule("avg_heart_rate", VitalMetric.HEART_RATE, Aggregation.MEAN, 80, 1.0, Direction.ABOVE))
                .driver(rule("avg_systolic", VitalMetric.SYSTOLIC, Aggregation.MEAN, 130, 0.8, Direction.ABOVE))
                .driver(rule("avg_oxygen_saturation", VitalMetric.OXYGEN_SATURATION, Aggregation.MEAN, 95, 5.0, Direction.BELOW))
                .build())
            .build();
    }

    private static Recommendation advice(double above, String text) {
        return Recommendation.builder().above(above).text(text).build();
    }

    private static DriverRule rule(String name, VitalMetric metric, Aggregation aggregation,
                                   double baseline, double coefficient, Direction direction) {
        return DriverRule.builder()
            .name(name)
            .metric(metric)
            .aggregation(aggregation)
            .baseline(baseline)
            .coefficient(coefficient)
            .direction(direction)
            .build();
    }
}
