package com.healthrevo.decision.risk;

import com.healthrevo.decision.model.VitalsSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Scores a vitals window against the configured risk models. The result depends only on the
 * set of samples, not on their order.
 */
public class RiskScoringEngine {

    private static final Logger logger = LoggerFactory.getLogger(RiskScoringEngine.class);

    private static final Comparator<VitalsSample> SAMPLE_ORDER = Comparator
        .comparing(VitalsSample::getRecordedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(VitalsSample::getSampleId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final RiskScoringConfig config;

    public RiskScoringEngine(RiskScoringConfig config) {
        this.config = config;
    }

    public RiskScoringConfig getConfig() {
        return config;
    }

    public List<RiskAssessment> scoreAll(List<VitalsSample> window) {
        List<RiskAssessment> assessments = new ArrayList<>();
        for (RiskType riskType : RiskType.values()) {
            if (config.modelFor(riskType).isPresent()) {
                assessments.add(score(riskType, window));
            }
        }
        return assessments;
    }

    public RiskAssessment score(RiskType riskType, List<VitalsSample> window) {
        RiskModel model = config.modelFor(riskType)
            .orElseThrow(() -> new IllegalArgumentException("No risk model configured for " + riskType));

        List<VitalsSample> samples = new ArrayList<>(window);
        samples.sort(SAMPLE_ORDER);

        if (samples.isEmpty()) {
            logger.debug("No samples in window for {}, reporting insufficient data", riskType);
            return RiskAssessment.builder()
                .riskType(riskType)
                .score(0)
                .level(RiskLevel.LOW)
                .drivers(Collections.emptyMap())
                .sampleCount(0)
                .insufficientData(true)
                .confidence(0)
                .method(config.getMethod())
                .recommendations(List.of())
                .build();
        }

        Map<String, Double> drivers = new TreeMap<>();
        double total = 0;
        for (DriverRule rule : model.getDrivers()) {
            List<Double> values = new ArrayList<>();
            for (VitalsSample sample : samples) {
                Double value = rule.getMetric().valueOf(sample);
                if (value != null) {
                    values.add(value);
                }
            }
            if (values.isEmpty()) {
                continue;
            }
            double observed = rule.getAggregation().apply(values);
            drivers.put(rule.getName(), round(observed, 1));
            total += rule.contribution(observed);
        }

        double score = round(Math.min(100, Math.max(0, total)), 2);
        RiskAssessment assessment = RiskAssessment.builder()
            .riskType(riskType)
            .score(score)
            .level(config.levelOf(score))
            .drivers(Collections.unmodifiableMap(drivers))
            .sampleCount(samples.size())
            .insufficientData(drivers.isEmpty())
            .confidence(Math.min(100, config.getConfidencePerSample() * samples.size()))
            .method(config.getMethod())
            .recommendations(recommendationsFor(model, score))
            .build();
        logger.debug("{} score {} from {} samples, drivers {}", riskType, score, samples.size(), drivers);
        return assessment;
    }

    private static List<String> recommendationsFor(RiskModel model, double score) {
        List<String> texts = new ArrayList<>();
        for (Recommendation recommendation : model.getRecommendations()) {
            if (recommendation.appliesTo(score)) {
                texts.add(recommendation.getText());
            }
        }
        return Collections.unmodifiableList(texts);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
