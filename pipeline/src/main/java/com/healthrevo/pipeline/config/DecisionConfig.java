package com.healthrevo.pipeline.config;

import com.healthrevo.decision.anomaly.AbsoluteThreshold;
import com.healthrevo.decision.anomaly.AlertStateMachine;
import com.healthrevo.decision.anomaly.AnomalyDetector;
import com.healthrevo.decision.anomaly.AnomalyThresholds;
import com.healthrevo.decision.anomaly.Bound;
import com.healthrevo.decision.anomaly.InteractionAlertPolicy;
import com.healthrevo.decision.interaction.CumulativeRule;
import com.healthrevo.decision.interaction.DrugInteractionChecker;
import com.healthrevo.decision.interaction.InteractionSettings;
import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.InteractionSeverity;
import com.healthrevo.decision.model.VitalMetric;
import com.healthrevo.decision.normalizer.MedicationNormalizer;
import com.healthrevo.decision.normalizer.NormalizerSettings;
import com.healthrevo.decision.normalizer.SimilarityMetrics;
import com.healthrevo.decision.prescription.DosageReview;
import com.healthrevo.decision.prescription.DoseLimit;
import com.healthrevo.decision.prescription.PrescriptionTextParser;
import com.healthrevo.decision.risk.Aggregation;
import com.healthrevo.decision.risk.Direction;
import com.healthrevo.decision.risk.DriverRule;
import com.healthrevo.decision.risk.Recommendation;
import com.healthrevo.decision.risk.RiskModel;
import com.healthrevo.decision.risk.RiskScoringConfig;
import com.healthrevo.decision.risk.RiskScoringEngine;
import com.healthrevo.decision.risk.RiskType;
import com.healthrevo.decision.vocabulary.VocabularyCsvReader;
import com.healthrevo.decision.vocabulary.VocabularyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Builds the immutable engine configuration from {@link CdsProperties} and exposes the engines
 * as beans. The engines themselves hold no Spring dependencies.
 */
@Configuration
@EnableConfigurationProperties(CdsProperties.class)
public class DecisionConfig {

    private static final Logger logger = LoggerFactory.getLogger(DecisionConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public VocabularyStore vocabularyStore() {
        return new VocabularyStore();
    }

    @Bean
    public VocabularyCsvReader vocabularyCsvReader() {
        return new VocabularyCsvReader();
    }

    @Bean
    public PrescriptionTextParser prescriptionTextParser() {
        return new PrescriptionTextParser();
    }

    @Bean
    public MedicationNormalizer medicationNormalizer(CdsProperties properties) {
        CdsProperties.Normalizer normalizer = properties.getNormalizer();
        NormalizerSettings settings = NormalizerSettings.builder()
            .acceptanceThreshold(normalizer.getAcceptanceThreshold())
            .ocrFolding(normalizer.isOcrFolding())
            .minTokenLength(normalizer.getMinTokenLength())
            .build();
        logger.info("Medication normalizer: metric={}, threshold={}", normalizer.getMetric(), settings.getAcceptanceThreshold());
        return new MedicationNormalizer(SimilarityMetrics.byName(normalizer.getMetric()), settings);
    }

    @Bean
    public InteractionSettings interactionSettings(CdsProperties properties) {
        CdsProperties.Interaction interaction = properties.getInteraction();
        InteractionSettings.InteractionSettingsBuilder builder = InteractionSettings.builder()
            .alertMinimumSeverity(InteractionSeverity.fromLabel(interaction.getAlertMinimumSeverity()))
            .cumulativeMinimumDrugs(interaction.getCumulativeMinimumDrugs());
        for (CdsProperties.CumulativeRuleProperties rule : interaction.getCumulativeRules()) {
            builder.cumulativeRule(CumulativeRule.builder()
                .mechanism(rule.getMechanism())
                .severity(InteractionSeverity.fromLabel(rule.getSeverity()))
                .note(rule.getNote())
                .build());
        }
        return builder.build();
    }

    @Bean
    public DrugInteractionChecker drugInteractionChecker(InteractionSettings interactionSettings) {
        return new DrugInteractionChecker(interactionSettings);
    }

    @Bean
    public InteractionAlertPolicy interactionAlertPolicy(InteractionSettings interactionSettings) {
        return new InteractionAlertPolicy(interactionSettings);
    }

    @Bean
    public DosageReview dosageReview(CdsProperties properties) {
        List<DoseLimit> limits = properties.getDosage().getLimits().stream()
            .map(limit -> DoseLimit.builder().drugId(limit.getDrugId()).reviewAtMg(limit.getReviewAtMg()).build())
            .toList();
        return new DosageReview(limits);
    }

    @Bean
    public RiskScoringEngine riskScoringEngine(CdsProperties properties) {
        CdsProperties.Risk risk = properties.getRisk();
        RiskScoringConfig.RiskScoringConfigBuilder builder = RiskScoringConfig.builder()
            .window(Duration.ofDays(risk.getWindowDays()))
            .moderateAt(risk.getModerateAt())
            .highAt(risk.getHighAt())
            .criticalAt(risk.getCriticalAt())
            .confidencePerSample(risk.getConfidencePerSample());
        if (risk.getModels().isEmpty()) {
            builder.models(RiskScoringConfig.defaults().getModels());
        } else {
            for (CdsProperties.ModelProperties model : risk.getModels()) {
                builder.model(toRiskModel(model));
            }
        }
        RiskScoringConfig config = builder.build();
        logger.info("Risk scoring: {} models over a {} day window", config.getModels().size(), risk.getWindowDays());
        return new RiskScoringEngine(config);
    }

    @Bean
    public AnomalyDetector anomalyDetector(CdsProperties properties) {
        CdsProperties.Anomaly anomaly = properties.getAnomaly();
        AnomalyThresholds.AnomalyThresholdsBuilder builder = AnomalyThresholds.builder()
            .relativeDeviation(anomaly.getRelativeDeviation())
            .minimumHistory(anomaly.getMinimumHistory())
            .trendWindow(Duration.ofDays(anomaly.getTrendWindowDays()));
        if (anomaly.getAbsoluteThresholds().isEmpty()) {
            builder.absoluteThresholds(AnomalyThresholds.defaults().getAbsoluteThresholds());
        } else {
            for (CdsProperties.ThresholdProperties threshold : anomaly.getAbsoluteThresholds()) {
                builder.absoluteThreshold(AbsoluteThreshold.builder()
                    .metric(VitalMetric.fromKey(threshold.getMetric()))
                    .bound(Bound.valueOf(threshold.getBound().toUpperCase(Locale.ROOT)))
                    .limit(threshold.getLimit())
                    .severity(AlertSeverity.fromLabel(threshold.getSeverity()))
                    .title(threshold.getTitle())
                    .recommendation(threshold.getRecommendation())
                    .build());
            }
        }
        return new AnomalyDetector(builder.build());
    }

    @Bean
    public AlertStateMachine alertStateMachine() {
        return new AlertStateMachine();
    }

    private static RiskModel toRiskModel(CdsProperties.ModelProperties model) {
        RiskModel.RiskModelBuilder builder = RiskModel.builder().riskType(RiskType.fromLabel(model.getRiskType()));
        for (CdsProperties.DriverProperties driver : model.getDrivers()) {
            builder.driver(DriverRule.builder()
                .name(driver.getName())
                .metric(VitalMetric.fromKey(driver.getMetric()))
                .aggregation(Aggregation.valueOf(driver.getAggregation().toUpperCase(Locale.ROOT)))
                .baseline(driver.getBaseline())
                .coefficient(driver.getCoefficient())
                .direction(Direction.valueOf(driver.getDirection().toUpperCase(Locale.ROOT)))
                .build());
        }
        for (CdsProperties.RecommendationProperties recommendation : model.getRecommendations()) {
            builder.recommendation(Recommendation.builder()
                .above(recommendation.getAbove())
                .text(recommendation.getText())
                .build());
        }
        return builder.build();
    }
}
