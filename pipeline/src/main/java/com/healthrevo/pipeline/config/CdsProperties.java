package com.healthrevo.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Decision tables bound from {@code cds.*}. Empty lists fall back to the engine defaults.
 */
@Data
@ConfigurationProperties(prefix = "cds")
public class CdsProperties {

    private Normalizer normalizer = new Normalizer();
    private Interaction interaction = new Interaction();
    private Risk risk = new Risk();
    private Anomaly anomaly = new Anomaly();
    private Dosage dosage = new Dosage();
    private Vocabulary vocabulary = new Vocabulary();

    @Data
    public static class Normalizer {
        private String metric = "levenshtein";
        private double acceptanceThreshold = 0.8;
        private boolean ocrFolding = true;
        private int minTokenLength = 4;
    }

    @Data
    public static class Interaction {
        private String alertMinimumSeverity = "moderate";
        private int cumulativeMinimumDrugs = 3;
        private List<CumulativeRuleProperties> cumulativeRules = new ArrayList<>();
    }

    @Data
    public static class CumulativeRuleProperties {
        private String mechanism;
        private String severity;
        private String note;
    }

    @Data
    public static class Risk {
        private int windowDays = 7;
        private double moderateAt = 20;
        private double highAt = 50;
        private double criticalAt = 80;
        private int confidencePerSample = 20;
        private List<ModelProperties> models = new ArrayList<>();
    }

    @Data
    public static class ModelProperties {
        private String riskType;
        private List<DriverProperties> drivers = new ArrayList<>();
        private List<RecommendationProperties> recommendations = new ArrayList<>();
    }

    @Data
    public static class RecommendationProperties {
        private double above;
        private String text;
    }

    @Data
    public static class DriverProperties {
        private String name;
        private String metric;
        private String aggregation = "mean";
        private double baseline;
        private double coefficient;
        private String direction = "above";
    }

    @Data
    public static class Anomaly {
        private double relativeDeviation = 0.20;
        private int minimumHistory = 3;
        private int trendWindowDays = 7;
        private List<ThresholdProperties> absoluteThresholds = new ArrayList<>();
    }

    @Data
    public static class ThresholdProperties {
        private String metric;
        private String bound = "above";
        private double limit;
        private String severity;
        private String title;
        private String recommendation;
    }

    @Data
    public static class Dosage {
        private List<DoseLimitProperties> limits = new ArrayList<>();
    }

    @Data
    public static class DoseLimitProperties {
        private String drugId;
        private double reviewAtMg;
    }

    @Data
    public static class Vocabulary {
        private boolean seedOnStartup = true;
        private String drugs = "classpath:vocabulary/drugs.csv";
        private String interactions = "classpath:vocabulary/interactions.csv";
    }
}
