package com.healthrevo.decision.anomaly;

import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.AlertType;
import com.healthrevo.decision.model.VitalMetric;
import com.healthrevo.decision.model.VitalsSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Evaluates a new vitals sample against its trailing window (relative rule) and the configured
 * absolute limits. When both fire for a metric the absolute candidate is emitted.
 */
public class AnomalyDetector {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyDetector.class);

    private static final Comparator<VitalsSample> SAMPLE_ORDER = Comparator
        .comparing(VitalsSample::getRecordedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(VitalsSample::getSampleId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final AnomalyThresholds thresholds;

    public AnomalyDetector(AnomalyThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public AnomalyThresholds getThresholds() {
        return thresholds;
    }

    /**
     * @param sample  the newly recorded sample
     * @param history the trailing window, or {@code null} when it could not be loaded
     */
    public AnomalyEvaluation evaluate(VitalsSample sample, List<VitalsSample> history) {
        if (sample == null || !sample.hasAnyMeasurement()) {
            return AnomalyEvaluation.notEvaluated("No vitals sample to evaluate");
        }

        List<VitalsSample> previous = null;
        if (history != null) {
            previous = new ArrayList<>();
            for (VitalsSample candidate : history) {
                if (!Objects.equals(candidate.getSampleId(), sample.getSampleId())) {
                    previous.add(candidate);
                }
            }
            previous.sort(SAMPLE_ORDER);
        }

        AnomalyEvaluation.AnomalyEvaluationBuilder evaluation = AnomalyEvaluation.builder()
            .status(EvaluationStatus.EVALUATED);
        boolean anyTrendEvaluated = false;

        for (VitalMetric metric : VitalMetric.values()) {
            Double value = metric.valueOf(sample);
            if (value == null) {
                continue;
            }

            Double deviation = null;
            Double mean = null;
            if (previous != null) {
                List<Double> values = new ArrayList<>();
                for (VitalsSample past : previous) {
                    Double pastValue = metric.valueOf(past);
                    if (pastValue != null) {
                        values.add(pastValue);
                    }
                }
                if (values.size() >= thresholds.getMinimumHistory()) {
                    anyTrendEvaluated = true;
                    mean = mean(values);
                    if (mean != 0) {
                        deviation = Math.abs(value - mean) / Math.abs(mean);
                    }
                }
            }
            boolean relativeFired = deviation != null && deviation > thresholds.getRelativeDeviation();

            AbsoluteThreshold absolute = strongestCrossed(metric, value);
            if (absolute != null) {
                evaluation.candidate(absoluteCandidate(metric, value, absolute, relativeFired ? deviation : null));
            } else if (relativeFired) {
                evaluation.candidate(relativeCandidate(metric, value, mean, deviation));
            }
        }

        EvaluationStatus trendStatus;
        if (previous == null) {
            trendStatus = EvaluationStatus.NOT_EVALUATED;
            evaluation.reason("Vitals window unavailable; only absolute limits were checked");
        } else if (anyTrendEvaluated) {
            trendStatus = EvaluationStatus.EVALUATED;
        } else {
            trendStatus = EvaluationStatus.INSUFFICIENT_HISTORY;
        }
        AnomalyEvaluation result = evaluation.trendStatus(trendStatus).build();
        logger.debug("Sample {} of patient {}: {} candidates, trend {}", sample.getSampleId(),
            sample.getPatientId(), result.getCandidates().size(), trendStatus);
        return result;
    }

    private AbsoluteThreshold strongestCrossed(VitalMetric metric, double value) {
        AbsoluteThreshold strongest = null;
        for (AbsoluteThreshold threshold : thresholds.getAbsoluteThresholds()) {
            if (threshold.getMetric() != metric || !threshold.isCrossedBy(value)) {
                continue;
            }
            if (strongest == null || threshold.getSeverity().isHigherThan(strongest.getSeverity())) {
                strongest = threshold;
            }
        }
        return strongest;
    }

    private static AlertCandidate absoluteCandidate(VitalMetric metric, double value, AbsoluteThreshold threshold,
                                                    Double deviation) {
        Map<String, Object> metadata = new TreeMap<>();
        metadata.put("metric", metric.key());
        metadata.put("value", value);
        metadata.put("threshold", threshold.getLimit());
        metadata.put("rule", "absolute");
        if (deviation != null) {
            metadata.put("deviation", round(deviation));
        }
        String comparison = threshold.getBound() == Bound.ABOVE ? "above" : "below";
        return AlertCandidate.builder()
            .type(AlertType.ANOMALY)
            .rootCauseKey(RootCauseKeys.vitals(metric))
            .severity(threshold.getSeverity())
            .title(threshold.getTitle())
            .message(String.format(Locale.ROOT, "%s %s %s is %s the limit of %s",
                metric.displayName(), format(value), metric.unit(), comparison, format(threshold.getLimit())))
            .recommendation(threshold.getRecommendation())
            .metadata(metadata)
            .build();
    }

    private AlertCandidate relativeCandidate(VitalMetric metric, double value, double mean, double deviation) {
        Map<String, Object> metadata = new TreeMap<>();
        metadata.put("metric", metric.key());
        metadata.put("value", value);
        metadata.put("baseline_mean", round(mean));
        metadata.put("deviation", round(deviation));
        metadata.put("rule", "relative");
        AlertSeverity severity = thresholds.getRelativeSeverity();
        return AlertCandidate.builder()
            .type(AlertType.ANOMALY)
            .rootCauseKey(RootCauseKeys.vitals(metric))
            .severity(severity)
            .title(metric.displayName() + " Trend Change")
            .message(String.format(Locale.ROOT, "%s %s %s deviates %.0f%% from the recent average of %s",
                metric.displayName(), format(value), metric.unit(), deviation * 100, format(round(mean))))
            .recommendation("Review recent readings and recheck")
            .metadata(metadata)
            .build();
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (Double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
