package com.healthrevo.decision.model;

import java.util.Locale;
import java.util.function.Function;

public enum VitalMetric {
    SYSTOLIC("systolic", "Systolic Blood Pressure", "mmHg", s -> toDouble(s.getSystolic())),
    DIASTOLIC("diastolic", "Diastolic Blood Pressure", "mmHg", s -> toDouble(s.getDiastolic())),
    HEART_RATE("heart_rate", "Heart Rate", "BPM", s -> toDouble(s.getHeartRate())),
    TEMPERATURE("temperature", "Temperature", "°C", VitalsSample::getTemperature),
    BLOOD_GLUCOSE("blood_glucose", "Blood Glucose", "mg/dL", VitalsSample::getBloodGlucose),
    OXYGEN_SATURATION("oxygen_saturation", "Oxygen Saturation", "%", s -> toDouble(s.getOxygenSaturation())),
    WEIGHT("weight", "Weight", "kg", VitalsSample::getWeight);

    private final String key;
    private final String displayName;
    private final String unit;
    private final Function<VitalsSample, Double> accessor;

    VitalMetric(String key, String displayName, String unit, Function<VitalsSample, Double> accessor) {
        this.key = key;
        this.displayName = displayName;
        this.unit = unit;
        this.accessor = accessor;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public String unit() {
        return unit;
    }

    /**
     * @return the measured value, or {@code null} when the sample did not record this metric
     */
    public Double valueOf(VitalsSample sample) {
        return accessor.apply(sample);
    }

    public static VitalMetric fromKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (VitalMetric metric : values()) {
            if (metric.key.equals(normalized) || metric.name().equalsIgnoreCase(normalized)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown vital metric: " + key);
    }

    private static Double toDouble(Integer value) {
        return value == null ? null : value.doubleValue();
    }
}
