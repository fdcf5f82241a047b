package com.healthrevo.decision.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * A single immutable vitals observation for one patient. Every measurement is optional;
 * consumers must skip fields that are {@code null} rather than treating them as zero.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class VitalsSample {
    String sampleId;
    String patientId;
    LocalDateTime recordedAt;
    Integer systolic;
    Integer diastolic;
    Integer heartRate;
    Double temperature;
    Double bloodGlucose;
    Integer oxygenSaturation;
    Double weight;
    String note;

    public boolean hasAnyMeasurement() {
        for (VitalMetric metric : VitalMetric.values()) {
            if (metric.valueOf(this) != null) {
                return true;
            }
        }
        return false;
    }
}
