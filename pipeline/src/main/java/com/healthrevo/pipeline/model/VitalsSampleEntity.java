package com.healthrevo.pipeline.model;

import com.healthrevo.decision.model.VitalsSample;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table("vitals_samples")
@Schema(description = "Vitals sample stored in database")
public class VitalsSampleEntity implements Persistable<String> {

    @Transient
    @Builder.Default
    private boolean isNew = true;

    @Id
    @Column("sample_id")
    @Schema(description = "Unique identifier for the sample", example = "11111111-1111-1111-1111-111111111111")
    private String sampleId;

    @Column("patient_id")
    @Schema(description = "Patient identifier", example = "p-001")
    private String patientId;

    @Column("recorded_at")
    @Schema(description = "Timestamp when the sample was recorded (UTC)", example = "2025-08-01T12:00:00")
    private LocalDateTime recordedAt;

    @Column("systolic")
    @Schema(description = "Systolic blood pressure in mmHg", example = "150")
    private Integer systolic;

    @Column("diastolic")
    @Schema(description = "Diastolic blood pressure in mmHg", example = "95")
    private Integer diastolic;

    @Column("heart_rate")
    @Schema(description = "Heart rate in beats per minute", example = "72")
    private Integer heartRate;

    @Column("temperature")
    @Schema(description = "Body temperature in °C", example = "36.8")
    private Double temperature;

    @Column("blood_glucose")
    @Schema(description = "Blood glucose in mg/dL", example = "110")
    private Double bloodGlucose;

    @Column("oxygen_saturation")
    @Schema(description = "Blood oxygen saturation percentage", example = "97")
    private Integer oxygenSaturation;

    @Column("weight")
    @Schema(description = "Weight in kg", example = "72.5")
    private Double weight;

    @Column("note")
    private String note;

    @Column("created_at")
    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    public static VitalsSampleEntity from(VitalsSample sample) {
        return VitalsSampleEntity.builder()
            .sampleId(sample.getSampleId())
            .patientId(sample.getPatientId())
            .recordedAt(sample.getRecordedAt())
            .systolic(sample.getSystolic())
            .diastolic(sample.getDiastolic())
            .heartRate(sample.getHeartRate())
            .temperature(sample.getTemperature())
            .bloodGlucose(sample.getBloodGlucose())
            .oxygenSaturation(sample.getOxygenSaturation())
            .weight(sample.getWeight())
            .note(sample.getNote())
            .build();
    }

    public VitalsSample toSample() {
        return VitalsSample.builder()
            .sampleId(sampleId)
            .patientId(patientId)
            .recordedAt(recordedAt)
            .systolic(systolic)
            .diastolic(diastolic)
            .heartRate(heartRate)
            .temperature(temperature)
            .bloodGlucose(bloodGlucose)
            .oxygenSaturation(oxygenSaturation)
            .weight(weight)
            .note(note)
            .build();
    }

    @Override
    public String getId() {
        return sampleId;
    }

    @Override
    public boolean isNew() {
        return isNew || sampleId == null;
    }
}
