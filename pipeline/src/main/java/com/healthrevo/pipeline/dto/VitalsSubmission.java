package com.healthrevo.pipeline.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "A vitals sample as submitted by a device or a clinician")
public class VitalsSubmission {
    @Schema(description = "Client-chosen id; resubmitting the same id replays the pipeline without storing twice",
            example = "11111111-1111-1111-1111-111111111111")
    private String sampleId;

    @Schema(description = "Recording time (UTC); defaults to the time of submission", example = "2025-08-01T12:00:00")
    private LocalDateTime recordedAt;

    @Schema(example = "142")
    private Integer systolic;

    @Schema(example = "91")
    private Integer diastolic;

    @Schema(example = "78")
    private Integer heartRate;

    @Schema(description = "Celsius; values above 45 are read as Fahrenheit", example = "36.8")
    private Double temperature;

    @Schema(description = "mg/dL", example = "105")
    private Double bloodGlucose;

    @Schema(description = "Percent", example = "97")
    private Integer oxygenSaturation;

    @Schema(description = "Kilograms; values above 200 are read as pounds", example = "72.5")
    private Double weight;

    private String note;
}
