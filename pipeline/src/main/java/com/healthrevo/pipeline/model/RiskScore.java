package com.healthrevo.pipeline.model;

import com.fasterxml.jackson.annotation.JsonRawValue;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One row of the append-only risk score history. The newest row per (patient, risk type) is the
 * current score.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table("risk_scores")
public class RiskScore {
    @Id
    private Long id;

    @Column("patient_id")
    private String patientId;

    @Column("risk_type")
    @Schema(allowableValues = {"HYPERTENSION", "DIABETES", "HEART_DISEASE"})
    private String riskType;

    @Column("score")
    @Schema(description = "Score between 0 and 100", example = "42.5")
    private Double score;

    @Column("level")
    @Schema(allowableValues = {"LOW", "MODERATE", "HIGH", "CRITICAL"})
    private String level;

    @JsonRawValue
    @Column("drivers")
    @Schema(description = "Driver name to observed value", type = "object", example = "{\"avg_systolic\": 142.3}")
    private String drivers;

    @Column("sample_count")
    private Integer sampleCount;

    @Column("insufficient_data")
    private Boolean insufficientData;

    @Column("confidence")
    private Integer confidence;

    @Column("method")
    private String method;

    @JsonRawValue
    @Column("recommendations")
    @Schema(description = "Advice for the score band", type = "array", example = "[\"Monitor blood pressure daily\"]")
    private String recommendations;

    @Column("computed_at")
    private LocalDateTime computedAt;

    /**
     * @return true when both rows carry the same computed result, ignoring id and time
     */
    public boolean sameResultAs(RiskScore other) {
        return other != null
            && Objects.equals(riskType, other.riskType)
            && Objects.equals(score, other.score)
            && Objects.equals(level, other.level)
            && Objects.equals(drivers, other.drivers)
            && Objects.equals(sampleCount, other.sampleCount)
            && Objects.equals(insufficientData, other.insufficientData)
            && Objects.equals(confidence, other.confidence)
            && Objects.equals(method, other.method)
            && Objects.equals(recommendations, other.recommendations);
    }
}
