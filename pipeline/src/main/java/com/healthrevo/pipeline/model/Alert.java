package com.healthrevo.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.AlertState;
import com.healthrevo.decision.model.AlertType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Stored alert. {@code openKey} is set while the alert is unacknowledged and cleared on
 * acknowledgment; its unique index keeps one open alert per (patient, type, root cause).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table("alerts")
public class Alert {
    @Id
    @JsonIgnore
    private Long id;

    @Column("alert_id")
    private String alertId;

    @Column("patient_id")
    private String patientId;

    @Column("type")
    @Schema(allowableValues = {"ANOMALY", "DRUG_INTERACTION"})
    private String type;

    @Column("root_cause_key")
    @Schema(example = "vitals:systolic")
    private String rootCauseKey;

    @JsonIgnore
    @Column("open_key")
    private String openKey;

    @Column("severity")
    @Schema(allowableValues = {"MILD", "SERIOUS", "URGENT", "CRITICAL"})
    private String severity;

    @Column("title")
    private String title;

    @Column("message")
    private String message;

    @Column("recommendation")
    private String recommendation;

    @JsonRawValue
    @Column("metadata")
    @Schema(type = "object")
    private String metadata;

    @Column("acknowledged")
    private boolean acknowledged;

    @Column("acknowledged_by")
    private String acknowledgedBy;

    @Column("acknowledged_at")
    private LocalDateTime acknowledgedAt;

    @Column("generated_at")
    private LocalDateTime generatedAt;

    @Column("last_evaluated_at")
    private LocalDateTime lastEvaluatedAt;

    public static String openKey(String patientId, AlertType type, String rootCauseKey) {
        return patientId + "|" + type.name() + "|" + rootCauseKey;
    }

    public AlertState toState() {
        return AlertState.builder()
            .alertId(alertId)
            .patientId(patientId)
            .type(AlertType.valueOf(type))
            .rootCauseKey(rootCauseKey)
            .severity(AlertSeverity.valueOf(severity))
            .generatedAt(generatedAt)
            .acknowledged(acknowledged)
            .build();
    }
}
