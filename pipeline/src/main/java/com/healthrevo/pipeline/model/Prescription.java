package com.healthrevo.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
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

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table("prescriptions")
public class Prescription {
    @Id
    @JsonIgnore
    private Long id;

    @Column("prescription_id")
    private String prescriptionId;

    @Column("patient_id")
    private String patientId;

    @Column("raw_text")
    private String rawText;

    @JsonRawValue
    @Column("medications")
    @Schema(description = "Normalized medication mentions", type = "array")
    private String medications;

    @JsonRawValue
    @Column("flags")
    @Schema(description = "Interaction and dosage findings", type = "array")
    private String flags;

    @Column("status")
    @Schema(allowableValues = {"COMPLETE", "PARTIAL"})
    private String status;

    @Column("uploaded_at")
    private LocalDateTime uploadedAt;
}
