package com.healthrevo.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.healthrevo.decision.model.DrugPair;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A drug pair a clinician accepted for one patient with monitoring. The pair is still reported
 * but no longer alerts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table("interaction_overrides")
public class InteractionOverride {
    @Id
    @JsonIgnore
    private Long id;

    @Column("patient_id")
    private String patientId;

    @Column("pair_key")
    private String pairKey;

    @Column("clinician_id")
    private String clinicianId;

    @Column("note")
    private String note;

    @Column("created_at")
    private LocalDateTime createdAt;

    public DrugPair toPair() {
        return DrugPair.fromKey(pairKey);
    }
}
