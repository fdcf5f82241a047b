package com.healthrevo.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.healthrevo.decision.anomaly.EvaluationStatus;
import com.healthrevo.decision.interaction.InteractionReport;
import com.healthrevo.decision.normalizer.NormalizationResult;
import com.healthrevo.decision.prescription.PrescriptionFinding;
import com.healthrevo.pipeline.model.Prescription;
import com.healthrevo.pipeline.model.ProcessingStatus;
import com.healthrevo.pipeline.model.RiskScore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one pipeline run. {@code status} is {@code PARTIAL} when a stage was skipped
 * because a collaborator was unavailable; {@code gaps} names the skipped collaborators.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineResult {

    public static final String VITALS_RECORDED = "VITALS_RECORDED";
    public static final String PRESCRIPTION_SUBMITTED = "PRESCRIPTION_SUBMITTED";

    private String patientId;

    @Schema(allowableValues = {VITALS_RECORDED, PRESCRIPTION_SUBMITTED})
    private String trigger;

    private ProcessingStatus status;

    @Builder.Default
    private List<String> gaps = new ArrayList<>();

    private String sampleId;

    @Schema(description = "The sample was already stored; the pipeline re-ran over the stored data")
    private Boolean replayed;

    private List<RiskScore> riskScores;

    @Schema(description = "Status of the trend (relative deviation) evaluation")
    private EvaluationStatus trendStatus;

    @Builder.Default
    private List<AlertOutcome> alerts = new ArrayList<>();

    private Prescription prescription;

    private List<NormalizationResult> normalization;

    @Schema(description = "NOT_EVALUATED when no medication set could be obtained; never read as no interactions")
    private EvaluationStatus interactionStatus;

    private InteractionReport interactionReport;

    private List<PrescriptionFinding> findings;

    @Schema(description = "Optional clinician-facing summary from the chat collaborator")
    private String summary;
}
