package com.healthrevo.pipeline.dto;

import com.healthrevo.decision.anomaly.TransitionKind;
import com.healthrevo.pipeline.model.Alert;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Alert touched by a pipeline run and how it was touched")
public class AlertOutcome {
    @Schema(allowableValues = {"OPEN", "REAFFIRM", "UPGRADE"})
    private TransitionKind transition;
    private Alert alert;
}
