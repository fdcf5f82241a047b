package com.healthrevo.pipeline.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgeRequest {
    @Schema(description = "Clinician acknowledging the alert", example = "dr-smith")
    private String reviewerId;
}
