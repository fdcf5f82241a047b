package com.healthrevo.pipeline.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InteractionOverrideRequest {
    @Schema(description = "Canonical drug id, name or alias", example = "lisinopril")
    private String drugA;

    @Schema(description = "Canonical drug id, name or alias", example = "Advil")
    private String drugB;

    @Schema(example = "dr-smith")
    private String clinicianId;

    @Schema(example = "Short course, renal function checked weekly")
    private String note;
}
