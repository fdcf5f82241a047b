package com.healthrevo.pipeline.dto;

import com.healthrevo.decision.model.MedicationMention;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Exactly one of {@code text}, {@code documentBase64} or {@code medications} is expected. When
 * several are present, structured medications win over text, and text wins over a document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrescriptionSubmission {
    private String prescriptionId;

    @Schema(description = "Typed prescription text", example = "1. Tab. Lisinopril 10mg OD\n2. Ibuprofen 400 mg TDS")
    private String text;

    @Schema(description = "Scanned prescription, base64 encoded; sent to text extraction")
    private String documentBase64;

    @Schema(example = "application/pdf")
    private String contentType;

    private List<MedicationMention> medications;
}
