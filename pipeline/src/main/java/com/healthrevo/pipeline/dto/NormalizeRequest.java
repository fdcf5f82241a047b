package com.healthrevo.pipeline.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NormalizeRequest {
    @Schema(description = "Medication names as written", example = "[\"Tab. Lisinoprl 10mg\", \"Paracetamo1\"]")
    private List<String> names;
}
