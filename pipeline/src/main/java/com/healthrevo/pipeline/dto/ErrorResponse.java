package com.healthrevo.pipeline.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    @Schema(description = "Error message", example = "systolic must be between 0 and 300")
    private String message;

    @Schema(description = "HTTP status code", example = "400")
    private int status;

    @Schema(description = "Timestamp of the error", example = "2025-08-01T12:00:00Z")
    private String timestamp;

    @Schema(description = "Whether repeating the same request may succeed")
    private boolean retryable;
}
