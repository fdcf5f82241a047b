package com.healthrevo.pipeline.controller;

import com.healthrevo.pipeline.dto.ErrorResponse;
import com.healthrevo.pipeline.dto.PipelineResult;
import com.healthrevo.pipeline.dto.VitalsSubmission;
import com.healthrevo.pipeline.service.ClinicalPipelineService;
import com.healthrevo.pipeline.service.PatientRecordService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/patients/{patientId}")
@Tag(name = "Vitals and Risk", description = "Record vitals, run the vitals pipeline and read risk scores")
public class VitalsController {

    private static final Logger logger = LoggerFactory.getLogger(VitalsController.class);

    private final ClinicalPipelineService pipelineService;
    private final PatientRecordService recordService;

    public VitalsController(ClinicalPipelineService pipelineService, PatientRecordService recordService) {
        this.pipelineService = pipelineService;
        this.recordService = recordService;
    }

    @PostMapping("/vitals")
    @Operation(summary = "Record a vitals sample",
               description = "Validates and stores the sample, recomputes the patient's risk scores, evaluates the sample "
                   + "for anomalies and opens or re-affirms alerts. Resubmitting a sample id re-runs the pipeline without storing twice.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Pipeline ran; status PARTIAL names skipped stages",
                    content = @Content(schema = @Schema(implementation = PipelineResult.class))),
        @ApiResponse(responseCode = "400", description = "Invalid vitals",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "409", description = "Conflicting concurrent write, retryable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "503", description = "Record store unavailable, retryable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Mono<ResponseEntity<Object>> recordVitals(@PathVariable String patientId, @RequestBody VitalsSubmission submission) {
        logger.info("Received vitals for patient {} (sampleId={})", patientId, submission.getSampleId());

        return pipelineService.recordVitals(patientId, submission)
            .map(result -> {
                logger.info("Vitals pipeline for patient {} finished with status {} and {} alerts",
                    patientId, result.getStatus(), result.getAlerts().size());
                return ResponseEntity.<Object>ok(result);
            })
            .onErrorResume(error -> ApiErrors.toResponse("record vitals", error));
    }

    @GetMapping("/vitals")
    @Operation(summary = "Get the vitals window",
               description = "Samples recorded between from and to (ISO date-times, UTC), oldest first. Defaults to the scoring window ending now.")
    public Mono<ResponseEntity<Object>> getVitals(
            @PathVariable String patientId,
            @Parameter(description = "Window start", example = "2025-08-01T00:00:00")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @Parameter(description = "Window end", example = "2025-08-08T00:00:00")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return recordService.getVitals(patientId, from, to)
            .collectList()
            .map(samples -> {
                logger.info("Retrieved {} vitals samples for patient {}", samples.size(), patientId);
                return ResponseEntity.<Object>ok(samples);
            })
            .onErrorResume(error -> ApiErrors.toResponse("read vitals", error));
    }

    @GetMapping("/risk-scores")
    @Operation(summary = "Get current risk scores", description = "The newest score per risk type")
    public Mono<ResponseEntity<Object>> getCurrentRiskScores(@PathVariable String patientId) {
        return recordService.getCurrentRiskScores(patientId)
            .collectList()
            .map(scores -> ResponseEntity.<Object>ok(scores))
            .onErrorResume(error -> ApiErrors.toResponse("read risk scores", error));
    }

    @GetMapping("/risk-scores/history")
    @Operation(summary = "Get risk score history", description = "Append-only history, newest first")
    public Mono<ResponseEntity<Object>> getRiskScoreHistory(
            @PathVariable String patientId,
            @Parameter(description = "Restrict to one risk type", example = "HYPERTENSION")
            @RequestParam(required = false) String riskType) {
        return recordService.getRiskScoreHistory(patientId, riskType)
            .collectList()
            .map(scores -> ResponseEntity.<Object>ok(scores))
            .onErrorResume(error -> ApiErrors.toResponse("read risk score history", error));
    }
}
