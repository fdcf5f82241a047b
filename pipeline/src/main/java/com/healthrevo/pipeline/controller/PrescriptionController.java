package com.healthrevo.pipeline.controller;

import com.healthrevo.pipeline.dto.ErrorResponse;
import com.healthrevo.pipeline.dto.InteractionOverrideRequest;
import com.healthrevo.pipeline.dto.PipelineResult;
import com.healthrevo.pipeline.dto.PrescriptionSubmission;
import com.healthrevo.pipeline.service.ClinicalPipelineService;
import com.healthrevo.pipeline.service.PatientRecordService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/patients/{patientId}")
@Tag(name = "Prescriptions", description = "Submit prescriptions and manage accepted drug interactions")
public class PrescriptionController {

    private static final Logger logger = LoggerFactory.getLogger(PrescriptionController.class);

    private final ClinicalPipelineService pipelineService;
    private final PatientRecordService recordService;

    public PrescriptionController(ClinicalPipelineService pipelineService, PatientRecordService recordService) {
        this.pipelineService = pipelineService;
        this.recordService = recordService;
    }

    @PostMapping("/prescriptions")
    @Operation(summary = "Submit a prescription",
               description = "Accepts typed text, a scanned document (sent to text extraction) or structured medications. "
                   + "Medications are normalized against the vocabulary, doses reviewed and interactions checked.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Prescription processed; status PARTIAL when text extraction failed",
                    content = @Content(schema = @Schema(implementation = PipelineResult.class))),
        @ApiResponse(responseCode = "400", description = "No prescription content",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "503", description = "Record store unavailable, retryable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Mono<ResponseEntity<Object>> submitPrescription(@PathVariable String patientId,
                                                           @RequestBody PrescriptionSubmission submission) {
        logger.info("Received prescription for patient {}", patientId);

        return pipelineService.submitPrescription(patientId, submission)
            .map(result -> {
                logger.info("Prescription pipeline for patient {} finished with status {} and {} alerts",
                    patientId, result.getStatus(), result.getAlerts().size());
                return ResponseEntity.<Object>ok(result);
            })
            .onErrorResume(error -> ApiErrors.toResponse("submit prescription", error));
    }

    @GetMapping("/prescriptions")
    @Operation(summary = "Get prescriptions", description = "Stored prescriptions, newest first")
    public Mono<ResponseEntity<Object>> getPrescriptions(@PathVariable String patientId) {
        return recordService.getPrescriptions(patientId)
            .collectList()
            .map(prescriptions -> ResponseEntity.<Object>ok(prescriptions))
            .onErrorResume(error -> ApiErrors.toResponse("read prescriptions", error));
    }

    @PostMapping("/interaction-overrides")
    @Operation(summary = "Accept a drug pair with monitoring",
               description = "The pair keeps appearing in interaction reports for this patient but no longer raises alerts")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Override stored"),
        @ApiResponse(responseCode = "400", description = "Missing drug or clinician",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Mono<ResponseEntity<Object>> addOverride(@PathVariable String patientId,
                                                    @RequestBody InteractionOverrideRequest request) {
        return pipelineService.addOverride(patientId, request)
            .map(override -> ResponseEntity.<Object>ok(override))
            .onErrorResume(error -> ApiErrors.toResponse("accept interaction", error));
    }

    @GetMapping("/interaction-overrides")
    @Operation(summary = "Get accepted drug pairs")
    public Mono<ResponseEntity<Object>> getOverrides(@PathVariable String patientId) {
        return recordService.getOverrides(patientId)
            .collectList()
            .map(overrides -> ResponseEntity.<Object>ok(overrides))
            .onErrorResume(error -> ApiErrors.toResponse("read interaction overrides", error));
    }
}
