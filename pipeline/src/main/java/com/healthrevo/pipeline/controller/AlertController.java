package com.healthrevo.pipeline.controller;

import com.healthrevo.pipeline.dto.AcknowledgeRequest;
import com.healthrevo.pipeline.dto.ErrorResponse;
import com.healthrevo.pipeline.model.Alert;
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
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@Tag(name = "Alert Management", description = "Review and acknowledge alerts")
public class AlertController {

    private static final Logger logger = LoggerFactory.getLogger(AlertController.class);

    private final ClinicalPipelineService pipelineService;
    private final PatientRecordService recordService;

    public AlertController(ClinicalPipelineService pipelineService, PatientRecordService recordService) {
        this.pipelineService = pipelineService;
        this.recordService = recordService;
    }

    @GetMapping("/alerts")
    @Operation(summary = "List alerts", description = "Alerts ordered by most recent first")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Alerts retrieved successfully",
                    content = @Content(schema = @Schema(implementation = Alert.class))),
        @ApiResponse(responseCode = "400", description = "Unknown severity",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Mono<ResponseEntity<Object>> getAlerts(
            @Parameter(description = "Restrict to one patient") @RequestParam(required = false) String patientId,
            @Parameter(description = "Minimum severity", example = "SERIOUS") @RequestParam(required = false) String severity,
            @Parameter(description = "Acknowledgment state") @RequestParam(required = false) Boolean acknowledged) {
        logger.info("Fetching alerts (patientId={}, severity={}, acknowledged={})", patientId, severity, acknowledged);

        return recordService.getAlerts(patientId, severity, acknowledged)
            .collectList()
            .map(alerts -> {
                logger.info("Found {} alerts", alerts.size());
                return ResponseEntity.<Object>ok(alerts);
            })
            .onErrorResume(error -> ApiErrors.toResponse("read alerts", error));
    }

    @PostMapping("/alerts/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an alert",
               description = "Terminal. A later qualifying condition opens a new alert.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Alert acknowledged",
                    content = @Content(schema = @Schema(implementation = Alert.class))),
        @ApiResponse(responseCode = "400", description = "Missing reviewer",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "404", description = "Unknown alert",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "409", description = "Alert already acknowledged",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Mono<ResponseEntity<Object>> acknowledge(@PathVariable String alertId, @RequestBody AcknowledgeRequest request) {
        logger.info("Acknowledging alert {} by {}", alertId, request.getReviewerId());

        return pipelineService.acknowledge(alertId, request.getReviewerId())
            .map(alert -> ResponseEntity.<Object>ok(alert))
            .onErrorResume(error -> ApiErrors.toResponse("acknowledge alert", error));
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Returns the health status of the service")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("CDS pipeline is healthy"));
    }
}
