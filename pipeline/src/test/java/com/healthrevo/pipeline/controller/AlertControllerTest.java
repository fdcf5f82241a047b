package com.healthrevo.pipeline.controller;

import com.healthrevo.decision.exception.AlertAlreadyAcknowledgedException;
import com.healthrevo.pipeline.model.Alert;
import com.healthrevo.pipeline.service.ClinicalPipelineService;
import com.healthrevo.pipeline.service.PatientRecordService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(AlertController.class)
@ActiveProfiles("test")
public class AlertControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ClinicalPipelineService pipelineService;

    @MockBean
    private PatientRecordService recordService;

    @BeforeEach
    void setUp() {
        reset(pipelineService, recordService);
    }

    private static Alert alert(String alertId, boolean acknowledged) {
        return Alert.builder()
            .alertId(alertId)
            .patientId("p-001")
            .type("DRUG_INTERACTION")
            .rootCauseKey("interaction:ibuprofen|lisinopril")
            .severity("SERIOUS")
            .title("Drug Interaction: Lisinopril + Ibuprofen")
            .metadata("{\"pair\":\"ibuprofen|lisinopril\"}")
            .acknowledged(acknowledged)
            .acknowledgedBy(acknowledged ? "dr-smith" : null)
            .generatedAt(LocalDateTime.parse("2025-08-01T12:00:00"))
            .build();
    }

    @Test
    @DisplayName("Should list alerts filtered by severity")
    void testGetAlerts() {
        when(recordService.getAlerts("p-001", "SERIOUS", null)).thenReturn(Flux.just(alert("a-1", false)));

        webTestClient
            .get()
            .uri("/alerts?patientId=p-001&severity=SERIOUS")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1)
            .jsonPath("$[0].alertId").isEqualTo("a-1")
            .jsonPath("$[0].metadata.pair").isEqualTo("ibuprofen|lisinopril")
            .jsonPath("$[0].id").doesNotExist();

        verify(recordService, times(1)).getAlerts("p-001", "SERIOUS", null);
    }

    @Test
    @DisplayName("Should return 400 for an unknown severity")
    void testUnknownSeverity() {
        when(recordService.getAlerts(isNull(), eq("LOUD"), isNull()))
            .thenReturn(Flux.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown severity LOUD")));

        webTestClient
            .get()
            .uri("/alerts?severity=LOUD")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.message").isEqualTo("Unknown severity LOUD");
    }

    @Test
    @DisplayName("Should acknowledge an alert")
    void testAcknowledge() {
        when(pipelineService.acknowledge("a-1", "dr-smith")).thenReturn(Mono.just(alert("a-1", true)));

        webTestClient
            .post()
            .uri("/alerts/a-1/acknowledge")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"reviewerId\": \"dr-smith\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.acknowledged").isEqualTo(true)
            .jsonPath("$.acknowledgedBy").isEqualTo("dr-smith");
    }

    @Test
    @DisplayName("Should return 409 without retry when the alert is already acknowledged")
    void testAcknowledgeTwice() {
        when(pipelineService.acknowledge("a-1", "dr-jones")).thenReturn(Mono.error(new AlertAlreadyAcknowledgedException("a-1")));

        webTestClient
            .post()
            .uri("/alerts/a-1/acknowledge")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"reviewerId\": \"dr-jones\"}")
            .exchange()
            .expectStatus().isEqualTo(HttpStatus.CONFLICT)
            .expectBody()
            .jsonPath("$.status").isEqualTo(409)
            .jsonPath("$.retryable").isEqualTo(false);
    }

    @Test
    @DisplayName("Should return 404 for an unknown alert")
    void testAcknowledgeUnknown() {
        when(pipelineService.acknowledge("missing", "dr-smith"))
            .thenReturn(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Alert not found: missing")));

        webTestClient
            .post()
            .uri("/alerts/missing/acknowledge")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"reviewerId\": \"dr-smith\"}")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.message").isEqualTo("Alert not found: missing");
    }

    @Test
    @DisplayName("Should report healthy")
    void testHealth() {
        webTestClient
            .get()
            .uri("/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("CDS pipeline is healthy");
    }
}
