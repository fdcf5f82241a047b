package com.healthrevo.pipeline.controller;

import com.healthrevo.decision.interaction.InteractionReport;
import com.healthrevo.pipeline.dto.InteractionOverrideRequest;
import com.healthrevo.pipeline.dto.PipelineResult;
import com.healthrevo.pipeline.dto.PrescriptionSubmission;
import com.healthrevo.pipeline.model.InteractionOverride;
import com.healthrevo.pipeline.model.Prescription;
import com.healthrevo.pipeline.model.ProcessingStatus;
import com.healthrevo.pipeline.service.ClinicalPipelineService;
import com.healthrevo.pipeline.service.PatientRecordService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
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
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(PrescriptionController.class)
@ActiveProfiles("test")
public class PrescriptionControllerTest {

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

    @Test
    @DisplayName("Should pass structured medications through to the pipeline")
    void testSubmitStructured() {
        PipelineResult result = PipelineResult.builder()
            .patientId("p-002")
            .trigger(PipelineResult.PRESCRIPTION_SUBMITTED)
            .status(ProcessingStatus.PARTIAL)
            .gaps(List.of("ocr"))
            .build();
        when(pipelineService.submitPrescription(eq("p-002"), any(PrescriptionSubmission.class))).thenReturn(Mono.just(result));

        webTestClient
            .post()
            .uri("/patients/p-002/prescriptions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("""
                {
                    "prescriptionId": "rx-1",
                    "medications": [
                        {"rawName": "Lisinopril", "dose": "10mg"},
                        {"rawName": "Ibuprofen", "dose": "200mg", "frequency": "tid"}
                    ]
                }
                """)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("PARTIAL")
            .jsonPath("$.gaps[0]").isEqualTo("ocr")
            .jsonPath("$.interactionReport").doesNotExist();

        ArgumentCaptor<PrescriptionSubmission> captor = ArgumentCaptor.forClass(PrescriptionSubmission.class);
        verify(pipelineService).submitPrescription(eq("p-002"), captor.capture());
        assertThat(captor.getValue().getPrescriptionId()).isEqualTo("rx-1");
        assertThat(captor.getValue().getMedications()).hasSize(2);
        assertThat(captor.getValue().getMedications().get(1).getFrequency()).isEqualTo("tid");
    }

    @Test
    @DisplayName("Should serialize the interaction report")
    void testSubmitWithReport() {
        PipelineResult result = PipelineResult.builder()
            .patientId("p-002")
            .trigger(PipelineResult.PRESCRIPTION_SUBMITTED)
            .status(ProcessingStatus.COMPLETE)
            .interactionReport(InteractionReport.builder().checkedDrugId("aspirin").build())
            .build();
        when(pipelineService.submitPrescription(eq("p-002"), any(PrescriptionSubmission.class))).thenReturn(Mono.just(result));

        webTestClient
            .post()
            .uri("/patients/p-002/prescriptions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"text\": \"Aspirin 81mg daily\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("COMPLETE")
            .jsonPath("$.interactionReport.checkedDrugIds[0]").isEqualTo("aspirin")
            .jsonPath("$.interactionReport.findings.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("Should return 400 for an empty prescription")
    void testEmptyPrescription() {
        when(pipelineService.submitPrescription(eq("p-002"), any(PrescriptionSubmission.class)))
            .thenReturn(Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "text, documentBase64 or medications is required")));

        webTestClient
            .post()
            .uri("/patients/p-002/prescriptions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.retryable").isEqualTo(false);
    }

    @Test
    @DisplayName("Should list stored prescriptions with raw JSON columns")
    void testGetPrescriptions() {
        Prescription prescription = Prescription.builder()
            .prescriptionId("rx-1")
            .patientId("p-002")
            .rawText("Lisinopril 10mg")
            .medications("[{\"rawName\":\"Lisinopril\",\"dose\":\"10mg\"}]")
            .flags("[]")
            .status("COMPLETE")
            .uploadedAt(LocalDateTime.parse("2025-08-01T12:00:00"))
            .build();
        when(recordService.getPrescriptions("p-002")).thenReturn(Flux.just(prescription));

        webTestClient
            .get()
            .uri("/patients/p-002/prescriptions")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].prescriptionId").isEqualTo("rx-1")
            .jsonPath("$[0].medications[0].rawName").isEqualTo("Lisinopril")
            .jsonPath("$[0].flags.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("Should store an interaction override")
    void testAddOverride() {
        InteractionOverride override = InteractionOverride.builder()
            .patientId("p-002")
            .pairKey("ibuprofen|lisinopril")
            .clinicianId("dr-smith")
            .note("monitor potassium")
            .createdAt(LocalDateTime.parse("2025-08-01T12:00:00"))
            .build();
        when(pipelineService.addOverride(eq("p-002"), any(InteractionOverrideRequest.class))).thenReturn(Mono.just(override));

        webTestClient
            .post()
            .uri("/patients/p-002/interaction-overrides")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"drugA\": \"Lisinopril\", \"drugB\": \"Ibuprofen\", \"clinicianId\": \"dr-smith\", \"note\": \"monitor potassium\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.pairKey").isEqualTo("ibuprofen|lisinopril")
            .jsonPath("$.clinicianId").isEqualTo("dr-smith");
    }

    @Test
    @DisplayName("Should return 400 when the override names no clinician")
    void testAddOverrideWithoutClinician() {
        when(pipelineService.addOverride(eq("p-002"), any(InteractionOverrideRequest.class)))
            .thenReturn(Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "drugA, drugB and clinicianId are required")));

        webTestClient
            .post()
            .uri("/patients/p-002/interaction-overrides")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"drugA\": \"Lisinopril\", \"drugB\": \"Ibuprofen\"}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.message").isEqualTo("drugA, drugB and clinicianId are required");
    }
}
