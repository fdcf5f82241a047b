package com.healthrevo.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.healthrevo.decision.anomaly.AlertCandidate;
import com.healthrevo.decision.anomaly.AnomalyDetector;
import com.healthrevo.decision.anomaly.AnomalyThresholds;
import com.healthrevo.decision.anomaly.EvaluationStatus;
import com.healthrevo.decision.anomaly.InteractionAlertPolicy;
import com.healthrevo.decision.exception.InvariantViolationException;
import com.healthrevo.decision.interaction.DrugInteractionChecker;
import com.healthrevo.decision.interaction.InteractionSettings;
import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.AlertType;
import com.healthrevo.decision.model.CanonicalDrug;
import com.healthrevo.decision.model.DrugPair;
import com.healthrevo.decision.model.InteractionRecord;
import com.healthrevo.decision.model.InteractionSeverity;
import com.healthrevo.decision.model.MedicationMention;
import com.healthrevo.decision.model.VitalsSample;
import com.healthrevo.decision.normalizer.MedicationNormalizer;
import com.healthrevo.decision.normalizer.NormalizedLevenshteinSimilarity;
import com.healthrevo.decision.normalizer.NormalizerSettings;
import com.healthrevo.decision.prescription.DosageReview;
import com.healthrevo.decision.prescription.DoseLimit;
import com.healthrevo.decision.prescription.PrescriptionTextParser;
import com.healthrevo.decision.risk.RiskAssessment;
import com.healthrevo.decision.risk.RiskScoringConfig;
import com.healthrevo.decision.risk.RiskScoringEngine;
import com.healthrevo.decision.vocabulary.VocabularySnapshot;
import com.healthrevo.decision.vocabulary.VocabularyStore;
import com.healthrevo.pipeline.client.TextExtractionClient;
import com.healthrevo.pipeline.dto.InteractionOverrideRequest;
import com.healthrevo.pipeline.dto.PrescriptionSubmission;
import com.healthrevo.pipeline.dto.VitalsSubmission;
import com.healthrevo.pipeline.exception.UpstreamUnavailableException;
import com.healthrevo.pipeline.model.InteractionOverride;
import com.healthrevo.pipeline.model.Prescription;
import com.healthrevo.pipeline.model.ProcessingStatus;
import com.healthrevo.pipeline.store.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ClinicalPipelineServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.parse("2025-08-01T12:00:00");

    @Mock
    private RecordStore recordStore;

    @Mock
    private PipelinePersistenceService persistenceService;

    @Mock
    private AlertLifecycleService alertLifecycleService;

    @Mock
    private ClinicalSummaryService summaryService;

    @Mock
    private TextExtractionClient textExtractionClient;

    private ClinicalPipelineService service;

    @BeforeEach
    void setUp() {
        VocabularyStore vocabularyStore = new VocabularyStore(vocabulary());
        InteractionSettings interactionSettings = InteractionSettings.defaults();
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        service = new ClinicalPipelineService(
            recordStore,
            new PatientRunSerializer(),
            persistenceService,
            alertLifecycleService,
            summaryService,
            textExtractionClient,
            vocabularyStore,
            new PrescriptionTextParser(),
            new MedicationNormalizer(new NormalizedLevenshteinSimilarity(), NormalizerSettings.defaults()),
            new DosageReview(List.of(DoseLimit.builder().drugId("acetaminophen").reviewAtMg(1000).build())),
            new DrugInteractionChecker(interactionSettings),
            new InteractionAlertPolicy(interactionSettings),
            new RiskScoringEngine(RiskScoringConfig.defaults()),
            new AnomalyDetector(AnomalyThresholds.defaults()),
            new JsonColumns(mapper),
            Clock.fixed(Instant.parse("2025-08-01T12:00:00Z"), ZoneOffset.UTC));
        lenient().when(summaryService.isEnabled()).thenReturn(false);
    }

    private static VocabularySnapshot vocabulary() {
        List<CanonicalDrug> drugs = List.of(
            CanonicalDrug.builder().id("lisinopril").name("Lisinopril").alias("Zestril").build(),
            CanonicalDrug.builder().id("ibuprofen").name("Ibuprofen").alias("Advil").build(),
            CanonicalDrug.builder().id("aspirin").name("Aspirin").build(),
            CanonicalDrug.builder().id("acetaminophen").name("Acetaminophen").alias("Paracetamol").build());
        List<InteractionRecord> interactions = List.of(
            InteractionRecord.builder()
                .pair(DrugPair.of("lisinopril", "ibuprofen"))
                .severity(InteractionSeverity.MODERATE)
                .description("NSAIDs may reduce the effect of ACE inhibitors")
                .build());
        return VocabularySnapshot.of(drugs, interactions);
    }

    private static VitalsSample baseline(String id, int daysAgo, int systolic) {
        return VitalsSample.builder()
            .sampleId(id)
            .patientId("p-001")
            .recordedAt(NOW.minusDays(daysAgo))
            .systolic(systolic)
            .diastolic(80)
            .build();
    }

    private static VitalsSubmission crisis() {
        return VitalsSubmission.builder()
            .sampleId("s-new")
            .recordedAt(NOW)
            .systolic(185)
            .diastolic(95)
            .build();
    }

    private static VitalsSample stored(VitalsSubmission submission) {
        return VitalsSample.builder()
            .sampleId(submission.getSampleId())
            .patientId("p-001")
            .recordedAt(submission.getRecordedAt())
            .systolic(submission.getSystolic())
            .diastolic(submission.getDiastolic())
            .build();
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<List<AlertCandidate>> candidateCaptor() {
        return ArgumentCaptor.forClass(List.class);
    }

    @Test
    @DisplayName("Should reject out of range vitals before touching the store")
    void testRejectsOutOfRangeVitals() {
        VitalsSubmission submission = VitalsSubmission.builder().systolic(350).diastolic(80).build();

        StepVerifier.create(service.recordVitals("p-001", submission))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(ResponseStatusException.class);
                assertThat(((ResponseStatusException) error).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                assertThat(((ResponseStatusException) error).getReason()).isEqualTo("systolic must be between 0 and 300");
            })
            .verify();

        verifyNoInteractions(recordStore, persistenceService);
    }

    @Test
    @DisplayName("Should reject a submission without any measurement")
    void testRejectsEmptySample() {
        StepVerifier.create(service.recordVitals("p-001", VitalsSubmission.builder().note("felt dizzy").build()))
            .expectError(ResponseStatusException.class)
            .verify();
    }

    @Test
    @DisplayName("Should convert Fahrenheit temperatures and pound weights")
    void testUnitConversion() {
        VitalsSample sample = service.toSample("p-001",
            VitalsSubmission.builder().temperature(98.6).weight(220.0).build());

        assertThat(sample.getTemperature()).isEqualTo(37.0);
        assertThat(sample.getWeight()).isEqualTo(99.79);
        assertThat(sample.getRecordedAt()).isEqualTo(NOW);
        assertThat(sample.getSampleId()).isNotBlank();
    }

    @Test
    @DisplayName("A systolic crisis after a stable week opens one urgent anomaly candidate")
    void testCrisisAfterStableWeek() {
        VitalsSubmission submission = crisis();
        when(recordStore.recordVitals(any(VitalsSample.class))).thenReturn(Mono.just(true));
        when(recordStore.getVitalsWindow(eq("p-001"), any(LocalDateTime.class), eq(NOW)))
            .thenReturn(Flux.just(baseline("s-1", 3, 120), baseline("s-2", 2, 124), baseline("s-3", 1, 122), stored(submission)));
        when(persistenceService.persistVitalsRun(eq("p-001"), anyList(), anyList(), eq(NOW)))
            .thenReturn(Mono.just(PersistedRun.builder().build()));

        StepVerifier.create(service.recordVitals("p-001", submission))
            .assertNext(result -> {
                assertThat(result.getStatus()).isEqualTo(ProcessingStatus.COMPLETE);
                assertThat(result.getGaps()).isEmpty();
                assertThat(result.getReplayed()).isFalse();
                assertThat(result.getTrendStatus()).isEqualTo(EvaluationStatus.EVALUATED);
            })
            .verifyComplete();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RiskAssessment>> assessments = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<AlertCandidate>> candidates = candidateCaptor();
        verify(persistenceService).persistVitalsRun(eq("p-001"), assessments.capture(), candidates.capture(), eq(NOW));
        assertThat(assessments.getValue()).hasSize(3);
        assertThat(candidates.getValue()).hasSize(1);
        AlertCandidate candidate = candidates.getValue().get(0);
        assertThat(candidate.getType()).isEqualTo(AlertType.ANOMALY);
        assertThat(candidate.getRootCauseKey()).isEqualTo("vitals:systolic");
        assertThat(candidate.getSeverity()).isEqualTo(AlertSeverity.URGENT);
    }

    @Test
    @DisplayName("An unavailable vitals window skips scoring but still checks absolute limits")
    void testWindowUnavailable() {
        when(recordStore.recordVitals(any(VitalsSample.class))).thenReturn(Mono.just(true));
        when(recordStore.getVitalsWindow(eq("p-001"), any(LocalDateTime.class), any(LocalDateTime.class)))
            .thenReturn(Flux.error(new UpstreamUnavailableException("record-store", "timeout", null)));
        when(persistenceService.persistVitalsRun(eq("p-001"), anyList(), anyList(), eq(NOW)))
            .thenReturn(Mono.just(PersistedRun.builder().build()));

        StepVerifier.create(service.recordVitals("p-001", crisis()))
            .assertNext(result -> {
                assertThat(result.getStatus()).isEqualTo(ProcessingStatus.PARTIAL);
                assertThat(result.getGaps()).containsExactly("vitals-window");
                assertThat(result.getTrendStatus()).isEqualTo(EvaluationStatus.NOT_EVALUATED);
            })
            .verifyComplete();

        ArgumentCaptor<List<AlertCandidate>> candidates = candidateCaptor();
        verify(persistenceService).persistVitalsRun(eq("p-001"), eq(List.of()), candidates.capture(), eq(NOW));
        assertThat(candidates.getValue()).extracting(AlertCandidate::getSeverity).containsExactly(AlertSeverity.URGENT);
    }

    @Test
    @DisplayName("A replayed sample re-runs the pipeline and is reported as a replay")
    void testReplay() {
        VitalsSubmission submission = crisis();
        when(recordStore.recordVitals(any(VitalsSample.class))).thenReturn(Mono.just(false));
        when(recordStore.getVitalsWindow(eq("p-001"), any(LocalDateTime.class), eq(NOW)))
            .thenReturn(Flux.just(stored(submission)));
        when(persistenceService.persistVitalsRun(eq("p-001"), anyList(), anyList(), eq(NOW)))
            .thenReturn(Mono.just(PersistedRun.builder().build()));

        StepVerifier.create(service.recordVitals("p-001", submission))
            .assertNext(result -> {
                assertThat(result.getReplayed()).isTrue();
                assertThat(result.getSampleId()).isEqualTo("s-new");
                assertThat(result.getTrendStatus()).isEqualTo(EvaluationStatus.INSUFFICIENT_HISTORY);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("A sample stored before a failed persist is completed by replaying it")
    void testReplayAfterFailedPersist() {
        VitalsSubmission submission = crisis();
        when(recordStore.recordVitals(any(VitalsSample.class))).thenReturn(Mono.just(true), Mono.just(false));
        when(recordStore.getVitalsWindow(eq("p-001"), any(LocalDateTime.class), eq(NOW)))
            .thenReturn(Flux.just(stored(submission)));
        when(persistenceService.persistVitalsRun(eq("p-001"), anyList(), anyList(), eq(NOW)))
            .thenReturn(Mono.error(new InvariantViolationException("open key taken")), Mono.just(PersistedRun.builder().build()));

        StepVerifier.create(service.recordVitals("p-001", submission))
            .expectError(InvariantViolationException.class)
            .verify();

        StepVerifier.create(service.recordVitals("p-001", submission))
            .assertNext(result -> {
                assertThat(result.getReplayed()).isTrue();
                assertThat(result.getStatus()).isEqualTo(ProcessingStatus.COMPLETE);
            })
            .verifyComplete();

        ArgumentCaptor<List<AlertCandidate>> candidates = candidateCaptor();
        verify(persistenceService, times(2)).persistVitalsRun(eq("p-001"), anyList(), candidates.capture(), eq(NOW));
        assertThat(candidates.getAllValues()).allSatisfy(run ->
            assertThat(run).extracting(AlertCandidate::getRootCauseKey).containsExactly("vitals:systolic"));
    }

    @Test
    @DisplayName("A failing summary collaborator marks the run partial without failing it")
    void testSummaryUnavailable() {
        when(summaryService.isEnabled()).thenReturn(true);
        when(summaryService.summarize(any(VitalsSample.class), anyList(), anyList()))
            .thenReturn(Mono.error(new UpstreamUnavailableException("chat", "down", null)));
        when(recordStore.recordVitals(any(VitalsSample.class))).thenReturn(Mono.just(true));
        when(recordStore.getVitalsWindow(eq("p-001"), any(LocalDateTime.class), eq(NOW))).thenReturn(Flux.empty());
        when(persistenceService.persistVitalsRun(eq("p-001"), anyList(), anyList(), eq(NOW)))
            .thenReturn(Mono.just(PersistedRun.builder().build()));

        StepVerifier.create(service.recordVitals("p-001", crisis()))
            .assertNext(result -> {
                assertThat(result.getStatus()).isEqualTo(ProcessingStatus.PARTIAL);
                assertThat(result.getGaps()).containsExactly("chat");
                assertThat(result.getSummary()).isNull();
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("A record store outage while storing the sample fails the request")
    void testStoreUnavailable() {
        when(recordStore.recordVitals(any(VitalsSample.class)))
            .thenReturn(Mono.error(new UpstreamUnavailableException("record-store", "down", null)));

        StepVerifier.create(service.recordVitals("p-001", crisis()))
            .expectError(UpstreamUnavailableException.class)
            .verify();

        verify(persistenceService, never()).persistVitalsRun(anyString(), anyList(), anyList(), any(LocalDateTime.class));
    }

    @Test
    @DisplayName("OCR-garbled medications still produce the known interaction alert")
    void testGarbledPrescription() {
        when(recordStore.findOverrides("p-001")).thenReturn(Flux.empty());
        when(persistenceService.persistPrescriptionRun(any(Prescription.class), anyList(), eq(NOW)))
            .thenReturn(Mono.just(PersistedRun.builder().build()));

        PrescriptionSubmission submission = PrescriptionSubmission.builder()
            .text("Lisinopri1 10mg\nIbuprofen 200mg")
            .build();

        StepVerifier.create(service.submitPrescription("p-001", submission))
            .assertNext(result -> {
                assertThat(result.getStatus()).isEqualTo(ProcessingStatus.COMPLETE);
                assertThat(result.getInteractionStatus()).isEqualTo(EvaluationStatus.EVALUATED);
                assertThat(result.getNormalization()).extracting(r -> r.getDrugId()).containsExactly("lisinopril", "ibuprofen");
                assertThat(result.getInteractionReport().getFindings()).hasSize(1);
                assertThat(result.getInteractionReport().getFindings().get(0).getRecord().getSeverity())
                    .isEqualTo(InteractionSeverity.MODERATE);
                assertThat(result.getPrescription().getStatus()).isEqualTo("COMPLETE");
            })
            .verifyComplete();

        ArgumentCaptor<List<AlertCandidate>> candidates = candidateCaptor();
        verify(persistenceService).persistPrescriptionRun(any(Prescription.class), candidates.capture(), eq(NOW));
        assertThat(candidates.getValue()).extracting(AlertCandidate::getRootCauseKey)
            .containsExactly("interaction:ibuprofen|lisinopril");
    }

    @Test
    @DisplayName("A single medication produces an empty report and no alert")
    void testSingleMedication() {
        when(recordStore.findOverrides("p-001")).thenReturn(Flux.empty());
        when(persistenceService.persistPrescriptionRun(any(Prescription.class), anyList(), eq(NOW)))
            .thenReturn(Mono.just(PersistedRun.builder().build()));

        PrescriptionSubmission submission = PrescriptionSubmission.builder()
            .medications(List.of(MedicationMention.named("Aspirin")))
            .build();

        StepVerifier.create(service.submitPrescription("p-001", submission))
            .assertNext(result -> {
                assertThat(result.getInteractionReport().isEmpty()).isTrue();
                assertThat(result.getAlerts()).isEmpty();
            })
            .verifyComplete();

        verify(persistenceService).persistPrescriptionRun(any(Prescription.class), eq(List.of()), eq(NOW));
    }

    @Test
    @DisplayName("An accepted pair is reported but not alerted")
    void testAcceptedPairNotAlerted() {
        InteractionOverride override = InteractionOverride.builder()
            .patientId("p-001").pairKey("ibuprofen|lisinopril").clinicianId("dr-smith").build();
        when(recordStore.findOverrides("p-001")).thenReturn(Flux.just(override));
        when(persistenceService.persistPrescriptionRun(any(Prescription.class), anyList(), eq(NOW)))
            .thenReturn(Mono.just(PersistedRun.builder().build()));

        PrescriptionSubmission submission = PrescriptionSubmission.builder()
            .medications(List.of(MedicationMention.named("Lisinopril"), MedicationMention.named("Advil")))
            .build();

        StepVerifier.create(service.submitPrescription("p-001", submission))
            .assertNext(result -> {
                assertThat(result.getInteractionReport().getFindings()).hasSize(1);
                assertThat(result.getInteractionReport().getFindings().get(0).isAcceptedWithMonitoring()).isTrue();
            })
            .verifyComplete();

        verify(persistenceService).persistPrescriptionRun(any(Prescription.class), eq(List.of()), eq(NOW));
    }

    @Test
    @DisplayName("A failed text extraction stores a partial prescription and does not report no interactions")
    void testOcrUnavailable() {
        when(textExtractionClient.extractText("JVBERi0=", "application/pdf"))
            .thenReturn(Mono.error(new UpstreamUnavailableException("ocr", "timeout", null)));
        when(recordStore.findOverrides("p-001")).thenReturn(Flux.empty());
        when(persistenceService.persistPrescriptionRun(any(Prescription.class), anyList(), eq(NOW)))
            .thenReturn(Mono.just(PersistedRun.builder().build()));

        PrescriptionSubmission submission = PrescriptionSubmission.builder()
            .documentBase64("JVBERi0=")
            .contentType("application/pdf")
            .build();

        StepVerifier.create(service.submitPrescription("p-001", submission))
            .assertNext(result -> {
                assertThat(result.getStatus()).isEqualTo(ProcessingStatus.PARTIAL);
                assertThat(result.getGaps()).containsExactly("ocr");
                assertThat(result.getInteractionStatus()).isEqualTo(EvaluationStatus.NOT_EVALUATED);
                assertThat(result.getInteractionReport()).isNull();
                assertThat(result.getPrescription().getStatus()).isEqualTo("PARTIAL");
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should reject a prescription without content")
    void testEmptyPrescription() {
        StepVerifier.create(service.submitPrescription("p-001", new PrescriptionSubmission()))
            .expectError(ResponseStatusException.class)
            .verify();
    }

    @Test
    @DisplayName("Should store an override under the canonical pair key")
    void testAddOverride() {
        when(recordStore.saveOverride(any(InteractionOverride.class)))
            .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        InteractionOverrideRequest request = InteractionOverrideRequest.builder()
            .drugA("Lisinopril").drugB("ibuprofen").clinicianId("dr-smith").note("renal panel weekly").build();

        StepVerifier.create(service.addOverride("p-001", request))
            .assertNext(override -> {
                assertThat(override.getPairKey()).isEqualTo("ibuprofen|lisinopril");
                assertThat(override.getCreatedAt()).isEqualTo(NOW);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should resolve brand names to canonical ids when storing an override")
    void testAddOverrideByAlias() {
        when(recordStore.saveOverride(any(InteractionOverride.class)))
            .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        InteractionOverrideRequest request = InteractionOverrideRequest.builder()
            .drugA("Zestril").drugB(" ADVIL ").clinicianId("dr-smith").build();

        StepVerifier.create(service.addOverride("p-001", request))
            .assertNext(override -> assertThat(override.getPairKey()).isEqualTo("ibuprofen|lisinopril"))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should reject an override naming a drug outside the vocabulary")
    void testAddOverrideUnknownDrug() {
        InteractionOverrideRequest request = InteractionOverrideRequest.builder()
            .drugA("Zestril").drugB("Zebrafloxin").clinicianId("dr-smith").build();

        StepVerifier.create(service.addOverride("p-001", request))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(ResponseStatusException.class);
                assertThat(((ResponseStatusException) error).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                assertThat(((ResponseStatusException) error).getReason()).isEqualTo("Unknown drug: Zebrafloxin");
            })
            .verify();

        verify(recordStore, never()).saveOverride(any(InteractionOverride.class));
    }

    @Test
    @DisplayName("Should reject an override whose two names resolve to the same drug")
    void testAddOverrideSameDrug() {
        InteractionOverrideRequest request = InteractionOverrideRequest.builder()
            .drugA("Advil").drugB("ibuprofen").clinicianId("dr-smith").build();

        StepVerifier.create(service.addOverride("p-001", request))
            .expectError(ResponseStatusException.class)
            .verify();

        verify(recordStore, never()).saveOverride(any(InteractionOverride.class));
    }

    @Test
    @DisplayName("Acknowledging without a reviewer is rejected")
    void testAcknowledgeWithoutReviewer() {
        StepVerifier.create(service.acknowledge("alert-1", " "))
            .expectError(ResponseStatusException.class)
            .verify();

        verifyNoInteractions(alertLifecycleService);
    }
}
