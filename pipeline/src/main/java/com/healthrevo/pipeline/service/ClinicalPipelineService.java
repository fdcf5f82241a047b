package com.healthrevo.pipeline.service;

import com.healthrevo.decision.anomaly.AlertCandidate;
import com.healthrevo.decision.anomaly.AnomalyDetector;
import com.healthrevo.decision.anomaly.AnomalyEvaluation;
import com.healthrevo.decision.anomaly.EvaluationStatus;
import com.healthrevo.decision.anomaly.InteractionAlertPolicy;
import com.healthrevo.decision.interaction.DrugInteractionChecker;
import com.healthrevo.decision.interaction.InteractionReport;
import com.healthrevo.decision.model.CanonicalDrug;
import com.healthrevo.decision.model.DrugPair;
import com.healthrevo.decision.model.MedicationMention;
import com.healthrevo.decision.model.VitalsSample;
import com.healthrevo.decision.normalizer.MedicationNormalizer;
import com.healthrevo.decision.normalizer.NormalizationResult;
import com.healthrevo.decision.prescription.DosageReview;
import com.healthrevo.decision.prescription.PrescriptionFinding;
import com.healthrevo.decision.prescription.PrescriptionFlags;
import com.healthrevo.decision.prescription.PrescriptionTextParser;
import com.healthrevo.decision.risk.RiskAssessment;
import com.healthrevo.decision.risk.RiskScoringEngine;
import com.healthrevo.decision.risk.VitalsWindow;
import com.healthrevo.decision.vocabulary.VocabularySnapshot;
import com.healthrevo.decision.vocabulary.VocabularyStore;
import com.healthrevo.pipeline.client.TextExtractionClient;
import com.healthrevo.pipeline.dto.InteractionOverrideRequest;
import com.healthrevo.pipeline.dto.PipelineResult;
import com.healthrevo.pipeline.dto.PrescriptionSubmission;
import com.healthrevo.pipeline.dto.VitalsSubmission;
import com.healthrevo.pipeline.exception.UpstreamUnavailableException;
import com.healthrevo.pipeline.model.Alert;
import com.healthrevo.pipeline.model.InteractionOverride;
import com.healthrevo.pipeline.model.Prescription;
import com.healthrevo.pipeline.model.ProcessingStatus;
import com.healthrevo.pipeline.store.RecordStore;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs the decision pipeline for the two triggers, "vitals recorded" and "prescription
 * submitted", and for alert acknowledgment. All three are serialized per patient. This is the
 * only writer of risk scores and alerts.
 */
@Service
public class ClinicalPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(ClinicalPipelineService.class);

    static final String GAP_VITALS_WINDOW = "vitals-window";
    static final String GAP_OCR = "ocr";
    static final String GAP_CHAT = "chat";

    private final RecordStore recordStore;
    private final PatientRunSerializer serializer;
    private final PipelinePersistenceService persistenceService;
    private final AlertLifecycleService alertLifecycleService;
    private final ClinicalSummaryService summaryService;
    private final TextExtractionClient textExtractionClient;
    private final VocabularyStore vocabularyStore;
    private final PrescriptionTextParser textParser;
    private final MedicationNormalizer normalizer;
    private final DosageReview dosageReview;
    private final DrugInteractionChecker interactionChecker;
    private final InteractionAlertPolicy interactionAlertPolicy;
    private final RiskScoringEngine riskScoringEngine;
    private final AnomalyDetector anomalyDetector;
    private final JsonColumns jsonColumns;
    private final Clock clock;

    public ClinicalPipelineService(RecordStore recordStore, PatientRunSerializer serializer,
                                   PipelinePersistenceService persistenceService, AlertLifecycleService alertLifecycleService,
                                   ClinicalSummaryService summaryService, TextExtractionClient textExtractionClient,
                                   VocabularyStore vocabularyStore, PrescriptionTextParser textParser,
                                   MedicationNormalizer normalizer, DosageReview dosageReview,
                                   DrugInteractionChecker interactionChecker, InteractionAlertPolicy interactionAlertPolicy,
                                   RiskScoringEngine riskScoringEngine, AnomalyDetector anomalyDetector,
                                   JsonColumns jsonColumns, Clock clock) {
        this.recordStore = recordStore;
        this.serializer = serializer;
        this.persistenceService = persistenceService;
        this.alertLifecycleService = alertLifecycleService;
        this.summaryService = summaryService;
        this.textExtractionClient = textExtractionClient;
        this.vocabularyStore = vocabularyStore;
        this.textParser = textParser;
        this.normalizer = normalizer;
        this.dosageReview = dosageReview;
        this.interactionChecker = interactionChecker;
        this.interactionAlertPolicy = interactionAlertPolicy;
        this.riskScoringEngine = riskScoringEngine;
        this.anomalyDetector = anomalyDetector;
        this.jsonColumns = jsonColumns;
        this.clock = clock;
    }

    /**
     * Stores the sample (once per sample id), rescores the patient, evaluates the sample for
     * anomalies and applies the resulting alert candidates.
     */
    public Mono<PipelineResult> recordVitals(String patientId, VitalsSubmission submission) {
        return Mono.fromCallable(() -> toSample(patientId, submission))
            .flatMap(sample -> serializer.serialize(sample.getPatientId(), Mono.defer(() -> runVitals(sample))))
            .flatMap(this::withSummary);
    }

    private Mono<VitalsRun> runVitals(VitalsSample submitted) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime end = later(now, submitted.getRecordedAt());
        VitalsWindow riskWindow = VitalsWindow.trailing(riskScoringEngine.getConfig().getWindow(), end);
        VitalsWindow trendWindow = VitalsWindow.trailing(anomalyDetector.getThresholds().getTrendWindow(), submitted.getRecordedAt());
        LocalDateTime from = riskWindow.getFrom().isBefore(trendWindow.getFrom()) ? riskWindow.getFrom() : trendWindow.getFrom();
        String patientId = submitted.getPatientId();
        List<String> gaps = new ArrayList<>();

        // Committed on its own. If the persist stage rolls back, a replay of the same sample id completes the run.
        return recordStore.recordVitals(submitted)
            .flatMap(stored -> recordStore.getVitalsWindow(patientId, from, end)
                .collectList()
                .map(Optional::of)
                .onErrorResume(UpstreamUnavailableException.class, error -> {
                    logger.warn("Vitals window for patient {} unavailable, scoring skipped: {}", patientId, error.getMessage());
                    gaps.add(GAP_VITALS_WINDOW);
                    return Mono.just(Optional.<List<VitalsSample>>empty());
                })
                .flatMap(window -> {
                    VitalsSample sample = window
                        .flatMap(samples -> samples.stream()
                            .filter(candidate -> candidate.getSampleId().equals(submitted.getSampleId()))
                            .findFirst())
                        .orElse(submitted);
                    List<RiskAssessment> assessments = window
                        .map(samples -> riskScoringEngine.scoreAll(samples.stream().filter(riskWindow::contains).toList()))
                        .orElse(List.of());
                    List<VitalsSample> history = window
                        .map(samples -> samples.stream().filter(trendWindow::contains).toList())
                        .orElse(null);
                    AnomalyEvaluation evaluation = anomalyDetector.evaluate(sample, history);
                    logger.info("Vitals run for patient {} (sample {}, replay={}): {} risk scores, {} alert candidates, trend {}",
                        patientId, sample.getSampleId(), !stored, assessments.size(), evaluation.getCandidates().size(),
                        evaluation.getTrendStatus());

                    return persistenceService.persistVitalsRun(patientId, assessments, evaluation.getCandidates(), now)
                        .map(run -> {
                            PipelineResult result = PipelineResult.builder()
                                .patientId(patientId)
                                .trigger(PipelineResult.VITALS_RECORDED)
                                .sampleId(sample.getSampleId())
                                .replayed(!stored)
                                .riskScores(run.getRiskScores())
                                .trendStatus(evaluation.getTrendStatus())
                                .alerts(new ArrayList<>(run.getAlerts()))
                                .gaps(gaps)
                                .build();
                            return new VitalsRun(result, sample, assessments, evaluation.getCandidates());
                        });
                }));
    }

    private Mono<PipelineResult> withSummary(VitalsRun run) {
        PipelineResult result = run.getResult();
        if (!summaryService.isEnabled()) {
            return Mono.just(finish(result));
        }
        return summaryService.summarize(run.getSample(), run.getAssessments(), run.getCandidates())
            .map(summary -> {
                result.setSummary(summary);
                return finish(result);
            })
            .onErrorResume(UpstreamUnavailableException.class, error -> {
                logger.warn("Clinical summary skipped for patient {}: {}", result.getPatientId(), error.getMessage());
                result.getGaps().add(GAP_CHAT);
                return Mono.just(finish(result));
            })
            .switchIfEmpty(Mono.fromCallable(() -> finish(result)));
    }

    VitalsSample toSample(String patientId, VitalsSubmission submission) {
        if (patientId == null || patientId.trim().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "patientId is required");
        }
        if (submission == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "vitals are required");
        }
        checkRange("systolic", submission.getSystolic(), 0, 300);
        checkRange("diastolic", submission.getDiastolic(), 0, 200);
        checkRange("heartRate", submission.getHeartRate(), 0, 300);
        checkRange("oxygenSaturation", submission.getOxygenSaturation(), 0, 100);

        Double temperature = submission.getTemperature();
        if (temperature != null && temperature > 45) {
            temperature = round2((temperature - 32.0) * 5.0 / 9.0);
        }
        Double weight = submission.getWeight();
        if (weight != null && weight > 200) {
            weight = round2(weight / 2.20462);
        }

        VitalsSample sample = VitalsSample.builder()
            .sampleId(submission.getSampleId() == null || submission.getSampleId().isBlank()
                ? UUID.randomUUID().toString() : submission.getSampleId().trim())
            .patientId(patientId.trim())
            .recordedAt(submission.getRecordedAt() == null ? LocalDateTime.now(clock) : submission.getRecordedAt())
            .systolic(submission.getSystolic())
            .diastolic(submission.getDiastolic())
            .heartRate(submission.getHeartRate())
            .temperature(temperature)
            .bloodGlucose(submission.getBloodGlucose())
            .oxygenSaturation(submission.getOxygenSaturation())
            .weight(weight)
            .note(submission.getNote())
            .build();
        if (!sample.hasAnyMeasurement()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "at least one vital measurement is required");
        }
        return sample;
    }

    private static void checkRange(String field, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " must be between " + min + " and " + max);
        }
    }

    /**
     * Normalizes the prescription's medications against one vocabulary snapshot, reviews doses,
     * checks interactions and applies the resulting alert candidates.
     */
    public Mono<PipelineResult> submitPrescription(String patientId, PrescriptionSubmission submission) {
        return Mono.fromCallable(() -> validatePrescription(patientId, submission))
            .flatMap(valid -> {
                List<String> gaps = new ArrayList<>();
                return resolveMentions(valid, gaps)
                    .flatMap(input -> serializer.serialize(patientId.trim(),
                        Mono.defer(() -> runPrescription(patientId.trim(), valid, input, gaps))));
            });
    }

    private PrescriptionSubmission validatePrescription(String patientId, PrescriptionSubmission submission) {
        if (patientId == null || patientId.trim().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "patientId is required");
        }
        if (submission == null || (isBlank(submission.getText()) && isBlank(submission.getDocumentBase64())
            && (submission.getMedications() == null || submission.getMedications().isEmpty()))) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "text, documentBase64 or medications is required");
        }
        return submission;
    }

    private Mono<PrescriptionInput> resolveMentions(PrescriptionSubmission submission, List<String> gaps) {
        if (submission.getMedications() != null && !submission.getMedications().isEmpty()) {
            String rawText = isBlank(submission.getText())
                ? submission.getMedications().stream().map(MedicationMention::getRawName)
                    .filter(Objects::nonNull).collect(Collectors.joining("\n"))
                : submission.getText();
            return Mono.just(new PrescriptionInput(rawText, submission.getMedications()));
        }
        if (!isBlank(submission.getText())) {
            return Mono.just(new PrescriptionInput(submission.getText(), textParser.parse(submission.getText())));
        }
        String contentType = isBlank(submission.getContentType()) ? "application/pdf" : submission.getContentType();
        return textExtractionClient.extractText(submission.getDocumentBase64(), contentType)
            .map(text -> new PrescriptionInput(text, textParser.parse(text)))
            .onErrorResume(UpstreamUnavailableException.class, error -> {
                logger.warn("Text extraction failed, prescription stored without medications: {}", error.getMessage());
                gaps.add(GAP_OCR);
                return Mono.just(new PrescriptionInput("", null));
            });
    }

    private Mono<PipelineResult> runPrescription(String patientId, PrescriptionSubmission submission,
                                                 PrescriptionInput input, List<String> gaps) {
        LocalDateTime now = LocalDateTime.now(clock);
        VocabularySnapshot snapshot = vocabularyStore.snapshot();
        List<NormalizationResult> results = input.getMentions() == null
            ? List.of() : normalizer.normalizeAll(input.getMentions(), snapshot);
        List<PrescriptionFinding> dosageFindings = dosageReview.review(results);

        return recordStore.findOverrides(patientId)
            .map(InteractionOverride::toPair)
            .collect(Collectors.toSet())
            .flatMap(accepted -> {
                InteractionReport report = null;
                List<AlertCandidate> candidates = List.of();
                List<PrescriptionFinding> flags = dosageFindings;
                if (input.hasMedicationSet()) {
                    Set<String> drugIds = new LinkedHashSet<>();
                    for (NormalizationResult result : results) {
                        if (result.isMatched()) {
                            drugIds.add(result.getDrugId());
                        }
                    }
                    report = interactionChecker.check(drugIds, snapshot, accepted);
                    candidates = interactionAlertPolicy.candidates(report);
                    flags = PrescriptionFlags.combine(report, dosageFindings);
                }
                ProcessingStatus status = gaps.isEmpty() ? ProcessingStatus.COMPLETE : ProcessingStatus.PARTIAL;
                Prescription prescription = Prescription.builder()
                    .prescriptionId(isBlank(submission.getPrescriptionId())
                        ? UUID.randomUUID().toString() : submission.getPrescriptionId().trim())
                    .patientId(patientId)
                    .rawText(input.getRawText())
                    .medications(jsonColumns.write(results))
                    .flags(jsonColumns.write(flags))
                    .status(status.name())
                    .uploadedAt(now)
                    .build();
                logger.info("Prescription {} for patient {}: {} mentions, {} matched, {} flags, {} alert candidates (snapshot v{})",
                    prescription.getPrescriptionId(), patientId, results.size(),
                    results.stream().filter(NormalizationResult::isMatched).count(), flags.size(), candidates.size(),
                    snapshot.getVersion());

                InteractionReport finalReport = report;
                List<PrescriptionFinding> finalFlags = flags;
                return persistenceService.persistPrescriptionRun(prescription, candidates, now)
                    .map(run -> finish(PipelineResult.builder()
                        .patientId(patientId)
                        .trigger(PipelineResult.PRESCRIPTION_SUBMITTED)
                        .prescription(prescription)
                        .normalization(results)
                        .interactionStatus(finalReport == null ? EvaluationStatus.NOT_EVALUATED : EvaluationStatus.EVALUATED)
                        .interactionReport(finalReport)
                        .findings(finalFlags)
                        .alerts(new ArrayList<>(run.getAlerts()))
                        .gaps(gaps)
                        .build()));
            });
    }

    public Mono<Alert> acknowledge(String alertId, String reviewerId) {
        if (reviewerId == null || reviewerId.isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "reviewerId is required"));
        }
        return recordStore.findAlert(alertId)
            .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Alert not found: " + alertId)))
            .flatMap(alert -> serializer.serialize(alert.getPatientId(),
                Mono.defer(() -> alertLifecycleService.acknowledge(alertId, reviewerId.trim(), LocalDateTime.now(clock)))));
    }

    /**
     * Accepts a drug pair for the patient with monitoring. Later checks still report the pair but
     * raise no alert for it. Each drug may be given by canonical id, name or alias; anything the
     * current vocabulary does not know is rejected.
     */
    public Mono<InteractionOverride> addOverride(String patientId, InteractionOverrideRequest request) {
        if (request == null || isBlank(request.getDrugA()) || isBlank(request.getDrugB()) || isBlank(request.getClinicianId())) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "drugA, drugB and clinicianId are required"));
        }
        VocabularySnapshot snapshot = vocabularyStore.snapshot();
        Optional<CanonicalDrug> drugA = normalizer.lookup(request.getDrugA(), snapshot);
        if (drugA.isEmpty()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown drug: " + request.getDrugA().trim()));
        }
        Optional<CanonicalDrug> drugB = normalizer.lookup(request.getDrugB(), snapshot);
        if (drugB.isEmpty()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown drug: " + request.getDrugB().trim()));
        }
        if (drugA.get().getId().equals(drugB.get().getId())) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "drugA and drugB must name two different drugs"));
        }
        InteractionOverride override = InteractionOverride.builder()
            .patientId(patientId.trim())
            .pairKey(DrugPair.of(drugA.get().getId(), drugB.get().getId()).key())
            .clinicianId(request.getClinicianId().trim())
            .note(request.getNote())
            .createdAt(LocalDateTime.now(clock))
            .build();
        logger.info("Clinician {} accepted {} for patient {} with monitoring", override.getClinicianId(), override.getPairKey(), patientId);
        return serializer.serialize(override.getPatientId(), Mono.defer(() -> recordStore.saveOverride(override)));
    }

    private static PipelineResult finish(PipelineResult result) {
        result.setStatus(result.getGaps().isEmpty() ? ProcessingStatus.COMPLETE : ProcessingStatus.PARTIAL);
        return result;
    }

    private static LocalDateTime later(LocalDateTime a, LocalDateTime b) {
        return b != null && b.isAfter(a) ? b : a;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    private static class VitalsRun {
        PipelineResult result;
        VitalsSample sample;
        List<RiskAssessment> assessments;
        List<AlertCandidate> candidates;
    }

    /** Text and mentions of a prescription; {@code mentions} is null when the text could not be obtained. */
    @Value
    private static class PrescriptionInput {
        String rawText;
        List<MedicationMention> mentions;

        boolean hasMedicationSet() {
            return mentions != null && !mentions.isEmpty();
        }
    }
}
