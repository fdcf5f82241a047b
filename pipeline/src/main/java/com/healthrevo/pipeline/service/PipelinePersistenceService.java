package com.healthrevo.pipeline.service;

import com.healthrevo.decision.anomaly.AlertCandidate;
import com.healthrevo.decision.risk.RiskAssessment;
import com.healthrevo.pipeline.model.Prescription;
import com.healthrevo.pipeline.model.RiskScore;
import com.healthrevo.pipeline.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Final stage of a pipeline run. Everything a run writes besides the vitals sample itself is
 * written here, in one transaction.
 */
@Service
public class PipelinePersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(PipelinePersistenceService.class);

    private final RecordStore recordStore;
    private final AlertLifecycleService alertLifecycleService;
    private final JsonColumns jsonColumns;

    public PipelinePersistenceService(RecordStore recordStore, AlertLifecycleService alertLifecycleService,
                                      JsonColumns jsonColumns) {
        this.recordStore = recordStore;
        this.alertLifecycleService = alertLifecycleService;
        this.jsonColumns = jsonColumns;
    }

    @Transactional
    public Mono<PersistedRun> persistVitalsRun(String patientId, List<RiskAssessment> assessments,
                                               List<AlertCandidate> candidates, LocalDateTime now) {
        return Flux.fromIterable(assessments)
            .concatMap(assessment -> persistRiskScore(patientId, assessment, now))
            .collectList()
            .flatMap(scores -> alertLifecycleService.apply(patientId, candidates, now)
                .map(alerts -> {
                    int appended = (int) scores.stream().filter(Tuple2::getT2).count();
                    logger.info("Persisted vitals run for patient {}: {} risk scores appended, {} alerts touched",
                        patientId, appended, alerts.size());
                    return PersistedRun.builder()
                        .riskScores(scores.stream().map(Tuple2::getT1).toList())
                        .appendedScores(appended)
                        .alerts(alerts)
                        .build();
                }));
    }

    @Transactional
    public Mono<PersistedRun> persistPrescriptionRun(Prescription prescription, List<AlertCandidate> candidates,
                                                     LocalDateTime now) {
        return recordStore.savePrescription(prescription)
            .then(alertLifecycleService.apply(prescription.getPatientId(), candidates, now))
            .map(alerts -> PersistedRun.builder().alerts(alerts).build());
    }

    /**
     * Appends the assessment unless it equals the current score, so recomputation over an
     * unchanged window leaves the history untouched.
     */
    private Mono<Tuple2<RiskScore, Boolean>> persistRiskScore(String patientId, RiskAssessment assessment,
                                                              LocalDateTime now) {
        RiskScore candidate = RiskScore.builder()
            .patientId(patientId)
            .riskType(assessment.getRiskType().name())
            .score(assessment.getScore())
            .level(assessment.getLevel().name())
            .drivers(jsonColumns.write(assessment.getDrivers()))
            .sampleCount(assessment.getSampleCount())
            .insufficientData(assessment.isInsufficientData())
            .confidence(assessment.getConfidence())
            .method(assessment.getMethod())
            .recommendations(jsonColumns.write(assessment.getRecommendations()))
            .computedAt(now)
            .build();
        return recordStore.findCurrentRiskScore(patientId, candidate.getRiskType())
            .filter(candidate::sameResultAs)
            .map(current -> {
                logger.debug("{} score for patient {} unchanged at {}", current.getRiskType(), patientId, current.getScore());
                return Tuples.of(current, false);
            })
            .switchIfEmpty(Mono.defer(() -> recordStore.appendRiskScore(candidate).map(saved -> Tuples.of(saved, true))));
    }
}
