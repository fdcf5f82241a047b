package com.healthrevo.pipeline.service;

import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.VitalsSample;
import com.healthrevo.decision.risk.RiskScoringEngine;
import com.healthrevo.decision.risk.RiskType;
import com.healthrevo.pipeline.model.Alert;
import com.healthrevo.pipeline.model.InteractionOverride;
import com.healthrevo.pipeline.model.Prescription;
import com.healthrevo.pipeline.model.RiskScore;
import com.healthrevo.pipeline.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Read side of the patient record. Nothing here writes.
 */
@Service
public class PatientRecordService {

    private static final Logger logger = LoggerFactory.getLogger(PatientRecordService.class);

    private final RecordStore recordStore;
    private final RiskScoringEngine riskScoringEngine;
    private final Clock clock;

    public PatientRecordService(RecordStore recordStore, RiskScoringEngine riskScoringEngine, Clock clock) {
        this.recordStore = recordStore;
        this.riskScoringEngine = riskScoringEngine;
        this.clock = clock;
    }

    /**
     * Vitals in {@code [from, to]}; {@code to} defaults to now and {@code from} to the start of
     * the scoring window ending at {@code to}.
     */
    public Flux<VitalsSample> getVitals(String patientId, LocalDateTime from, LocalDateTime to) {
        LocalDateTime end = to == null ? LocalDateTime.now(clock) : to;
        LocalDateTime start = from == null ? end.minus(riskScoringEngine.getConfig().getWindow()) : from;
        if (start.isAfter(end)) {
            return Flux.error(new IllegalArgumentException("from must not be after to"));
        }
        logger.info("Fetching vitals for patient {} between {} and {}", patientId, start, end);
        return recordStore.getVitalsWindow(patientId, start, end);
    }

    public Flux<RiskScore> getCurrentRiskScores(String patientId) {
        return Flux.fromArray(RiskType.values())
            .concatMap(riskType -> recordStore.findCurrentRiskScore(patientId, riskType.name()));
    }

    public Flux<RiskScore> getRiskScoreHistory(String patientId, String riskType) {
        String type = riskType == null || riskType.isBlank() ? null : RiskType.fromLabel(riskType).name();
        return recordStore.findRiskScoreHistory(patientId, type);
    }

    /**
     * Alerts newest first, optionally restricted to one patient, a minimum severity and an
     * acknowledgment state.
     */
    public Flux<Alert> getAlerts(String patientId, String minimumSeverity, Boolean acknowledged) {
        AlertSeverity floor = minimumSeverity == null || minimumSeverity.isBlank() ? null : AlertSeverity.fromLabel(minimumSeverity);
        String patient = patientId == null || patientId.isBlank() ? null : patientId;
        return recordStore.findAlerts(patient)
            .filter(alert -> floor == null || !floor.isHigherThan(AlertSeverity.valueOf(alert.getSeverity())))
            .filter(alert -> acknowledged == null || alert.isAcknowledged() == acknowledged);
    }

    public Flux<Prescription> getPrescriptions(String patientId) {
        return recordStore.findPrescriptions(patientId);
    }

    public Flux<InteractionOverride> getOverrides(String patientId) {
        return recordStore.findOverrides(patientId);
    }
}
