package com.healthrevo.pipeline.store;

import com.healthrevo.decision.model.AlertType;
import com.healthrevo.decision.model.VitalsSample;
import com.healthrevo.pipeline.model.Alert;
import com.healthrevo.pipeline.model.InteractionOverride;
import com.healthrevo.pipeline.model.Prescription;
import com.healthrevo.pipeline.model.RiskScore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Persistent store for vitals, risk score history, alerts, prescriptions and interaction
 * overrides. Failures surface as {@code UpstreamUnavailableException} (store unreachable after
 * retries) or {@code InvariantViolationException} (uniqueness clash).
 */
public interface RecordStore {

    /**
     * @return true when the sample was stored, false when a sample with the same id already existed
     */
    Mono<Boolean> recordVitals(VitalsSample sample);

    /**
     * Samples of the patient recorded in {@code [from, to]}, ordered by time then id.
     */
    Flux<VitalsSample> getVitalsWindow(String patientId, LocalDateTime from, LocalDateTime to);

    Mono<RiskScore> appendRiskScore(RiskScore riskScore);

    Mono<RiskScore> findCurrentRiskScore(String patientId, String riskType);

    Flux<RiskScore> findRiskScoreHistory(String patientId, String riskType);

    Mono<Alert> appendAlert(Alert alert);

    Mono<Alert> findOpenAlert(String patientId, AlertType type, String rootCauseKey);

    /**
     * Persists changes to an open alert (severity upgrade or a new evaluation time).
     */
    Mono<Alert> reaffirmAlert(Alert alert);

    Mono<Alert> acknowledgeAlert(String alertId, String reviewerId, LocalDateTime acknowledgedAt);

    Mono<Alert> findAlert(String alertId);

    Mono<LocalDateTime> findLatestAlertTime(String patientId);

    Flux<Alert> findAlerts(String patientId);

    Mono<Prescription> savePrescription(Prescription prescription);

    Flux<Prescription> findPrescriptions(String patientId);

    Mono<InteractionOverride> saveOverride(InteractionOverride override);

    Flux<InteractionOverride> findOverrides(String patientId);
}
