package com.healthrevo.pipeline.store;

import com.healthrevo.decision.exception.AlertAlreadyAcknowledgedException;
import com.healthrevo.decision.exception.InvariantViolationException;
import com.healthrevo.decision.model.AlertType;
import com.healthrevo.decision.model.VitalsSample;
import com.healthrevo.pipeline.exception.UpstreamUnavailableException;
import com.healthrevo.pipeline.model.Alert;
import com.healthrevo.pipeline.model.InteractionOverride;
import com.healthrevo.pipeline.model.Prescription;
import com.healthrevo.pipeline.model.RiskScore;
import com.healthrevo.pipeline.model.VitalsSampleEntity;
import com.healthrevo.pipeline.repository.AlertRepository;
import com.healthrevo.pipeline.repository.InteractionOverrideRepository;
import com.healthrevo.pipeline.repository.PrescriptionRepository;
import com.healthrevo.pipeline.repository.RiskScoreRepository;
import com.healthrevo.pipeline.repository.VitalsSampleRepository;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.time.LocalDateTime;

@Component
public class R2dbcRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(R2dbcRecordStore.class);

    static final String DEPENDENCY = "record-store";

    private final VitalsSampleRepository vitalsRepository;
    private final RiskScoreRepository riskScoreRepository;
    private final AlertRepository alertRepository;
    private final PrescriptionRepository prescriptionRepository;
    private final InteractionOverrideRepository overrideRepository;

    @Value("${cds.store.max-retries:2}")
    private int maxRetries = 2;

    @Value("${cds.store.retry-backoff-millis:50}")
    private long retryBackoffMillis = 50;

    public R2dbcRecordStore(VitalsSampleRepository vitalsRepository, RiskScoreRepository riskScoreRepository,
                            AlertRepository alertRepository, PrescriptionRepository prescriptionRepository,
                            InteractionOverrideRepository overrideRepository) {
        this.vitalsRepository = vitalsRepository;
        this.riskScoreRepository = riskScoreRepository;
        this.alertRepository = alertRepository;
        this.prescriptionRepository = prescriptionRepository;
        this.overrideRepository = overrideRepository;
    }

    @Override
    public Mono<Boolean> recordVitals(VitalsSample sample) {
        Mono<Boolean> call = vitalsRepository.existsBySampleId(sample.getSampleId())
            .flatMap(exists -> {
                if (exists) {
                    logger.info("Sample with ID {} already exists, not storing it again", sample.getSampleId());
                    return Mono.just(false);
                }
                return vitalsRepository.save(VitalsSampleEntity.from(sample))
                    .doOnSuccess(saved -> logger.info("Saved vitals sample: {}", saved.getSampleId()))
                    .thenReturn(true);
            });
        return guarded("recordVitals", call);
    }

    @Override
    public Flux<VitalsSample> getVitalsWindow(String patientId, LocalDateTime from, LocalDateTime to) {
        return guarded("getVitalsWindow", vitalsRepository
            .findByPatientIdAndRecordedAtBetweenOrderByRecordedAtAscSampleIdAsc(patientId, from, to)
            .map(VitalsSampleEntity::toSample));
    }

    @Override
    public Mono<RiskScore> appendRiskScore(RiskScore riskScore) {
        riskScore.setId(null);
        return guarded("appendRiskScore", riskScoreRepository.save(riskScore))
            .doOnSuccess(saved -> logger.debug("Appended {} risk score {} for patient {}",
                saved.getRiskType(), saved.getScore(), saved.getPatientId()));
    }

    @Override
    public Mono<RiskScore> findCurrentRiskScore(String patientId, String riskType) {
        return guarded("findCurrentRiskScore", riskScoreRepository.findCurrent(patientId, riskType));
    }

    @Override
    public Flux<RiskScore> findRiskScoreHistory(String patientId, String riskType) {
        Flux<RiskScore> history = riskType == null
            ? riskScoreRepository.findByPatientIdOrderByComputedAtDescIdDesc(patientId)
            : riskScoreRepository.findByPatientIdAndRiskTypeOrderByComputedAtDescIdDesc(patientId, riskType);
        return guarded("findRiskScoreHistory", history);
    }

    @Override
    public Mono<Alert> appendAlert(Alert alert) {
        alert.setId(null);
        alert.setOpenKey(Alert.openKey(alert.getPatientId(), AlertType.valueOf(alert.getType()), alert.getRootCauseKey()));
        return guarded("appendAlert", alertRepository.save(alert))
            .doOnSuccess(saved -> logger.info("Opened {} alert {} ({}) for patient {}",
                saved.getSeverity(), saved.getAlertId(), saved.getRootCauseKey(), saved.getPatientId()));
    }

    @Override
    public Mono<Alert> findOpenAlert(String patientId, AlertType type, String rootCauseKey) {
        return guarded("findOpenAlert", alertRepository.findByOpenKey(Alert.openKey(patientId, type, rootCauseKey)));
    }

    @Override
    public Mono<Alert> reaffirmAlert(Alert alert) {
        if (alert.getId() == null || alert.isAcknowledged()) {
            return Mono.error(new InvariantViolationException("Only stored open alerts can be re-affirmed: " + alert.getAlertId()));
        }
        return guarded("reaffirmAlert", alertRepository.save(alert));
    }

    @Override
    public Mono<Alert> acknowledgeAlert(String alertId, String reviewerId, LocalDateTime acknowledgedAt) {
        Mono<Alert> call = alertRepository.findByAlertId(alertId)
            .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Alert not found: " + alertId)))
            .flatMap(alert -> {
                if (alert.isAcknowledged()) {
                    return Mono.error(new AlertAlreadyAcknowledgedException(alertId));
                }
                alert.setAcknowledged(true);
                alert.setAcknowledgedBy(reviewerId);
                alert.setAcknowledgedAt(acknowledgedAt);
                alert.setOpenKey(null);
                return alertRepository.save(alert);
            });
        return guarded("acknowledgeAlert", call)
            .doOnSuccess(alert -> logger.info("Alert {} acknowledged by {}", alertId, reviewerId));
    }

    @Override
    public Mono<Alert> findAlert(String alertId) {
        return guarded("findAlert", alertRepository.findByAlertId(alertId));
    }

    @Override
    public Mono<LocalDateTime> findLatestAlertTime(String patientId) {
        return guarded("findLatestAlertTime", alertRepository.findLatestByPatientId(patientId).map(Alert::getGeneratedAt));
    }

    @Override
    public Flux<Alert> findAlerts(String patientId) {
        Flux<Alert> alerts = patientId == null
            ? alertRepository.findAllByOrderByGeneratedAtDesc()
            : alertRepository.findByPatientIdOrderByGeneratedAtDesc(patientId);
        return guarded("findAlerts", alerts);
    }

    @Override
    public Mono<Prescription> savePrescription(Prescription prescription) {
        return guarded("savePrescription", prescriptionRepository.save(prescription))
            .doOnSuccess(saved -> logger.info("Saved prescription {} for patient {}", saved.getPrescriptionId(), saved.getPatientId()));
    }

    @Override
    public Flux<Prescription> findPrescriptions(String patientId) {
        return guarded("findPrescriptions", prescriptionRepository.findByPatientIdOrderByUploadedAtDesc(patientId));
    }

    @Override
    public Mono<InteractionOverride> saveOverride(InteractionOverride override) {
        Mono<InteractionOverride> call = overrideRepository.findByPatientIdAndPairKey(override.getPatientId(), override.getPairKey())
            .flatMap(existing -> {
                existing.setClinicianId(override.getClinicianId());
                existing.setNote(override.getNote());
                existing.setCreatedAt(override.getCreatedAt());
                return overrideRepository.save(existing);
            })
            .switchIfEmpty(Mono.defer(() -> overrideRepository.save(override)));
        return guarded("saveOverride", call);
    }

    @Override
    public Flux<InteractionOverride> findOverrides(String patientId) {
        return guarded("findOverrides", overrideRepository.findByPatientId(patientId));
    }

    private <T> Mono<T> guarded(String operation, Mono<T> call) {
        return call.retryWhen(retrySpec(operation)).onErrorMap(error -> translate(operation, error));
    }

    private <T> Flux<T> guarded(String operation, Flux<T> call) {
        return call.retryWhen(retrySpec(operation)).onErrorMap(error -> translate(operation, error));
    }

    private RetryBackoffSpec retrySpec(String operation) {
        return Retry.backoff(maxRetries, Duration.ofMillis(retryBackoffMillis))
            .filter(R2dbcRecordStore::isTransient)
            .doBeforeRetry(signal -> logger.warn("Record store {} failed ({}), retry {}",
                operation, signal.failure().getMessage(), signal.totalRetries() + 1))
            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure());
    }

    private static boolean isTransient(Throwable error) {
        return error instanceof TransientDataAccessException || error instanceof R2dbcTransientException;
    }

    private static Throwable translate(String operation, Throwable error) {
        if (error instanceof DataIntegrityViolationException || error instanceof R2dbcDataIntegrityViolationException) {
            logger.error("Record store {} violated a uniqueness constraint: {}", operation, error.getMessage());
            return new InvariantViolationException("Conflicting write in " + operation, error);
        }
        if (isTransient(error) || error instanceof DataAccessResourceFailureException) {
            logger.error("Record store {} unavailable: {}", operation, error.getMessage());
            return new UpstreamUnavailableException(DEPENDENCY, "Record store unavailable during " + operation, error);
        }
        return error;
    }
}
