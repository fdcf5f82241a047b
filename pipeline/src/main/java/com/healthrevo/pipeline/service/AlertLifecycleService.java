package com.healthrevo.pipeline.service;

import com.healthrevo.decision.anomaly.AlertCandidate;
import com.healthrevo.decision.anomaly.AlertStateMachine;
import com.healthrevo.decision.anomaly.AlertTransition;
import com.healthrevo.decision.model.AlertState;
import com.healthrevo.pipeline.dto.AlertOutcome;
import com.healthrevo.pipeline.model.Alert;
import com.healthrevo.pipeline.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies alert candidates to the stored alerts of one patient. Must run inside the patient's
 * serialized run so that lookups of the open alert and the following write are not interleaved.
 */
@Service
public class AlertLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(AlertLifecycleService.class);

    private final RecordStore recordStore;
    private final AlertStateMachine stateMachine;
    private final JsonColumns jsonColumns;

    public AlertLifecycleService(RecordStore recordStore, AlertStateMachine stateMachine, JsonColumns jsonColumns) {
        this.recordStore = recordStore;
        this.stateMachine = stateMachine;
        this.jsonColumns = jsonColumns;
    }

    public Mono<List<AlertOutcome>> apply(String patientId, List<AlertCandidate> candidates, LocalDateTime now) {
        if (candidates.isEmpty()) {
            return Mono.just(List.of());
        }
        logger.info("Applying {} alert candidates for patient {}", candidates.size(), patientId);
        // one candidate at a time: each may read what the previous one wrote
        return Flux.fromIterable(candidates)
            .concatMap(candidate -> applyOne(patientId, candidate, now))
            .collectList();
    }

    private Mono<AlertOutcome> applyOne(String patientId, AlertCandidate candidate, LocalDateTime now) {
        return recordStore.findOpenAlert(patientId, candidate.getType(), candidate.getRootCauseKey())
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(open -> {
                Optional<AlertState> state = open.map(Alert::toState);
                AlertTransition transition = stateMachine.decide(candidate, state);
                switch (transition.getKind()) {
                    case OPEN:
                        return openAlert(patientId, candidate, now)
                            .map(alert -> new AlertOutcome(transition.getKind(), alert));
                    case UPGRADE:
                        return upgradeAlert(open.get(), candidate, now)
                            .map(alert -> new AlertOutcome(transition.getKind(), alert));
                    case REAFFIRM:
                    default:
                        return reaffirm(open.get(), now)
                            .map(alert -> new AlertOutcome(transition.getKind(), alert));
                }
            });
    }

    private Mono<Alert> openAlert(String patientId, AlertCandidate candidate, LocalDateTime now) {
        return recordStore.findLatestAlertTime(patientId)
            .defaultIfEmpty(now)
            .flatMap(latest -> {
                LocalDateTime generatedAt = latest.isAfter(now) ? latest : now;
                Alert alert = Alert.builder()
                    .alertId(UUID.randomUUID().toString())
                    .patientId(patientId)
                    .type(candidate.getType().name())
                    .rootCauseKey(candidate.getRootCauseKey())
                    .severity(candidate.getSeverity().name())
                    .title(candidate.getTitle())
                    .message(candidate.getMessage())
                    .recommendation(candidate.getRecommendation())
                    .metadata(toJson(candidate.getMetadata()))
                    .acknowledged(false)
                    .generatedAt(generatedAt)
                    .lastEvaluatedAt(now)
                    .build();
                return recordStore.appendAlert(alert);
            });
    }

    private Mono<Alert> upgradeAlert(Alert existing, AlertCandidate candidate, LocalDateTime now) {
        logger.info("Upgrading alert {} from {} to {}", existing.getAlertId(), existing.getSeverity(), candidate.getSeverity());
        existing.setSeverity(candidate.getSeverity().name());
        existing.setTitle(candidate.getTitle());
        existing.setMessage(candidate.getMessage());
        existing.setRecommendation(candidate.getRecommendation());
        existing.setMetadata(toJson(candidate.getMetadata()));
        existing.setLastEvaluatedAt(now);
        return recordStore.reaffirmAlert(existing);
    }

    private Mono<Alert> reaffirm(Alert existing, LocalDateTime now) {
        logger.debug("Re-affirming open alert {} ({})", existing.getAlertId(), existing.getRootCauseKey());
        existing.setLastEvaluatedAt(now);
        return recordStore.reaffirmAlert(existing);
    }

    /**
     * Marks an open alert acknowledged. Acknowledgment is terminal.
     */
    public Mono<Alert> acknowledge(String alertId, String reviewerId, LocalDateTime now) {
        return recordStore.findAlert(alertId)
            .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "Alert not found: " + alertId)))
            .flatMap(alert -> {
                stateMachine.acknowledge(alert.toState(), reviewerId);
                return recordStore.acknowledgeAlert(alertId, reviewerId, now);
            });
    }

    private String toJson(Map<String, Object> metadata) {
        return metadata == null || metadata.isEmpty() ? "{}" : jsonColumns.write(metadata);
    }
}
