package com.healthrevo.decision.anomaly;

import com.healthrevo.decision.exception.AlertAlreadyAcknowledgedException;
import com.healthrevo.decision.exception.InvariantViolationException;
import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.AlertState;
import com.healthrevo.decision.model.AlertType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertStateMachineTest {

    private static final LocalDateTime DETECTED = LocalDateTime.of(2024, 3, 8, 9, 0);

    private final AlertStateMachine stateMachine = new AlertStateMachine();

    @Test
    @DisplayName("Should open a new alert when none is open")
    void testOpen() {
        AlertTransition transition = stateMachine.decide(candidate(AlertSeverity.URGENT), Optional.empty());

        assertThat(transition.getKind()).isEqualTo(TransitionKind.OPEN);
        assertThat(transition.getExisting()).isNull();
        assertThat(transition.resultingSeverity()).isEqualTo(AlertSeverity.URGENT);
    }

    @Test
    @DisplayName("Should re-affirm an open alert at the same or lower severity without downgrading")
    void testReaffirm() {
        AlertState open = open(AlertSeverity.URGENT, false);

        AlertTransition same = stateMachine.decide(candidate(AlertSeverity.URGENT), Optional.of(open));
        AlertTransition lower = stateMachine.decide(candidate(AlertSeverity.MILD), Optional.of(open));

        assertThat(same.getKind()).isEqualTo(TransitionKind.REAFFIRM);
        assertThat(lower.getKind()).isEqualTo(TransitionKind.REAFFIRM);
        assertThat(lower.resultingSeverity()).isEqualTo(AlertSeverity.URGENT);
    }

    @Test
    @DisplayName("Should upgrade an open alert when the new severity is higher")
    void testUpgrade() {
        AlertTransition transition = stateMachine.decide(candidate(AlertSeverity.CRITICAL),
            Optional.of(open(AlertSeverity.MILD, false)));

        assertThat(transition.getKind()).isEqualTo(TransitionKind.UPGRADE);
        assertThat(transition.getExisting().getAlertId()).isEqualTo("a-1");
        assertThat(transition.resultingSeverity()).isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should fail when an acknowledged alert is returned as open")
    void testAcknowledgedAsOpen() {
        assertThatThrownBy(() -> stateMachine.decide(candidate(AlertSeverity.URGENT),
            Optional.of(open(AlertSeverity.URGENT, true))))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("a-1");
    }

    @Test
    @DisplayName("Should fail when the open alert belongs to another root cause")
    void testMismatchedRootCause() {
        AlertState other = AlertState.builder()
            .alertId("a-2")
            .patientId("p-1")
            .type(AlertType.ANOMALY)
            .rootCauseKey("vitals:diastolic")
            .severity(AlertSeverity.MILD)
            .generatedAt(DETECTED)
            .build();

        assertThatThrownBy(() -> stateMachine.decide(candidate(AlertSeverity.URGENT), Optional.of(other)))
            .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    @DisplayName("Should acknowledge once and reject a second acknowledgment")
    void testAcknowledge() {
        AlertState acknowledged = stateMachine.acknowledge(open(AlertSeverity.URGENT, false), "dr-kim");

        assertThat(acknowledged.isAcknowledged()).isTrue();
        assertThat(acknowledged.getAlertId()).isEqualTo("a-1");
        assertThatThrownBy(() -> stateMachine.acknowledge(acknowledged, "dr-kim"))
            .isInstanceOf(AlertAlreadyAcknowledgedException.class);
        assertThatThrownBy(() -> stateMachine.acknowledge(open(AlertSeverity.URGENT, false), " "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should open exactly one alert across repeated evaluations until acknowledged, then a new one")
    void testSingleOpenAlertPerRootCause() {
        List<AlertState> store = new ArrayList<>();
        int opened = 0;
        for (int run = 0; run < 5; run++) {
            AlertTransition transition = stateMachine.decide(candidate(AlertSeverity.URGENT), findOpen(store));
            if (transition.getKind() == TransitionKind.OPEN) {
                opened++;
                store.add(newAlert("a-" + opened));
            }
        }
        assertThat(opened).isEqualTo(1);

        store.set(0, stateMachine.acknowledge(store.get(0), "dr-kim"));
        AlertTransition afterAck = stateMachine.decide(candidate(AlertSeverity.URGENT), findOpen(store));

        assertThat(afterAck.getKind()).isEqualTo(TransitionKind.OPEN);
    }

    private static Optional<AlertState> findOpen(List<AlertState> store) {
        return store.stream().filter(alert -> !alert.isAcknowledged()).findFirst();
    }

    private static AlertState newAlert(String id) {
        return AlertState.builder()
            .alertId(id)
            .patientId("p-1")
            .type(AlertType.ANOMALY)
            .rootCauseKey("vitals:systolic")
            .severity(AlertSeverity.URGENT)
            .generatedAt(DETECTED)
            .build();
    }

    private static AlertState open(AlertSeverity severity, boolean acknowledged) {
        return AlertState.builder()
            .alertId("a-1")
            .patientId("p-1")
            .type(AlertType.ANOMALY)
            .rootCauseKey("vitals:systolic")
            .severity(severity)
            .generatedAt(DETECTED)
            .acknowledged(acknowledged)
            .build();
    }

    private static AlertCandidate candidate(AlertSeverity severity) {
        return AlertCandidate.builder()
            .type(AlertType.ANOMALY)
            .rootCauseKey("vitals:systolic")
            .severity(severity)
            .title("Hypertensive Crisis")
            .message("Systolic Blood Pressure 185 mmHg is above the limit of 180")
            .metadata(Map.of("value", 185.0))
            .build();
    }
}
