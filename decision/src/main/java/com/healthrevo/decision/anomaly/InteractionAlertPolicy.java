package com.healthrevo.decision.anomaly;

import com.healthrevo.decision.interaction.CumulativeFinding;
import com.healthrevo.decision.interaction.InteractionFinding;
import com.healthrevo.decision.interaction.InteractionReport;
import com.healthrevo.decision.interaction.InteractionSettings;
import com.healthrevo.decision.model.AlertSeverity;
import com.healthrevo.decision.model.AlertType;
import com.healthrevo.decision.model.InteractionRecord;
import com.healthrevo.decision.model.InteractionSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns an interaction report into alert candidates. Allowlisted pairs and pairs below the
 * configured minimum severity are skipped; cumulative findings without a rule become a mild
 * "review" alert.
 */
public class InteractionAlertPolicy {

    private final InteractionSettings settings;

    public InteractionAlertPolicy(InteractionSettings settings) {
        this.settings = settings;
    }

    public List<AlertCandidate> candidates(InteractionReport report) {
        List<AlertCandidate> candidates = new ArrayList<>();
        for (InteractionFinding finding : report.getFindings()) {
            InteractionRecord record = finding.getRecord();
            if (finding.isAcceptedWithMonitoring() || !record.getSeverity().isAtLeast(settings.getAlertMinimumSeverity())) {
                continue;
            }
            candidates.add(pairCandidate(record));
        }
        for (CumulativeFinding cumulative : report.getCumulativeFindings()) {
            candidates.add(cumulativeCandidate(cumulative));
        }
        return candidates;
    }

    private static AlertCandidate pairCandidate(InteractionRecord record) {
        Map<String, Object> metadata = new TreeMap<>();
        metadata.put("drugs", List.of(record.getPair().getFirst(), record.getPair().getSecond()));
        metadata.put("interaction_severity", record.getSeverity().name().toLowerCase(Locale.ROOT));
        if (record.getMechanism() != null) {
            metadata.put("mechanism", record.getMechanism());
        }
        String recommendation = record.getManagement() == null || record.getManagement().isBlank()
            ? record.getSeverity().recommendation()
            : record.getManagement();
        return AlertCandidate.builder()
            .type(AlertType.DRUG_INTERACTION)
            .rootCauseKey(RootCauseKeys.interaction(record.getPair()))
            .severity(record.getSeverity().toAlertSeverity())
            .title("Drug Interaction: " + record.getPair().getFirst() + " + " + record.getPair().getSecond())
            .message(record.getDescription())
            .recommendation(recommendation)
            .metadata(metadata)
            .build();
    }

    private static AlertCandidate cumulativeCandidate(CumulativeFinding cumulative) {
        Map<String, Object> metadata = new TreeMap<>();
        metadata.put("drugs", cumulative.getDrugIds());
        metadata.put("mechanism", cumulative.getMechanism());
        metadata.put("review_required", cumulative.isReviewRequired());

        InteractionSeverity ruleSeverity = cumulative.getRuleSeverity();
        AlertSeverity severity = ruleSeverity == null ? AlertSeverity.MILD : ruleSeverity.toAlertSeverity();
        String recommendation;
        if (ruleSeverity == null) {
            recommendation = "Flagged for clinician review; no cumulative rule is configured for this mechanism.";
        } else if (cumulative.getNote() != null) {
            recommendation = cumulative.getNote();
        } else {
            recommendation = ruleSeverity.recommendation();
        }
        return AlertCandidate.builder()
            .type(AlertType.DRUG_INTERACTION)
            .rootCauseKey(RootCauseKeys.cumulative(cumulative.getMechanism()))
            .severity(severity)
            .title("Cumulative Interaction Risk: " + cumulative.getMechanism())
            .message(cumulative.getDrugIds().size() + " medications share mechanism '" + cumulative.getMechanism()
                + "': " + String.join(", ", cumulative.getDrugIds()))
            .recommendation(recommendation)
            .metadata(metadata)
            .build();
    }
}
