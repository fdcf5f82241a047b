package com.healthrevo.decision.prescription;

import com.healthrevo.decision.interaction.CumulativeFinding;
import com.healthrevo.decision.interaction.InteractionFinding;
import com.healthrevo.decision.interaction.InteractionReport;
import com.healthrevo.decision.model.InteractionRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the flag list stored on a prescription: interaction findings first, then the dosage
 * review findings.
 */
public final class PrescriptionFlags {

    private PrescriptionFlags() {
    }

    public static List<PrescriptionFinding> combine(InteractionReport report, List<PrescriptionFinding> dosageFindings) {
        List<PrescriptionFinding> flags = new ArrayList<>();
        for (InteractionFinding finding : report.getFindings()) {
            InteractionRecord record = finding.getRecord();
            String message = String.format(Locale.ROOT, "%s + %s: %s",
                record.getPair().getFirst(), record.getPair().getSecond(), record.getDescription());
            if (finding.isAcceptedWithMonitoring()) {
                message += " (accepted with monitoring)";
            }
            flags.add(PrescriptionFinding.builder()
                .severity(flagSeverity(record))
                .type(FindingType.INTERACTION)
                .message(message)
                .build());
        }
        for (CumulativeFinding cumulative : report.getCumulativeFindings()) {
            flags.add(PrescriptionFinding.builder()
                .severity(cumulative.isReviewRequired() ? FindingSeverity.MEDIUM : FindingSeverity.HIGH)
                .type(FindingType.CUMULATIVE)
                .message(String.format(Locale.ROOT, "%d medications share mechanism '%s': %s",
                    cumulative.getDrugIds().size(), cumulative.getMechanism(), String.join(", ", cumulative.getDrugIds())))
                .build());
        }
        flags.addAll(dosageFindings);
        return flags;
    }

    private static FindingSeverity flagSeverity(InteractionRecord record) {
        switch (record.getSeverity()) {
            case MAJOR:
            case CONTRAINDICATED:
                return FindingSeverity.HIGH;
            case MODERATE:
                return FindingSeverity.MEDIUM;
            default:
                return FindingSeverity.LOW;
        }
    }
}
