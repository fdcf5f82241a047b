package com.healthrevo.decision.interaction;

import com.healthrevo.decision.model.CanonicalDrug;
import com.healthrevo.decision.model.DrugPair;
import com.healthrevo.decision.model.InteractionRecord;
import com.healthrevo.decision.model.InteractionSeverity;
import com.healthrevo.decision.vocabulary.VocabularySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Pairwise and cumulative interaction check over a set of canonical drug ids.
 */
public class DrugInteractionChecker {

    private static final Logger logger = LoggerFactory.getLogger(DrugInteractionChecker.class);

    static final String NO_INTERACTIONS = "No known interactions between the listed medications.";
    static final String REVIEW_CUMULATIVE = "Several medications share a mechanism; review the combination.";

    private final InteractionSettings settings;

    public DrugInteractionChecker(InteractionSettings settings) {
        this.settings = settings;
    }

    public InteractionReport check(Collection<String> drugIds, VocabularySnapshot snapshot, Set<DrugPair> accepted) {
        InteractionReport.InteractionReportBuilder report = InteractionReport.builder();

        List<String> known = new ArrayList<>();
        for (String drugId : new TreeSet<>(drugIds)) {
            if (snapshot.containsDrug(drugId)) {
                known.add(drugId);
            } else {
                report.excludedDrugId(drugId);
            }
        }
        report.checkedDrugIds(known);

        InteractionSeverity overall = null;
        for (int i = 0; i < known.size(); i++) {
            for (int j = i + 1; j < known.size(); j++) {
                Optional<InteractionRecord> interaction = snapshot.findInteraction(known.get(i), known.get(j));
                if (interaction.isEmpty()) {
                    continue;
                }
                InteractionRecord record = interaction.get();
                boolean acceptedWithMonitoring = accepted.contains(record.getPair());
                report.finding(InteractionFinding.builder()
                    .record(record)
                    .acceptedWithMonitoring(acceptedWithMonitoring)
                    .build());
                overall = higher(overall, record.getSeverity());
                logger.debug("Interaction {} ({}){}", record.getPair().key(), record.getSeverity(),
                    acceptedWithMonitoring ? " accepted with monitoring" : "");
            }
        }

        boolean reviewRequired = false;
        for (CumulativeFinding cumulative : cumulativeFindings(known, snapshot)) {
            report.cumulativeFinding(cumulative);
            if (cumulative.isReviewRequired()) {
                reviewRequired = true;
            } else {
                overall = higher(overall, cumulative.getRuleSeverity());
            }
        }

        report.overallSeverity(overall);
        if (overall != null) {
            report.recommendation(overall.recommendation());
        } else if (reviewRequired) {
            report.recommendation(REVIEW_CUMULATIVE);
        } else {
            report.recommendation(NO_INTERACTIONS);
        }
        return report.build();
    }

    private List<CumulativeFinding> cumulativeFindings(List<String> known, VocabularySnapshot snapshot) {
        Map<String, Set<String>> drugsByMechanism = new TreeMap<>();
        for (String drugId : known) {
            Optional<CanonicalDrug> drug = snapshot.findDrug(drugId);
            drug.ifPresent(d -> d.getMechanismTags().forEach(tag ->
                drugsByMechanism.computeIfAbsent(tag, t -> new TreeSet<>()).add(drugId)));
        }

        List<CumulativeFinding> findings = new ArrayList<>();
        drugsByMechanism.forEach((mechanism, ids) -> {
            if (ids.size() < settings.getCumulativeMinimumDrugs()) {
                return;
            }
            Optional<CumulativeRule> rule = settings.ruleFor(mechanism);
            findings.add(CumulativeFinding.builder()
                .mechanism(mechanism)
                .drugIds(List.copyOf(ids))
                .ruleSeverity(rule.map(CumulativeRule::getSeverity).orElse(null))
                .note(rule.map(CumulativeRule::getNote).orElse(null))
                .build());
            logger.debug("Cumulative finding {} across {} drugs (rule: {})", mechanism, ids.size(), rule.isPresent());
        });
        return findings;
    }

    private static InteractionSeverity higher(InteractionSeverity current, InteractionSeverity candidate) {
        if (current == null) {
            return candidate;
        }
        return candidate.isAtLeast(current) ? candidate : current;
    }
}
