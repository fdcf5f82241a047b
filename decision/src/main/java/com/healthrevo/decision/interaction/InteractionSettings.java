package com.healthrevo.decision.interaction;

import com.healthrevo.decision.model.InteractionSeverity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class InteractionSettings {
    /** Pairwise findings below this severity are reported but never alerted. */
    @Builder.Default
    InteractionSeverity alertMinimumSeverity = InteractionSeverity.MODERATE;
    /** Number of drugs sharing a mechanism tag that makes a cumulative finding. */
    @Builder.Default
    int cumulativeMinimumDrugs = 3;
    @Singular
    List<CumulativeRule> cumulativeRules;

    public Optional<CumulativeRule> ruleFor(String mechanism) {
        return cumulativeRules.stream()
            .filter(rule -> rule.getMechanism().equalsIgnoreCase(mechanism))
            .findFirst();
    }

    public static InteractionSettings defaults() {
        return InteractionSettings.builder().build();
    }
}
