package com.healthrevo.decision.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A medication as written on a prescription, before normalization.
 */
@Value
@Builder
@Jacksonized
public class MedicationMention {
    String rawName;
    String dose;
    String frequency;
    String instructions;

    public static MedicationMention named(String rawName) {
        return MedicationMention.builder().rawName(rawName).build();
    }
}
