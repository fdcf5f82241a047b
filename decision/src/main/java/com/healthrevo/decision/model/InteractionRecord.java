package com.healthrevo.decision.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InteractionRecord {
    DrugPair pair;
    InteractionSeverity severity;
    String description;
    String mechanism;
    String management;
}
