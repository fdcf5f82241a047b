package com.healthrevo.decision.normalizer;

public enum MatchStatus {
    MATCHED,
    /** Best candidate fell below the acceptance threshold, or the name was empty or garbage. */
    UNMATCHED
}
