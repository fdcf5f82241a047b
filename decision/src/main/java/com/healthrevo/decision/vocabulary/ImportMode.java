package com.healthrevo.decision.vocabulary;

public enum ImportMode {
    REPLACE,
    MERGE
}
