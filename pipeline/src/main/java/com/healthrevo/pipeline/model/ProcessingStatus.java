package com.healthrevo.pipeline.model;

public enum ProcessingStatus {
    COMPLETE,
    /** At least one stage was skipped; the gaps are named on the result. */
    PARTIAL
}
