package com.healthrevo.decision.interaction;

import com.healthrevo.decision.model.InteractionRecord;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InteractionFinding {
    InteractionRecord record;
    /** The pair is on the patient's allowlist: reported, never alerted. */
    boolean acceptedWithMonitoring;
}
