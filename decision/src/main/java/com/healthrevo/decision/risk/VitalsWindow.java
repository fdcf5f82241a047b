package com.healthrevo.decision.risk;

import com.healthrevo.decision.model.VitalsSample;
import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Closed time interval of vitals used for scoring and trend evaluation.
 */
@Value
public class VitalsWindow {
    LocalDateTime from;
    LocalDateTime to;

    public static VitalsWindow trailing(Duration length, LocalDateTime end) {
        return new VitalsWindow(end.minus(length), end);
    }

    public boolean contains(VitalsSample sample) {
        LocalDateTime at = sample.getRecordedAt();
        return at != null && !at.isBefore(from) && !at.isAfter(to);
    }
}
