package com.healthrevo.decision.risk;

public enum Direction {
    ABOVE,
    BELOW;

    /** Signed distance past the baseline; negative when the observed value is on the healthy side. */
    public double deviation(double observed, double baseline) {
        return this == ABOVE ? observed - baseline : baseline - observed;
    }
}
