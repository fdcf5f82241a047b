package com.healthrevo.decision.anomaly;

public enum Bound {
    ABOVE,
    BELOW;

    public boolean isCrossedBy(double value, double limit) {
        return this == ABOVE ? value > limit : value < limit;
    }
}
