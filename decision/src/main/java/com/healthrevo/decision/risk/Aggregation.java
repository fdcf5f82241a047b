package com.healthrevo.decision.risk;

import java.util.List;

public enum Aggregation {
    MEAN,
    MAX,
    MIN;

    /**
     * @param values non-empty, in a stable order so that the floating point sum is reproducible
     */
    public double apply(List<Double> values) {
        switch (this) {
            case MAX:
                return values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
            case MIN:
                return values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
            default:
                double sum = 0;
                for (Double value : values) {
                    sum += value;
                }
                return sum / values.size();
        }
    }
}
