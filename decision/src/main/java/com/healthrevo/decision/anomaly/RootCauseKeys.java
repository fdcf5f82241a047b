package com.healthrevo.decision.anomaly;

import com.healthrevo.decision.model.DrugPair;
import com.healthrevo.decision.model.VitalMetric;

/**
 * Keys that identify one unresolved condition of a patient. At most one open alert exists per
 * (patient, alert type, key).
 */
public final class RootCauseKeys {

    private RootCauseKeys() {
    }

    public static String vitals(VitalMetric metric) {
        return "vitals:" + metric.key();
    }

    public static String interaction(DrugPair pair) {
        return "interaction:" + pair.key();
    }

    public static String cumulative(String mechanism) {
        return "cumulative:" + mechanism;
    }
}
