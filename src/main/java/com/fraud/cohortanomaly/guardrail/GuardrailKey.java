package com.fraud.cohortanomaly.guardrail;

import lombok.Value;

/**
 * Identifies one debounce counter: a cohort and metric, scoped to the
 * detector that evaluates them so two detectors never share a counter.
 */
@Value(staticConstructor = "of")
public class GuardrailKey {

    String detectorId;
    String cohortKey;
    String metric;

    public static GuardrailKey unscoped(String cohortKey, String metric) {
        return of("", cohortKey, metric);
    }

    @Override
    public String toString() {
        return detectorId + "/" + cohortKey + "/" + metric;
    }
}
