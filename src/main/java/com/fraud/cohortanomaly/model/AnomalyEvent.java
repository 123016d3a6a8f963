package com.fraud.cohortanomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * A confirmed anomaly for one cohort and metric. Created only after the
 * persistence guardrail has confirmed the excursion; never modified.
 */
@Value
@Builder
public class AnomalyEvent {

    String eventId;

    String runId;

    String detectorId;

    // Canonical cohort key, see CohortKey#asString
    String cohortKey;

    String metric;

    // Epoch millis of the observation that confirmed the anomaly
    long timestamp;

    // Peak detector score over the confirmed excursion
    double score;

    Severity severity;

    // Consecutive exceeding observations in the excursion
    int persistedN;

    long createdAt;
}
