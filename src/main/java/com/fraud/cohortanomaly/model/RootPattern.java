package com.fraud.cohortanomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A ranked root-cause hypothesis for a confirmed anomaly.
 */
@Value
@Builder
public class RootPattern {

    PatternType patternType;

    String description;

    Confidence confidence;

    String mitigationHint;

    // Estimated fraction of the anomaly explained (0-1); ranking key within a confidence tier
    double impact;

    // Concentration only: the segment alone carries more than half of the delta
    boolean dominant;

    String anomalyId;

    // Segment labels or entity type backing the hypothesis
    @Builder.Default
    List<String> evidence = List.of();
}
