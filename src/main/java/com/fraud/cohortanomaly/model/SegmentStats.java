package com.fraud.cohortanomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate of one dimension value within a single window (baseline or during).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentStats {

    private String dimensionValue;

    private double metricValue;

    // Number of transactions backing metricValue
    private long support;

    private long entityCount;
}
