package com.fraud.cohortanomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One dimension value's contribution to an anomaly's metric delta.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Segment {

    // e.g. "issuer", "asn", "device_fp"
    private String dimension;

    private String dimensionValue;

    // Fraction of the total absolute delta attributed to this value (0-1)
    private double shareOfDelta;

    private long entityCount;

    private double deltaMetric;

    // |delta| * share * stability * rarity; 0 when supplied pre-ranked
    private double importance;

    public String label() {
        return dimension == null ? dimensionValue : dimension + "=" + dimensionValue;
    }
}
