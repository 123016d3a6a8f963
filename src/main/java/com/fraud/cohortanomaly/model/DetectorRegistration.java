package com.fraud.cohortanomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to register a detector. Parameters left null take the configured
 * detector defaults; correlation overrides left null use the global values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectorRegistration {

    // Generated when absent
    private String detectorId;

    private String name;

    // e.g. "stl_mad", "STL-MAD", "cusum"
    private String type;

    @Builder.Default
    private List<String> cohortDimensions = new ArrayList<>();

    @Builder.Default
    private List<String> metrics = new ArrayList<>();

    private Double kThreshold;
    private Integer persistence;
    private Integer minSupport;
    private Integer seasonalPeriod;
    private Integer trendBlockSize;
    private Double cusumDrift;

    private Double concentrationThreshold;
    private Integer burstEntityThreshold;
    private Double multiSegmentThreshold;
}
