package com.fraud.cohortanomaly.model;

import com.fraud.cohortanomaly.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A configured detector: which strategy to run, over which cohort
 * dimensions and metrics, with which parameters.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Detector {

    private String detectorId;

    private String name;

    private DetectorType type;

    // Dimension names that define a cohort, e.g. ["merchant_id"] or ["merchant_id", "device_type"]
    @Builder.Default
    private List<String> cohortDimensions = new ArrayList<>();

    // Metric names evaluated per cohort, e.g. ["tx_count", "decline_rate"]
    @Builder.Default
    private List<String> metrics = new ArrayList<>();

    @Builder.Default
    private DetectorParams params = DetectorParams.defaults();

    @Builder.Default
    private boolean enabled = true;

    private long createdAt;

    private long updatedAt;

    public void validate() {
        if (detectorId == null || detectorId.isBlank()) {
            throw new ValidationException("Detector id is required");
        }
        if (type == null) {
            throw new ValidationException("Detector " + detectorId + " has no type");
        }
        if (cohortDimensions == null || cohortDimensions.isEmpty()) {
            throw new ValidationException("Detector " + detectorId + " needs at least one cohort dimension");
        }
        if (metrics == null || metrics.isEmpty()) {
            throw new ValidationException("Detector " + detectorId + " needs at least one metric");
        }
        if (params == null) {
            throw new ValidationException("Detector " + detectorId + " has no params");
        }
    }
}
