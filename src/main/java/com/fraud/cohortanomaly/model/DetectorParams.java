package com.fraud.cohortanomaly.model;

import com.fraud.cohortanomaly.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

/**
 * Tuning parameters of one detector instance. Validated when built, so an
 * instance that exists is always usable.
 *
 * Unset strategy parameters fall back to the constants below; unset
 * correlation overrides stay null and the global correlation config applies.
 */
@Value
public class DetectorParams {

    public static final double DEFAULT_K_THRESHOLD = 3.5;
    public static final int DEFAULT_PERSISTENCE = 2;
    public static final int DEFAULT_MIN_SUPPORT = 50;
    public static final int DEFAULT_SEASONAL_PERIOD = 7;
    public static final int DEFAULT_TREND_BLOCK_SIZE = 0;
    public static final double DEFAULT_CUSUM_DRIFT = 0.5;

    // Sensitivity. STL+MAD: robust z-score cut-off. CUSUM: decision threshold h.
    double kThreshold;

    // Consecutive exceedances required before an anomaly is confirmed
    int persistence;

    // Minimum observed points before a series is evaluated
    int minSupport;

    // Season length in points; 0 or 1 disables the seasonal component
    int seasonalPeriod;

    // Points per piecewise-median trend block; 0 uses the whole series
    int trendBlockSize;

    // CUSUM slack in standardized units
    double cusumDrift;

    Double concentrationThreshold;
    Integer burstEntityThreshold;
    Double multiSegmentThreshold;

    @Builder(toBuilder = true)
    public DetectorParams(Double kThreshold, Integer persistence, Integer minSupport,
                          Integer seasonalPeriod, Integer trendBlockSize, Double cusumDrift,
                          Double concentrationThreshold, Integer burstEntityThreshold,
                          Double multiSegmentThreshold) {
        this.kThreshold = kThreshold != null ? kThreshold : DEFAULT_K_THRESHOLD;
        this.persistence = persistence != null ? persistence : DEFAULT_PERSISTENCE;
        this.minSupport = minSupport != null ? minSupport : DEFAULT_MIN_SUPPORT;
        this.seasonalPeriod = seasonalPeriod != null ? seasonalPeriod : DEFAULT_SEASONAL_PERIOD;
        this.trendBlockSize = trendBlockSize != null ? trendBlockSize : DEFAULT_TREND_BLOCK_SIZE;
        this.cusumDrift = cusumDrift != null ? cusumDrift : DEFAULT_CUSUM_DRIFT;
        this.concentrationThreshold = concentrationThreshold;
        this.burstEntityThreshold = burstEntityThreshold;
        this.multiSegmentThreshold = multiSegmentThreshold;
        validate();
    }

    public static DetectorParams defaults() {
        return DetectorParams.builder().build();
    }

    private void validate() {
        if (!(kThreshold > 0) || Double.isInfinite(kThreshold)) {
            throw new ValidationException("k_threshold must be a finite value > 0, got " + kThreshold);
        }
        if (persistence < 1) {
            throw new ValidationException("persistence must be >= 1, got " + persistence);
        }
        if (minSupport < 1) {
            throw new ValidationException("min_support must be >= 1, got " + minSupport);
        }
        if (seasonalPeriod < 0) {
            throw new ValidationException("seasonal_period must be >= 0, got " + seasonalPeriod);
        }
        if (trendBlockSize < 0) {
            throw new ValidationException("trend_block_size must be >= 0, got " + trendBlockSize);
        }
        if (!(cusumDrift >= 0) || Double.isInfinite(cusumDrift)) {
            throw new ValidationException("cusum_drift must be a finite value >= 0, got " + cusumDrift);
        }
        requireShare("concentration_threshold", concentrationThreshold);
        requireShare("multi_segment_threshold", multiSegmentThreshold);
        if (burstEntityThreshold != null && burstEntityThreshold < 1) {
            throw new ValidationException("burst_entity_threshold must be >= 1, got " + burstEntityThreshold);
        }
    }

    private static void requireShare(String name, Double value) {
        if (value != null && !(value > 0 && value < 1)) {
            throw new ValidationException(name + " must be in (0, 1), got " + value);
        }
    }
}
