package com.fraud.cohortanomaly.engine;

import com.fraud.cohortanomaly.model.DetectionResult;
import com.fraud.cohortanomaly.model.DetectorParams;
import com.fraud.cohortanomaly.model.DetectorType;
import com.fraud.cohortanomaly.model.MetricSeries;

/**
 * Interface for all series detection strategies.
 * Implementations are stateless and safe to call from concurrent cohort workers.
 */
public interface SeriesDetector {

    /**
     * The detector type this strategy implements.
     */
    DetectorType getSupportedType();

    /**
     * Score every point of a series.
     *
     * @param series the cohort's metric series, possibly with gaps
     * @param params the detector instance's parameters
     * @return per-point scores and flags, compared against {@link DetectionResult#getThreshold()}
     * @throws com.fraud.cohortanomaly.exception.EmptyInputException        empty or fully-missing series
     * @throws com.fraud.cohortanomaly.exception.InsufficientDataException fewer observations than min support
     */
    DetectionResult detect(MetricSeries series, DetectorParams params);
}
