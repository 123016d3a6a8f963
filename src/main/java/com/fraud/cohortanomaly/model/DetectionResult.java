package com.fraud.cohortanomaly.model;

import lombok.Value;

/**
 * Per-point output of a detector. {@code scores[i] > threshold} exactly when
 * {@code flagged[i]}, except for CUSUM which may hold a flagged excursion
 * open until the statistic drops back below the threshold.
 */
@Value
public class DetectionResult {

    DetectorType detectorType;
    double[] values;
    double[] scores;
    boolean[] flagged;
    double threshold;

    public int size() {
        return scores.length;
    }

    public int flaggedCount() {
        int count = 0;
        for (boolean f : flagged) {
            if (f) count++;
        }
        return count;
    }

    public double maxScore() {
        double max = 0.0;
        for (double s : scores) {
            max = Math.max(max, s);
        }
        return max;
    }
}
