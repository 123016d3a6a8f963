package com.fraud.cohortanomaly.service;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.model.DetectorParams;
import com.fraud.cohortanomaly.model.Severity;
import org.springframework.stereotype.Service;

/**
 * Maps a detector score and its persistence count to a severity tier.
 *
 * Tiers, with ratio = score / threshold:
 *   NONE      score is 0 or not above threshold
 *   CRITICAL  ratio >= criticalMultiplier or persistedN >= criticalPersistence
 *   WARN      ratio >= warnMultiplier or persistedN >= warnPersistence
 *   INFO      any other exceedance
 *
 * Pure: reads only its arguments and the configured tier boundaries.
 */
@Service
public class SeverityScorer {

    private final DetectionConfig config;

    public SeverityScorer(DetectionConfig config) {
        this.config = config;
    }

    public Severity determineSeverity(double score, int persistedN, DetectorParams params) {
        return determineSeverity(score, persistedN, params.getKThreshold());
    }

    public Severity determineSeverity(double score, int persistedN, double threshold) {
        if (score == 0.0 || Double.isNaN(score) || !(score > threshold)) {
            return Severity.NONE;
        }

        DetectionConfig.SeverityTiers tiers = config.getSeverity();
        double ratio = threshold > 0 ? score / threshold : Double.POSITIVE_INFINITY;

        if (ratio >= tiers.getCriticalMultiplier() || persistedN >= tiers.getCriticalPersistence()) {
            return Severity.CRITICAL;
        }
        if (ratio >= tiers.getWarnMultiplier() || persistedN >= tiers.getWarnPersistence()) {
            return Severity.WARN;
        }
        return Severity.INFO;
    }
}
