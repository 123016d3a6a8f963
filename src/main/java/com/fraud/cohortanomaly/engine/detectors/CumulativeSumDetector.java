package com.fraud.cohortanomaly.engine.detectors;

import com.fraud.cohortanomaly.engine.SeriesDetector;
import com.fraud.cohortanomaly.engine.stats.RobustStats;
import com.fraud.cohortanomaly.engine.stats.SeriesImputer;
import com.fraud.cohortanomaly.model.DetectionResult;
import com.fraud.cohortanomaly.model.DetectorParams;
import com.fraud.cohortanomaly.model.DetectorType;
import com.fraud.cohortanomaly.model.MetricSeries;
import org.springframework.stereotype.Component;

/**
 * Two-sided CUSUM control chart for small, sustained shifts.
 *
 * Values are standardized against the series median and scaled MAD (sample
 * standard deviation when MAD is 0). With z the standardized value and k the
 * drift:
 *
 *   S+ = max(0, S+ + z - k)
 *   S- = max(0, S- - z - k)
 *   score = max(S+, S-)
 *
 * A point is flagged while score exceeds the decision threshold h (the
 * detector's k_threshold). When a flagged excursion ends both sums restart
 * from 0, so the next excursion is measured on its own.
 */
@Component
public class CumulativeSumDetector implements SeriesDetector {

    @Override
    public DetectorType getSupportedType() {
        return DetectorType.CUSUM;
    }

    @Override
    public DetectionResult detect(MetricSeries series, DetectorParams params) {
        double[] values = SeriesImputer.imputeAndCheck(series, params.getMinSupport());

        double reference = RobustStats.median(values);
        double scale = RobustStats.scaledMad(values);
        if (scale == 0.0) {
            scale = RobustStats.stdDev(values);
        }

        double h = params.getKThreshold();
        double drift = params.getCusumDrift();
        double[] scores = new double[values.length];
        boolean[] flagged = new boolean[values.length];

        if (scale == 0.0) {
            return new DetectionResult(DetectorType.CUSUM, values, scores, flagged, h);
        }

        double upper = 0.0;
        double lower = 0.0;
        boolean inExcursion = false;

        for (int i = 0; i < values.length; i++) {
            double z = (values[i] - reference) / scale;
            upper = Math.max(0.0, upper + z - drift);
            lower = Math.max(0.0, lower - z - drift);
            double statistic = Math.max(upper, lower);

            scores[i] = statistic;
            if (statistic > h) {
                flagged[i] = true;
                inExcursion = true;
            } else if (inExcursion) {
                upper = 0.0;
                lower = 0.0;
                inExcursion = false;
            }
        }

        return new DetectionResult(DetectorType.CUSUM, values, scores, flagged, h);
    }
}
