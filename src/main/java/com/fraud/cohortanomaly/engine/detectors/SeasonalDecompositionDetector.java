package com.fraud.cohortanomaly.engine.detectors;

import com.fraud.cohortanomaly.engine.SeriesDetector;
import com.fraud.cohortanomaly.engine.stats.RobustStats;
import com.fraud.cohortanomaly.engine.stats.SeriesImputer;
import com.fraud.cohortanomaly.engine.stats.StlDecomposition;
import com.fraud.cohortanomaly.model.DetectionResult;
import com.fraud.cohortanomaly.model.DetectorParams;
import com.fraud.cohortanomaly.model.DetectorType;
import com.fraud.cohortanomaly.model.MetricSeries;
import org.springframework.stereotype.Component;

/**
 * Flags points whose seasonal-trend residual is far from the residual median,
 * measured in scaled MADs.
 *
 * score(i) = |residual(i) - median(residual)| / (1.4826 * MAD(residual))
 * flagged(i) = score(i) > k_threshold
 *
 * A residual with MAD = 0 (e.g. a constant series) has no measurable
 * deviation: every score is 0 and nothing is flagged.
 */
@Component
public class SeasonalDecompositionDetector implements SeriesDetector {

    @Override
    public DetectorType getSupportedType() {
        return DetectorType.STL_MAD;
    }

    @Override
    public DetectionResult detect(MetricSeries series, DetectorParams params) {
        double[] values = SeriesImputer.imputeAndCheck(series, params.getMinSupport());

        StlDecomposition stl = StlDecomposition.decompose(
                values, params.getSeasonalPeriod(), params.getTrendBlockSize());
        double[] residual = stl.getResidual();

        double center = RobustStats.median(residual);
        double scale = RobustStats.scaledMad(residual);

        double threshold = params.getKThreshold();
        double[] scores = new double[values.length];
        boolean[] flagged = new boolean[values.length];

        if (scale > 0) {
            for (int i = 0; i < values.length; i++) {
                scores[i] = Math.abs(residual[i] - center) / scale;
                flagged[i] = scores[i] > threshold;
            }
        }

        return new DetectionResult(DetectorType.STL_MAD, values, scores, flagged, threshold);
    }
}
