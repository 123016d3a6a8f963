package com.fraud.cohortanomaly.engine.stats;

import com.fraud.cohortanomaly.exception.EmptyInputException;
import com.fraud.cohortanomaly.exception.InsufficientDataException;
import com.fraud.cohortanomaly.model.MetricSeries;

import java.util.List;

/**
 * Fills gaps in a metric series and enforces minimum support.
 *
 * Interior gaps are linearly interpolated between the nearest observations;
 * leading and trailing gaps take the nearest observation.
 */
public final class SeriesImputer {

    private SeriesImputer() {}

    /**
     * @return the gap-free values of {@code series}
     * @throws EmptyInputException        if the series is empty or has no observation at all
     * @throws InsufficientDataException if fewer than {@code minSupport} points were observed
     */
    public static double[] imputeAndCheck(MetricSeries series, int minSupport) {
        if (series == null || series.isEmpty()) {
            throw new EmptyInputException("Series is empty");
        }
        double[] imputed = impute(series.getValues());
        int observed = series.observedCount();
        if (observed < minSupport) {
            throw new InsufficientDataException(observed, minSupport);
        }
        return imputed;
    }

    public static double[] impute(List<Double> values) {
        int n = values.size();
        double[] out = new double[n];
        int previous = -1;

        for (int i = 0; i < n; i++) {
            Double v = values.get(i);
            if (MetricSeries.isMissing(v)) continue;
            out[i] = v;
            if (previous == -1) {
                for (int j = 0; j < i; j++) out[j] = v;
            } else if (i - previous > 1) {
                double start = out[previous];
                double step = (v - start) / (i - previous);
                for (int j = previous + 1; j < i; j++) {
                    out[j] = start + step * (j - previous);
                }
            }
            previous = i;
        }

        if (previous == -1) {
            throw new EmptyInputException("Series of " + n + " points has no observed value to impute from");
        }
        for (int j = previous + 1; j < n; j++) out[j] = out[previous];
        return out;
    }
}
