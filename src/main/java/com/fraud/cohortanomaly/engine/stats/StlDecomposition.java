package com.fraud.cohortanomaly.engine.stats;

/**
 * Robust seasonal-trend decomposition: {@code value = trend + seasonal + residual}.
 *
 * The trend is a Theil–Sen line per block: the slope is the median of pairwise
 * slopes and the intercept the median of the slope-adjusted values, so a short
 * level shift at the end of the window stays in the residual while a steady
 * drift is removed. With a season of at least two full cycles in a block, only
 * pairs a whole number of seasons apart contribute slopes. The seasonal
 * component is the median of each cycle subseries of the detrended values,
 * centred to sum to zero.
 */
public final class StlDecomposition {

    private final double[] trend;
    private final double[] seasonal;
    private final double[] residual;

    private StlDecomposition(double[] trend, double[] seasonal, double[] residual) {
        this.trend = trend;
        this.seasonal = seasonal;
        this.residual = residual;
    }

    /**
     * @param values    gap-free series
     * @param period    season length in points; below 2 disables the seasonal component
     * @param blockSize points per trend block; 0 or anything at least the series length uses one block
     */
    public static StlDecomposition decompose(double[] values, int period, int blockSize) {
        int n = values.length;
        double[] trend = blockTrend(values, period, blockSize);

        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            detrended[i] = values[i] - trend[i];
        }

        double[] seasonal = new double[n];
        if (period >= 2 && n >= 2 * period) {
            double[] cycle = cycleSubseriesMedians(detrended, period);
            for (int i = 0; i < n; i++) {
                seasonal[i] = cycle[i % period];
            }
        }

        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        return new StlDecomposition(trend, seasonal, residual);
    }

    private static double[] blockTrend(double[] values, int period, int blockSize) {
        int n = values.length;
        int block = (blockSize <= 0 || blockSize >= n) ? n : blockSize;
        double[] trend = new double[n];
        for (int start = 0; start < n; start += block) {
            int end = Math.min(n, start + block);
            // A trailing stub shorter than half a block joins the previous block
            if (end < n && n - end < block / 2) {
                end = n;
            }
            fitTheilSen(values, start, end, period, trend);
            if (end == n) break;
        }
        return trend;
    }

    private static void fitTheilSen(double[] values, int start, int end, int period, double[] trend) {
        int length = end - start;
        int lag = (period >= 2 && length >= 2 * period) ? period : 1;

        int pairs = 0;
        for (int gap = lag; gap < length; gap += lag) {
            pairs += length - gap;
        }
        double slope = 0.0;
        if (pairs > 0) {
            double[] slopes = new double[pairs];
            int k = 0;
            for (int i = start; i < end; i++) {
                for (int j = i + lag; j < end; j += lag) {
                    slopes[k++] = (values[j] - values[i]) / (j - i);
                }
            }
            slope = RobustStats.median(slopes);
        }

        double[] adjusted = new double[length];
        for (int i = 0; i < length; i++) {
            adjusted[i] = values[start + i] - slope * i;
        }
        double intercept = RobustStats.median(adjusted);
        for (int i = 0; i < length; i++) {
            trend[start + i] = intercept + slope * i;
        }
    }

    private static double[] cycleSubseriesMedians(double[] detrended, int period) {
        double[] cycle = new double[period];
        for (int phase = 0; phase < period; phase++) {
            int count = (detrended.length - phase + period - 1) / period;
            double[] subseries = new double[count];
            for (int k = 0; k < count; k++) {
                subseries[k] = detrended[phase + k * period];
            }
            cycle[phase] = RobustStats.median(subseries);
        }
        double mean = RobustStats.mean(cycle);
        for (int phase = 0; phase < period; phase++) {
            cycle[phase] -= mean;
        }
        return cycle;
    }

    public double[] getTrend() {
        return trend.clone();
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }

    public double[] getResidual() {
        return residual.clone();
    }
}
