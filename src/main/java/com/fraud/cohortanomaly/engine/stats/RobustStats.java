package com.fraud.cohortanomaly.engine.stats;

import java.util.Arrays;

/**
 * Order statistics and dispersion estimates over primitive arrays.
 * None of the methods modify their input.
 */
public final class RobustStats {

    // Scales MAD to a consistent estimator of the standard deviation for normal data
    public static final double MAD_SCALE = 1.4826;

    private RobustStats() {}

    public static double median(double[] values) {
        return median(values, 0, values.length);
    }

    /**
     * Median of {@code values[from, to)}.
     */
    public static double median(double[] values, int from, int to) {
        int n = to - from;
        if (n <= 0) return 0.0;
        double[] sorted = Arrays.copyOfRange(values, from, to);
        Arrays.sort(sorted);
        int mid = n / 2;
        return (n % 2 == 1) ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    public static double mad(double[] values) {
        if (values.length == 0) return 0.0;
        double center = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return median(deviations);
    }

    public static double scaledMad(double[] values) {
        return MAD_SCALE * mad(values);
    }

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * Sample standard deviation (n - 1 denominator); 0 for fewer than two values.
     */
    public static double stdDev(double[] values) {
        if (values.length < 2) return 0.0;
        double mean = mean(values);
        double m2 = 0.0;
        for (double v : values) {
            double d = v - mean;
            m2 += d * d;
        }
        return Math.sqrt(m2 / (values.length - 1));
    }

    /**
     * Population coefficient of variation (stdDev / mean); 0 when the mean is 0.
     */
    public static double coefficientOfVariation(double[] values) {
        if (values.length == 0) return 0.0;
        double mean = mean(values);
        if (mean == 0.0) return 0.0;
        double m2 = 0.0;
        for (double v : values) {
            double d = v - mean;
            m2 += d * d;
        }
        return Math.sqrt(m2 / values.length) / Math.abs(mean);
    }
}
