package com.fraud.cohortanomaly.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered observations of one metric for one cohort. A null or NaN value
 * marks a missing observation.
 */
@Value
public class MetricSeries {

    List<Instant> timestamps;
    List<Double> values;

    public MetricSeries(List<Instant> timestamps, List<Double> values) {
        if (timestamps == null || values == null) {
            throw new IllegalArgumentException("timestamps and values are required");
        }
        if (timestamps.size() != values.size()) {
            throw new IllegalArgumentException(String.format(
                    "timestamps (%d) and values (%d) differ in length", timestamps.size(), values.size()));
        }
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static MetricSeries empty() {
        return new MetricSeries(List.of(), List.of());
    }

    /**
     * Builds a series with one point per {@code step} starting at {@code start}.
     */
    public static MetricSeries regular(Instant start, Duration step, double... values) {
        List<Instant> ts = new ArrayList<>(values.length);
        List<Double> vs = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            ts.add(start.plus(step.multipliedBy(i)));
            vs.add(values[i]);
        }
        return new MetricSeries(ts, vs);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public static boolean isMissing(Double value) {
        return value == null || value.isNaN();
    }

    public int observedCount() {
        int count = 0;
        for (Double v : values) {
            if (!isMissing(v)) count++;
        }
        return count;
    }
}
