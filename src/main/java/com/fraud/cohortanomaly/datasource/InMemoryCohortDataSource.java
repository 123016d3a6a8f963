package com.fraud.cohortanomaly.datasource;

import com.fraud.cohortanomaly.exception.EmptyResultException;
import com.fraud.cohortanomaly.model.CohortKey;
import com.fraud.cohortanomaly.model.DetectionWindow;
import com.fraud.cohortanomaly.model.Detector;
import com.fraud.cohortanomaly.model.MetricSeries;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Series held in memory, loaded with {@link #load}. Used with {@code anomaly.store=memory}.
 */
@Component
@ConditionalOnProperty(name = "anomaly.store", havingValue = "memory")
public class InMemoryCohortDataSource implements CohortDataSource {

    // canonical cohort key -> metric -> series
    private final Map<String, Map<String, MetricSeries>> series = new ConcurrentHashMap<>();
    private final Map<String, CohortKey> cohorts = new ConcurrentHashMap<>();

    public void load(CohortKey cohort, String metric, MetricSeries metricSeries) {
        cohorts.put(cohort.asString(), cohort);
        series.computeIfAbsent(cohort.asString(), k -> new ConcurrentHashMap<>()).put(metric, metricSeries);
    }

    public void clear() {
        series.clear();
        cohorts.clear();
    }

    @Override
    public List<CohortKey> getCohorts(Detector detector, DetectionWindow window) {
        Set<String> wanted = new LinkedHashSet<>(detector.getCohortDimensions());
        List<CohortKey> matching = new ArrayList<>();
        for (CohortKey cohort : cohorts.values()) {
            if (cohort.getDimensions().keySet().equals(wanted) && hasDataIn(cohort, window)) {
                matching.add(cohort);
            }
        }
        matching.sort((a, b) -> a.asString().compareTo(b.asString()));
        return matching;
    }

    @Override
    public MetricSeries getSeries(CohortKey cohort, String metric, DetectionWindow window) {
        MetricSeries stored = series.getOrDefault(cohort.asString(), Map.of()).get(metric);
        if (stored == null) {
            throw new EmptyResultException("No " + metric + " series for cohort " + cohort);
        }
        List<Instant> timestamps = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (int i = 0; i < stored.size(); i++) {
            if (window.contains(stored.getTimestamps().get(i))) {
                timestamps.add(stored.getTimestamps().get(i));
                values.add(stored.getValues().get(i));
            }
        }
        if (timestamps.isEmpty()) {
            throw new EmptyResultException("No " + metric + " points for cohort " + cohort + " in " + window);
        }
        return new MetricSeries(timestamps, values);
    }

    private boolean hasDataIn(CohortKey cohort, DetectionWindow window) {
        for (MetricSeries s : series.getOrDefault(cohort.asString(), Map.of()).values()) {
            for (Instant ts : s.getTimestamps()) {
                if (window.contains(ts)) return true;
            }
        }
        return false;
    }
}
