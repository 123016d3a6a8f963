package com.fraud.cohortanomaly.datasource;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.fraud.cohortanomaly.config.AerospikeConfig;
import com.fraud.cohortanomaly.exception.DataSourceConnectionException;
import com.fraud.cohortanomaly.exception.EmptyResultException;
import com.fraud.cohortanomaly.model.CohortKey;
import com.fraud.cohortanomaly.model.DetectionWindow;
import com.fraud.cohortanomaly.model.Detector;
import com.fraud.cohortanomaly.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Reads pre-aggregated cohort metric points from the {@code cohort_metrics} set.
 *
 * Record layout, one record per (cohort, metric, bucket):
 *   dims    comma-joined cohort dimension names, e.g. "merchant_id,device_type"
 *   cohort  canonical cohort key ({@link CohortKey#asString()}), e.g. "merchant_id=M-17|device_type=ios"
 *   metric  metric name
 *   ts      bucket start, epoch millis
 *   value   metric value (double)
 */
@Component
@ConditionalOnProperty(name = "anomaly.store", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeCohortDataSource implements CohortDataSource {

    private static final Logger log = LoggerFactory.getLogger(AerospikeCohortDataSource.class);

    private final AerospikeClient client;
    private final String namespace;
    private final ScanPolicy scanPolicy;

    public AerospikeCohortDataSource(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("cohortScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.scanPolicy = scanPolicy;
    }

    @Override
    public List<CohortKey> getCohorts(Detector detector, DetectionWindow window) {
        String dims = String.join(",", detector.getCohortDimensions());
        TreeSet<String> cohorts = new TreeSet<>();

        scan(record -> dims.equals(record.getString("dims")) && inWindow(record, window),
                record -> {
                    synchronized (cohorts) {
                        cohorts.add(record.getString("cohort"));
                    }
                });

        log.debug("Found {} cohorts over [{}] in {}", cohorts.size(), dims, window);
        List<CohortKey> keys = new ArrayList<>(cohorts.size());
        for (String canonical : cohorts) {
            try {
                keys.add(CohortKey.parse(canonical));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unreadable cohort record '{}': {}", canonical, e.getMessage());
            }
        }
        return keys;
    }

    @Override
    public MetricSeries getSeries(CohortKey cohort, String metric, DetectionWindow window) {
        String canonical = cohort.asString();
        List<Record> records = new ArrayList<>();

        scan(record -> canonical.equals(record.getString("cohort"))
                        && metric.equals(record.getString("metric"))
                        && inWindow(record, window),
                record -> {
                    synchronized (records) {
                        records.add(record);
                    }
                });

        if (records.isEmpty()) {
            throw new EmptyResultException(String.format(
                    "No %s points for cohort %s in %s", metric, canonical, window));
        }

        records.sort(Comparator.comparingLong(r -> r.getLong("ts")));
        List<Instant> timestamps = new ArrayList<>(records.size());
        List<Double> values = new ArrayList<>(records.size());
        for (Record record : records) {
            timestamps.add(Instant.ofEpochMilli(record.getLong("ts")));
            Object value = record.getValue("value");
            values.add(value instanceof Number n ? n.doubleValue() : null);
        }
        return new MetricSeries(timestamps, values);
    }

    private boolean inWindow(Record record, DetectionWindow window) {
        return window.contains(Instant.ofEpochMilli(record.getLong("ts")));
    }

    private void scan(Predicate<Record> filter, Consumer<Record> sink) {
        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_COHORT_METRICS,
                    (key, record) -> {
                        if (filter.test(record)) {
                            sink.accept(record);
                        }
                    });
        } catch (AerospikeException e) {
            throw new DataSourceConnectionException(
                    "Cohort metric scan failed: " + e.getMessage(), e);
        }
    }
}
