package com.fraud.cohortanomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.cohortanomaly.config.AerospikeConfig;
import com.fraud.cohortanomaly.model.Detector;
import com.fraud.cohortanomaly.model.DetectorParams;
import com.fraud.cohortanomaly.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
@ConditionalOnProperty(name = "anomaly.store", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeDetectorRepository implements DetectorRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeDetectorRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeDetectorRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void save(Detector detector) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTORS, detector.getDetectorId());

        client.put(writePolicy, key,
                new Bin("detectorId", detector.getDetectorId()),
                new Bin("name", detector.getName()),
                new Bin("type", detector.getType().name()),
                new Bin("dims", toJson(detector.getCohortDimensions())),
                new Bin("metrics", toJson(detector.getMetrics())),
                new Bin("params", toJson(paramsToMap(detector.getParams()))),
                new Bin("enabled", detector.isEnabled()),
                new Bin("createdAt", detector.getCreatedAt()),
                new Bin("updatedAt", detector.getUpdatedAt()));
    }

    @Override
    public Detector findById(String detectorId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTORS, detectorId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    @Override
    public List<Detector> findAll() {
        List<Detector> detectors = Collections.synchronizedList(new ArrayList<>());
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DETECTORS,
                (key, record) -> {
                    try {
                        detectors.add(mapRecord(record));
                    } catch (RuntimeException e) {
                        log.warn("Skipping unreadable detector record {}: {}", key.userKey, e.getMessage());
                    }
                });

        List<Detector> sorted = new ArrayList<>(detectors);
        sorted.sort(Comparator.comparing(Detector::getDetectorId));
        return sorted;
    }

    @Override
    public boolean delete(String detectorId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTORS, detectorId);
        return client.delete(writePolicy, key);
    }

    private Detector mapRecord(Record record) {
        return Detector.builder()
                .detectorId(record.getString("detectorId"))
                .name(record.getString("name"))
                .type(DetectorType.fromString(record.getString("type")))
                .cohortDimensions(fromJson(record.getString("dims"), new TypeReference<List<String>>() {}))
                .metrics(fromJson(record.getString("metrics"), new TypeReference<List<String>>() {}))
                .params(mapToParams(fromJson(record.getString("params"), new TypeReference<Map<String, Object>>() {})))
                .enabled(record.getBoolean("enabled"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }

    static Map<String, Object> paramsToMap(DetectorParams params) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("k_threshold", params.getKThreshold());
        map.put("persistence", params.getPersistence());
        map.put("min_support", params.getMinSupport());
        map.put("seasonal_period", params.getSeasonalPeriod());
        map.put("trend_block_size", params.getTrendBlockSize());
        map.put("cusum_drift", params.getCusumDrift());
        map.put("concentration_threshold", params.getConcentrationThreshold());
        map.put("burst_entity_threshold", params.getBurstEntityThreshold());
        map.put("multi_segment_threshold", params.getMultiSegmentThreshold());
        return map;
    }

    static DetectorParams mapToParams(Map<String, Object> map) {
        return DetectorParams.builder()
                .kThreshold(asDouble(map.get("k_threshold")))
                .persistence(asInteger(map.get("persistence")))
                .minSupport(asInteger(map.get("min_support")))
                .seasonalPeriod(asInteger(map.get("seasonal_period")))
                .trendBlockSize(asInteger(map.get("trend_block_size")))
                .cusumDrift(asDouble(map.get("cusum_drift")))
                .concentrationThreshold(asDouble(map.get("concentration_threshold")))
                .burstEntityThreshold(asInteger(map.get("burst_entity_threshold")))
                .multiSegmentThreshold(asDouble(map.get("multi_segment_threshold")))
                .build();
    }

    private static Double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number n ? n.intValue() : null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize detector field", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isEmpty()) {
            throw new IllegalStateException("Missing detector field");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize detector field", e);
        }
    }
}
