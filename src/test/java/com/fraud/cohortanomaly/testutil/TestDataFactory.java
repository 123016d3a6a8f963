package com.fraud.cohortanomaly.testutil;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.model.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    public static final Duration STEP = Duration.ofHours(1);

    private TestDataFactory() {}

    public static DetectionConfig createConfig() {
        DetectionConfig config = new DetectionConfig();
        config.setStore("memory");
        config.getJob().setWorkerPoolSize(2);
        config.getJob().setFetchTimeout(Duration.ofSeconds(5));
        return config;
    }

    public static Detector createDetector(String detectorId, DetectorType type, DetectorParams params) {
        return Detector.builder()
                .detectorId(detectorId)
                .name("Test detector " + detectorId)
                .type(type)
                .cohortDimensions(new ArrayList<>(List.of("merchant_id")))
                .metrics(new ArrayList<>(List.of("tx_count")))
                .params(params)
                .enabled(true)
                .createdAt(START.toEpochMilli())
                .updatedAt(START.toEpochMilli())
                .build();
    }

    public static Detector createStlDetector(String detectorId) {
        return createDetector(detectorId, DetectorType.STL_MAD, DetectorParams.builder()
                .kThreshold(3.5)
                .persistence(2)
                .minSupport(50)
                .build());
    }

    public static CohortKey merchant(String merchantId) {
        return CohortKey.of("merchant_id", merchantId);
    }

    public static DetectionWindow windowFor(int points) {
        return DetectionWindow.of(START, START.plus(STEP.multipliedBy(points)));
    }

    /**
     * Gaussian noise around {@code mean}, then the last {@code shiftedPoints}
     * moved to {@code shiftedMean}.
     */
    public static MetricSeries shiftedSeries(long seed, int points, double mean, double stdDev,
                                             int shiftedPoints, double shiftedMean) {
        Random random = new Random(seed);
        double[] values = new double[points];
        for (int i = 0; i < points; i++) {
            double center = i >= points - shiftedPoints ? shiftedMean : mean;
            values[i] = center + random.nextGaussian() * stdDev;
        }
        return MetricSeries.regular(START, STEP, values);
    }

    public static MetricSeries noisySeries(long seed, int points, double mean, double stdDev) {
        return shiftedSeries(seed, points, mean, stdDev, 0, mean);
    }

    public static MetricSeries constantSeries(int points, double value) {
        double[] values = new double[points];
        Arrays.fill(values, value);
        return MetricSeries.regular(START, STEP, values);
    }

    public static AnomalyEvent createAnomalyEvent(String eventId, String detectorId, Severity severity, long createdAt) {
        return AnomalyEvent.builder()
                .eventId(eventId)
                .runId("RUN-1")
                .detectorId(detectorId)
                .cohortKey("merchant_id=M-1")
                .metric("tx_count")
                .timestamp(createdAt)
                .score(7.5)
                .severity(severity)
                .persistedN(3)
                .createdAt(createdAt)
                .build();
    }

    public static Segment createSegment(String dimension, String value, double share) {
        return Segment.builder()
                .dimension(dimension)
                .dimensionValue(value)
                .shareOfDelta(share)
                .entityCount(25)
                .build();
    }

    public static CandidateEntityGroup createEntityGroup(String entityType, long... activityCounts) {
        List<EntityActivity> entities = new ArrayList<>();
        for (int i = 0; i < activityCounts.length; i++) {
            entities.add(new EntityActivity(entityType + "-" + i, activityCounts[i]));
        }
        return CandidateEntityGroup.builder()
                .entityType(entityType)
                .entities(entities)
                .build();
    }

    public static SegmentStats stats(String value, double metric, long support) {
        return SegmentStats.builder()
                .dimensionValue(value)
                .metricValue(metric)
                .support(support)
                .entityCount(support / 2)
                .build();
    }
}
