package com.fraud.cohortanomaly.config;

import com.fraud.cohortanomaly.guardrail.ConcurrencyPolicy;
import com.fraud.cohortanomaly.model.DetectorParams;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class DetectionConfig {

    // Repository backend: "aerospike" (default) or "memory"
    private String store = "aerospike";

    // Fallbacks for detector registrations that omit a parameter
    private DetectorDefaults detectorDefaults = new DetectorDefaults();

    private SeverityTiers severity = new SeverityTiers();

    private Correlation correlation = new Correlation();

    private GuardrailSettings guardrails = new GuardrailSettings();

    private Job job = new Job();

    private Query query = new Query();

    @Data
    public static class DetectorDefaults {
        // k_threshold: robust z cut-off for STL+MAD, decision threshold h for CUSUM
        private double sensitivity = DetectorParams.DEFAULT_K_THRESHOLD;
        private int persistence = DetectorParams.DEFAULT_PERSISTENCE;
        private int minSupport = DetectorParams.DEFAULT_MIN_SUPPORT;
        private int seasonalPeriod = DetectorParams.DEFAULT_SEASONAL_PERIOD;
        private int trendBlockSize = DetectorParams.DEFAULT_TREND_BLOCK_SIZE;
        private double cusumDrift = DetectorParams.DEFAULT_CUSUM_DRIFT;
    }

    @Data
    public static class SeverityTiers {
        // score/threshold ratio at which an exceedance escalates to WARN
        private double warnMultiplier = 2.0;
        // score/threshold ratio at which an exceedance escalates to CRITICAL
        private double criticalMultiplier = 4.0;
        // persisted observations that escalate to WARN regardless of magnitude
        private int warnPersistence = 2;
        // persisted observations that escalate to CRITICAL regardless of magnitude
        private int criticalPersistence = 5;
    }

    @Data
    public static class Correlation {
        private double concentrationThreshold = 0.3;
        private double dominantThreshold = 0.5;
        private int burstEntityThreshold = 10;
        // Max coefficient of variation of per-entity activity still considered "near-uniform"
        private double burstMaxCv = 0.25;
        private double multiSegmentThreshold = 0.7;
        private double multiSegmentHighConfidence = 0.85;
        private int segmentTopK = 10;
        private long segmentMinSupport = 50;
    }

    @Data
    public static class GuardrailSettings {
        private ConcurrencyPolicy concurrencyPolicy = ConcurrencyPolicy.FAIL_FAST;
        private Duration queueTimeout = Duration.ofSeconds(30);
        // Zero disables the cooldown between confirmations of the same cohort+metric
        private Duration alertCooldown = Duration.ZERO;
    }

    @Data
    public static class Job {
        private int workerPoolSize = 4;
        // Measured from the start of the call
        private Duration fetchTimeout = Duration.ofSeconds(30);
        // Longest wait for a free fetch thread before the fetch counts as failed
        private Duration fetchQueueTimeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Query {
        private int maxResults = 500;
        private int recentRunsLimit = 50;
    }
}
