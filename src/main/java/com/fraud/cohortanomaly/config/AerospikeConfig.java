package com.fraud.cohortanomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Aerospike wiring for the detector, run and event stores and the cohort metric source.
 * Record operations share one timeout pair; cohort metric scans get their own total
 * timeout, which should stay below {@code anomaly.job.fetch-timeout} so the client gives
 * up before the job does.
 */
@Configuration
@ConditionalOnProperty(name = "anomaly.store", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeConfig {

    public static final String SET_DETECTORS = "detectors";
    public static final String SET_DETECTION_RUNS = "detection_runs";
    public static final String SET_ANOMALY_EVENTS = "anomaly_events";
    public static final String SET_COHORT_METRICS = "cohort_metrics";

    private final String host;
    private final int port;
    private final String namespace;
    private final int maxConnsPerNode;
    private final int totalTimeoutMs;
    private final int socketTimeoutMs;
    private final int cohortScanTimeoutMs;

    public AerospikeConfig(@Value("${aerospike.host:127.0.0.1}") String host,
                           @Value("${aerospike.port:3000}") int port,
                           @Value("${aerospike.namespace:fraud}") String namespace,
                           @Value("${aerospike.max-conns-per-node:100}") int maxConnsPerNode,
                           @Value("${aerospike.total-timeout-ms:3000}") int totalTimeoutMs,
                           @Value("${aerospike.socket-timeout-ms:1000}") int socketTimeoutMs,
                           @Value("${aerospike.cohort-scan-timeout-ms:20000}") int cohortScanTimeoutMs) {
        this.host = host;
        this.port = port;
        this.namespace = namespace;
        this.maxConnsPerNode = maxConnsPerNode;
        this.totalTimeoutMs = totalTimeoutMs;
        this.socketTimeoutMs = socketTimeoutMs;
        this.cohortScanTimeoutMs = cohortScanTimeoutMs;
    }

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        return new AerospikeClient(clientPolicy(), host, port);
    }

    ClientPolicy clientPolicy() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = maxConnsPerNode;
        clientPolicy.timeout = totalTimeoutMs;
        clientPolicy.readPolicyDefault = defaultReadPolicy();
        clientPolicy.writePolicyDefault = defaultWritePolicy();
        clientPolicy.scanPolicyDefault = cohortScanPolicy();
        return clientPolicy;
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        return policy;
    }

    // Cohort listing and series reads scan the whole metric set, node by node in parallel
    @Bean
    public ScanPolicy cohortScanPolicy() {
        ScanPolicy policy = new ScanPolicy();
        policy.concurrentNodes = true;
        policy.includeBinData = true;
        policy.totalTimeout = cohortScanTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
