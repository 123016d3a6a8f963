package com.fraud.cohortanomaly.config;

import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AerospikeConfigTest {

    private final AerospikeConfig config =
            new AerospikeConfig("10.0.0.5", 3100, "fraud_test", 40, 2500, 800, 15000);

    @Test
    void recordPolicies_useConfiguredTimeouts() {
        WritePolicy write = config.defaultWritePolicy();
        Policy read = config.defaultReadPolicy();

        assertThat(write.totalTimeout).isEqualTo(2500);
        assertThat(write.socketTimeout).isEqualTo(800);
        assertThat(read.totalTimeout).isEqualTo(2500);
        assertThat(read.socketTimeout).isEqualTo(800);
    }

    @Test
    void cohortScanPolicy_scansNodesConcurrentlyWithOwnTimeout() {
        ScanPolicy scan = config.cohortScanPolicy();

        assertThat(scan.concurrentNodes).isTrue();
        assertThat(scan.includeBinData).isTrue();
        assertThat(scan.totalTimeout).isEqualTo(15000);
        assertThat(scan.socketTimeout).isEqualTo(800);
    }

    @Test
    void clientPolicy_carriesConnectionLimitAndDefaults() {
        ClientPolicy client = config.clientPolicy();

        assertThat(client.maxConnsPerNode).isEqualTo(40);
        assertThat(client.timeout).isEqualTo(2500);
        assertThat(client.readPolicyDefault.totalTimeout).isEqualTo(2500);
        assertThat(client.writePolicyDefault.socketTimeout).isEqualTo(800);
        assertThat(client.scanPolicyDefault.totalTimeout).isEqualTo(15000);
    }

    @Test
    void aerospikeNamespace_isConfiguredValue() {
        assertThat(config.aerospikeNamespace()).isEqualTo("fraud_test");
    }
}
