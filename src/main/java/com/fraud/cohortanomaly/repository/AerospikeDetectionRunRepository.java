package com.fraud.cohortanomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fraud.cohortanomaly.config.AerospikeConfig;
import com.fraud.cohortanomaly.model.DetectionRun;
import com.fraud.cohortanomaly.model.JobPhase;
import com.fraud.cohortanomaly.model.RunStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
@ConditionalOnProperty(name = "anomaly.store", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeDetectionRunRepository implements DetectionRunRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeDetectionRunRepository(AerospikeClient client,
                                           @Qualifier("aerospikeNamespace") String namespace,
                                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                           @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public void save(DetectionRun run) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, run.getRunId());

        client.put(writePolicy, key,
                new Bin("runId", run.getRunId()),
                new Bin("detectorId", run.getDetectorId()),
                new Bin("windowFrom", run.getWindowFrom()),
                new Bin("windowTo", run.getWindowTo()),
                new Bin("startedAt", run.getStartedAt()),
                new Bin("completedAt", run.getCompletedAt()),
                new Bin("cohortsDone", run.getCohortsProcessed()),
                new Bin("cohortsFailed", run.getCohortsFailed()),
                new Bin("anomalies", run.getAnomaliesFound()),
                new Bin("status", run.getStatus().name()),
                new Bin("phase", run.getPhase().name()),
                new Bin("errorMessage", run.getErrorMessage()));
    }

    @Override
    public DetectionRun findById(String runId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, runId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    @Override
    public List<DetectionRun> findByDetectorId(String detectorId, int limit) {
        List<DetectionRun> runs = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DETECTION_RUNS,
                (key, record) -> {
                    if (detectorId.equals(record.getString("detectorId"))) {
                        synchronized (runs) {
                            runs.add(mapRecord(record));
                        }
                    }
                });

        runs.sort(Comparator.comparingLong(DetectionRun::getStartedAt).reversed());
        if (runs.size() > limit) {
            return runs.subList(0, limit);
        }
        return runs;
    }

    private DetectionRun mapRecord(Record record) {
        return DetectionRun.builder()
                .runId(record.getString("runId"))
                .detectorId(record.getString("detectorId"))
                .windowFrom(record.getLong("windowFrom"))
                .windowTo(record.getLong("windowTo"))
                .startedAt(record.getLong("startedAt"))
                .completedAt(record.getLong("completedAt"))
                .cohortsProcessed(record.getLong("cohortsDone"))
                .cohortsFailed(record.getLong("cohortsFailed"))
                .anomaliesFound(record.getLong("anomalies"))
                .status(RunStatus.valueOf(record.getString("status")))
                .phase(JobPhase.valueOf(record.getString("phase")))
                .errorMessage(record.getString("errorMessage"))
                .build();
    }
}
