package com.fraud.cohortanomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fraud.cohortanomaly.config.AerospikeConfig;
import com.fraud.cohortanomaly.model.AnomalyEvent;
import com.fraud.cohortanomaly.model.Severity;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

@Repository
@ConditionalOnProperty(name = "anomaly.store", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeAnomalyEventRepository implements AnomalyEventRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;

    public AerospikeAnomalyEventRepository(AerospikeClient client,
                                           @Qualifier("aerospikeNamespace") String namespace,
                                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        // Events are immutable: a second write under the same id must fail
        this.createOnlyPolicy = new WritePolicy(writePolicy);
        this.createOnlyPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
    }

    @Override
    public void save(AnomalyEvent event) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_EVENTS, event.getEventId());

        client.put(createOnlyPolicy, key,
                new Bin("eventId", event.getEventId()),
                new Bin("runId", event.getRunId()),
                new Bin("detectorId", event.getDetectorId()),
                new Bin("cohortKey", event.getCohortKey()),
                new Bin("metric", event.getMetric()),
                new Bin("ts", event.getTimestamp()),
                new Bin("score", event.getScore()),
                new Bin("severity", event.getSeverity().name()),
                new Bin("persistedN", event.getPersistedN()),
                new Bin("createdAt", event.getCreatedAt()));
    }

    @Override
    public List<AnomalyEvent> findRecent(String detectorId, long sinceMillis, int limit) {
        List<AnomalyEvent> events = scan(record ->
                (detectorId == null || detectorId.equals(record.getString("detectorId")))
                        && record.getLong("createdAt") >= sinceMillis);

        events.sort(Comparator.comparingLong(AnomalyEvent::getCreatedAt).reversed()
                .thenComparing(AnomalyEvent::getEventId));
        if (events.size() > limit) {
            return events.subList(0, limit);
        }
        return events;
    }

    @Override
    public List<AnomalyEvent> findByRunId(String runId) {
        List<AnomalyEvent> events = scan(record -> runId.equals(record.getString("runId")));
        events.sort(Comparator.comparingLong(AnomalyEvent::getTimestamp));
        return events;
    }

    private List<AnomalyEvent> scan(Predicate<Record> filter) {
        List<AnomalyEvent> events = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_EVENTS,
                (key, record) -> {
                    if (filter.test(record)) {
                        synchronized (events) {
                            events.add(mapRecord(record));
                        }
                    }
                });
        return events;
    }

    private AnomalyEvent mapRecord(Record record) {
        return AnomalyEvent.builder()
                .eventId(record.getString("eventId"))
                .runId(record.getString("runId"))
                .detectorId(record.getString("detectorId"))
                .cohortKey(record.getString("cohortKey"))
                .metric(record.getString("metric"))
                .timestamp(record.getLong("ts"))
                .score(record.getDouble("score"))
                .severity(Severity.valueOf(record.getString("severity")))
                .persistedN(record.getInt("persistedN"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
