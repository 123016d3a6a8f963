package com.fraud.cohortanomaly.repository;

import com.fraud.cohortanomaly.model.AnomalyEvent;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "anomaly.store", havingValue = "memory")
public class InMemoryAnomalyEventRepository implements AnomalyEventRepository {

    private final Map<String, AnomalyEvent> storage = new ConcurrentHashMap<>();

    @Override
    public void save(AnomalyEvent event) {
        storage.put(event.getEventId(), event);
    }

    @Override
    public List<AnomalyEvent> findRecent(String detectorId, long sinceMillis, int limit) {
        return storage.values().stream()
                .filter(e -> detectorId == null || detectorId.equals(e.getDetectorId()))
                .filter(e -> e.getCreatedAt() >= sinceMillis)
                .sorted(Comparator.comparingLong(AnomalyEvent::getCreatedAt).reversed()
                        .thenComparing(AnomalyEvent::getEventId))
                .limit(limit)
                .toList();
    }

    @Override
    public List<AnomalyEvent> findByRunId(String runId) {
        return storage.values().stream()
                .filter(e -> runId.equals(e.getRunId()))
                .sorted(Comparator.comparingLong(AnomalyEvent::getTimestamp))
                .toList();
    }
}
