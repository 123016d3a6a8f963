package com.fraud.cohortanomaly.repository;

import com.fraud.cohortanomaly.model.DetectionRun;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "anomaly.store", havingValue = "memory")
public class InMemoryDetectionRunRepository implements DetectionRunRepository {

    private final Map<String, DetectionRun> storage = new ConcurrentHashMap<>();

    @Override
    public void save(DetectionRun run) {
        // Store a copy so later in-place updates by the job are only visible after the next save
        storage.put(run.getRunId(), run.toBuilder().build());
    }

    @Override
    public DetectionRun findById(String runId) {
        DetectionRun run = storage.get(runId);
        return run == null ? null : run.toBuilder().build();
    }

    @Override
    public List<DetectionRun> findByDetectorId(String detectorId, int limit) {
        return storage.values().stream()
                .filter(run -> detectorId.equals(run.getDetectorId()))
                .sorted(Comparator.comparingLong(DetectionRun::getStartedAt).reversed())
                .limit(limit)
                .map(run -> run.toBuilder().build())
                .toList();
    }
}
