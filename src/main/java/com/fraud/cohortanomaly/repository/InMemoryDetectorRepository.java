package com.fraud.cohortanomaly.repository;

import com.fraud.cohortanomaly.model.Detector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "anomaly.store", havingValue = "memory")
public class InMemoryDetectorRepository implements DetectorRepository {

    private final Map<String, Detector> storage = new ConcurrentHashMap<>();

    @Override
    public void save(Detector detector) {
        storage.put(detector.getDetectorId(), detector.toBuilder().build());
    }

    @Override
    public Detector findById(String detectorId) {
        Detector detector = storage.get(detectorId);
        return detector == null ? null : detector.toBuilder().build();
    }

    @Override
    public List<Detector> findAll() {
        List<Detector> all = new ArrayList<>();
        for (Detector d : storage.values()) {
            all.add(d.toBuilder().build());
        }
        all.sort(Comparator.comparing(Detector::getDetectorId));
        return all;
    }

    @Override
    public boolean delete(String detectorId) {
        return storage.remove(detectorId) != null;
    }
}
