package com.fraud.cohortanomaly.repository;

import com.fraud.cohortanomaly.model.DetectionRun;

import java.util.List;

public interface DetectionRunRepository {

    /**
     * Insert or overwrite the run record. Called repeatedly while a run progresses.
     */
    void save(DetectionRun run);

    /**
     * @return the run, or null if unknown
     */
    DetectionRun findById(String runId);

    /**
     * Runs of one detector, newest first.
     */
    List<DetectionRun> findByDetectorId(String detectorId, int limit);
}
