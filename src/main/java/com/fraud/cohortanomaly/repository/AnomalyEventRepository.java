package com.fraud.cohortanomaly.repository;

import com.fraud.cohortanomaly.model.AnomalyEvent;

import java.util.List;

public interface AnomalyEventRepository {

    void save(AnomalyEvent event);

    /**
     * Events newest first.
     *
     * @param detectorId only events of this detector; null for all detectors
     * @param sinceMillis only events created at or after this instant; 0 for no bound
     * @param limit      maximum number of events returned
     */
    List<AnomalyEvent> findRecent(String detectorId, long sinceMillis, int limit);

    List<AnomalyEvent> findByRunId(String runId);
}
