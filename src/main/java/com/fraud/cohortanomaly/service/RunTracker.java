package com.fraud.cohortanomaly.service;

import com.fraud.cohortanomaly.model.AnomalyEvent;
import com.fraud.cohortanomaly.model.DetectionRun;
import com.fraud.cohortanomaly.model.JobPhase;
import com.fraud.cohortanomaly.repository.AnomalyEventRepository;
import com.fraud.cohortanomaly.repository.DetectionRunRepository;

/**
 * Serializes all updates to one in-flight run. Every change is persisted
 * immediately, so a crash mid-run leaves the counters of the finished work.
 */
class RunTracker {

    private final DetectionRun run;
    private final DetectionRunRepository repository;
    private boolean aborted;

    RunTracker(DetectionRun run, DetectionRunRepository repository) {
        this.run = run;
        this.repository = repository;
    }

    synchronized void advance(JobPhase phase) {
        run.advanceTo(phase);
        repository.save(run);
    }

    synchronized void cohortProcessed() {
        run.setCohortsProcessed(run.getCohortsProcessed() + 1);
        repository.save(run);
    }

    synchronized void cohortFailed() {
        run.setCohortsFailed(run.getCohortsFailed() + 1);
        repository.save(run);
    }

    /**
     * Saves the event and counts it, unless the run was aborted or has finished.
     *
     * @return false if the event was dropped
     */
    synchronized boolean recordAnomaly(AnomalyEvent event, AnomalyEventRepository events) {
        if (aborted || run.isTerminal()) return false;
        events.save(event);
        run.setAnomaliesFound(run.getAnomaliesFound() + 1);
        repository.save(run);
        return true;
    }

    /**
     * Stops further work: queued cohorts are skipped and no more events are saved.
     */
    synchronized void abort() {
        aborted = true;
    }

    synchronized boolean isAborted() {
        return aborted;
    }

    synchronized void complete(long now) {
        run.advanceTo(JobPhase.COMPLETED);
        run.setCompletedAt(now);
        repository.save(run);
    }

    /**
     * Marks the run FAILED unless it already reached a terminal phase.
     */
    synchronized void fail(String detail, long now) {
        if (run.isTerminal()) return;
        run.advanceTo(JobPhase.FAILED);
        run.setErrorMessage(detail);
        run.setCompletedAt(now);
        repository.save(run);
    }

    synchronized String runId() {
        return run.getRunId();
    }

    synchronized DetectionRun snapshot() {
        return run.toBuilder().build();
    }
}
