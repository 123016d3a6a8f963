package com.fraud.cohortanomaly.model;

/**
 * Detection job state machine. Phases only move forward; FAILED is reachable
 * from any non-terminal phase.
 */
public enum JobPhase {
    CREATED(RunStatus.CREATED),
    FETCHING_COHORTS(RunStatus.RUNNING),
    DETECTING(RunStatus.RUNNING),
    COMPLETED(RunStatus.COMPLETED),
    FAILED(RunStatus.FAILED);

    private final RunStatus runStatus;

    JobPhase(RunStatus runStatus) {
        this.runStatus = runStatus;
    }

    public RunStatus getRunStatus() {
        return runStatus;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canAdvanceTo(JobPhase next) {
        if (isTerminal()) return false;
        if (next == FAILED) return true;
        return next.ordinal() > this.ordinal();
    }
}
