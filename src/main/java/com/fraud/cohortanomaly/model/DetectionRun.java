package com.fraud.cohortanomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bookkeeping for one detection run. Counters only grow and the phase only
 * moves forward; a failed run keeps the counters of the work it finished.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRun {

    private String runId;

    private String detectorId;

    // Window bounds in epoch milliseconds
    private long windowFrom;
    private long windowTo;

    private long startedAt;

    // 0 while the run is still in flight
    private long completedAt;

    private long cohortsProcessed;

    private long cohortsFailed;

    private long anomaliesFound;

    @Builder.Default
    private RunStatus status = RunStatus.CREATED;

    @Builder.Default
    private JobPhase phase = JobPhase.CREATED;

    private String errorMessage;

    /**
     * Moves the run to {@code next}, keeping {@link #status} in step.
     *
     * @throws IllegalStateException if the transition would revert the run
     *                               or leave a terminal phase
     */
    public void advanceTo(JobPhase next) {
        if (!phase.canAdvanceTo(next)) {
            throw new IllegalStateException(String.format(
                    "Run %s cannot move from %s to %s", runId, phase, next));
        }
        this.phase = next;
        this.status = next.getRunStatus();
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }
}
