package com.fraud.cohortanomaly.service;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.correlation.AnomalyCorrelator;
import com.fraud.cohortanomaly.exception.ValidationException;
import com.fraud.cohortanomaly.guardrail.Guardrails;
import com.fraud.cohortanomaly.model.AnomalyEvent;
import com.fraud.cohortanomaly.model.CandidateEntityGroup;
import com.fraud.cohortanomaly.model.DetectionRun;
import com.fraud.cohortanomaly.model.DetectionWindow;
import com.fraud.cohortanomaly.model.Detector;
import com.fraud.cohortanomaly.model.RootPattern;
import com.fraud.cohortanomaly.model.Segment;
import com.fraud.cohortanomaly.repository.AnomalyEventRepository;
import com.fraud.cohortanomaly.repository.DetectionRunRepository;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Entry point for running detectors and reading their results.
 */
@Service
public class DetectionService {

    private final DetectorService detectorService;
    private final DetectionJob detectionJob;
    private final DetectionRunRepository runRepository;
    private final AnomalyEventRepository eventRepository;
    private final AnomalyCorrelator correlator;
    private final Guardrails guardrails;
    private final DetectionConfig config;

    public DetectionService(DetectorService detectorService,
                            DetectionJob detectionJob,
                            DetectionRunRepository runRepository,
                            AnomalyEventRepository eventRepository,
                            AnomalyCorrelator correlator,
                            Guardrails guardrails,
                            DetectionConfig config) {
        this.detectorService = detectorService;
        this.detectionJob = detectionJob;
        this.runRepository = runRepository;
        this.eventRepository = eventRepository;
        this.correlator = correlator;
        this.guardrails = guardrails;
        this.config = config;
    }

    /**
     * Runs the detector over [windowFrom, windowTo).
     *
     * @throws ValidationException for an unknown or disabled detector or an invalid window
     * @throws com.fraud.cohortanomaly.exception.ConcurrentRunException if the detector is already running
     */
    @Observed(name = "detection.run", contextualName = "run-detection")
    public DetectionRun runDetection(String detectorId, Instant windowFrom, Instant windowTo) {
        DetectionWindow window = DetectionWindow.of(windowFrom, windowTo);
        Detector detector = detectorService.requireDetector(detectorId);
        return detectionJob.run(detector, window);
    }

    /**
     * Newest first, capped at the configured maximum.
     *
     * @param detectorId restrict to one detector; null for all
     * @param since      only events created at or after this instant; null for no bound
     */
    public List<AnomalyEvent> getRecentAnomalies(String detectorId, Instant since) {
        long sinceMillis = since == null ? 0L : since.toEpochMilli();
        return eventRepository.findRecent(detectorId, sinceMillis, config.getQuery().getMaxResults());
    }

    public List<AnomalyEvent> getRunAnomalies(String runId) {
        return eventRepository.findByRunId(runId);
    }

    /**
     * Ranked root-cause hypotheses for a confirmed anomaly. Correlation
     * overrides of the anomaly's detector apply when the detector still exists.
     */
    public List<RootPattern> correlate(AnomalyEvent anomaly, List<Segment> segments,
                                       List<CandidateEntityGroup> candidateEntities) {
        if (anomaly == null) {
            throw new ValidationException("Anomaly is required for correlation");
        }
        Detector detector = anomaly.getDetectorId() == null
                ? null : detectorService.getDetector(anomaly.getDetectorId());
        return correlator.correlate(anomaly, segments, candidateEntities,
                detector == null ? null : detector.getParams());
    }

    public DetectionRun getRun(String runId) {
        return runRepository.findById(runId);
    }

    public List<DetectionRun> getRecentRuns(String detectorId) {
        return runRepository.findByDetectorId(detectorId, config.getQuery().getRecentRunsLimit());
    }

    /**
     * Clears debounce state for one detector, or for all detectors when
     * {@code detectorId} is null.
     *
     * @return number of keys reset
     */
    public int resetGuardrails(String detectorId) {
        return detectorId == null ? guardrails.resetAll() : guardrails.resetDetector(detectorId);
    }
}
