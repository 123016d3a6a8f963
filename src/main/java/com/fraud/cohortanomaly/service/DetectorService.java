package com.fraud.cohortanomaly.service;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.engine.DetectorRegistry;
import com.fraud.cohortanomaly.exception.ValidationException;
import com.fraud.cohortanomaly.model.Detector;
import com.fraud.cohortanomaly.model.DetectorParams;
import com.fraud.cohortanomaly.model.DetectorRegistration;
import com.fraud.cohortanomaly.model.DetectorType;
import com.fraud.cohortanomaly.repository.DetectorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service layer for managing detector configurations.
 */
@Service
public class DetectorService {

    private static final Logger log = LoggerFactory.getLogger(DetectorService.class);

    private final DetectorRepository detectorRepository;
    private final DetectorRegistry registry;
    private final DetectionConfig config;
    private final Clock clock;

    public DetectorService(DetectorRepository detectorRepository, DetectorRegistry registry,
                           DetectionConfig config, Clock clock) {
        this.detectorRepository = detectorRepository;
        this.registry = registry;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Validates and stores a new detector.
     *
     * @throws ValidationException on invalid parameters or an unknown detector type
     */
    public Detector registerDetector(DetectorRegistration request) {
        if (request == null) {
            throw new ValidationException("Registration request is required");
        }
        DetectorType type = DetectorType.fromString(request.getType());
        // rejects types without a strategy bean
        registry.resolve(type);

        String detectorId = request.getDetectorId();
        if (detectorId == null || detectorId.isBlank()) {
            detectorId = UUID.randomUUID().toString();
        } else if (detectorRepository.findById(detectorId) != null) {
            throw new ValidationException("Detector " + detectorId + " already exists");
        }

        long now = clock.millis();
        Detector detector = Detector.builder()
                .detectorId(detectorId)
                .name(request.getName() != null ? request.getName() : detectorId)
                .type(type)
                .cohortDimensions(copy(request.getCohortDimensions()))
                .metrics(copy(request.getMetrics()))
                .params(paramsFor(request))
                .enabled(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
        detector.validate();

        detectorRepository.save(detector);
        log.info("Registered detector {} ({}): dimensions={} metrics={} params={}",
                detectorId, type, detector.getCohortDimensions(), detector.getMetrics(), detector.getParams());
        return detector;
    }

    public Detector getDetector(String detectorId) {
        return detectorRepository.findById(detectorId);
    }

    /**
     * @throws ValidationException if no detector is stored under {@code detectorId}
     */
    public Detector requireDetector(String detectorId) {
        if (detectorId == null || detectorId.isBlank()) {
            throw new ValidationException("Detector id is required");
        }
        Detector detector = detectorRepository.findById(detectorId);
        if (detector == null) {
            throw new ValidationException("Unknown detector: " + detectorId);
        }
        return detector;
    }

    public List<Detector> getAllDetectors() {
        return detectorRepository.findAll();
    }

    public Detector setEnabled(String detectorId, boolean enabled) {
        Detector detector = requireDetector(detectorId);
        detector.setEnabled(enabled);
        detector.setUpdatedAt(clock.millis());
        detectorRepository.save(detector);
        log.info("Detector {} {}", detectorId, enabled ? "enabled" : "disabled");
        return detector;
    }

    public boolean deleteDetector(String detectorId) {
        boolean deleted = detectorRepository.delete(detectorId);
        if (deleted) {
            log.info("Deleted detector {}", detectorId);
        }
        return deleted;
    }

    private DetectorParams paramsFor(DetectorRegistration request) {
        DetectionConfig.DetectorDefaults defaults = config.getDetectorDefaults();
        return DetectorParams.builder()
                .kThreshold(orDefault(request.getKThreshold(), defaults.getSensitivity()))
                .persistence(orDefault(request.getPersistence(), defaults.getPersistence()))
                .minSupport(orDefault(request.getMinSupport(), defaults.getMinSupport()))
                .seasonalPeriod(orDefault(request.getSeasonalPeriod(), defaults.getSeasonalPeriod()))
                .trendBlockSize(orDefault(request.getTrendBlockSize(), defaults.getTrendBlockSize()))
                .cusumDrift(orDefault(request.getCusumDrift(), defaults.getCusumDrift()))
                .concentrationThreshold(request.getConcentrationThreshold())
                .burstEntityThreshold(request.getBurstEntityThreshold())
                .multiSegmentThreshold(request.getMultiSegmentThreshold())
                .build();
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static List<String> copy(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
