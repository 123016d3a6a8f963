package com.fraud.cohortanomaly.engine;

import com.fraud.cohortanomaly.exception.UnknownDetectorTypeException;
import com.fraud.cohortanomaly.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves detector types to their strategy. The set of strategies is fixed
 * when the registry is built; unknown or unimplemented types are rejected.
 */
@Component
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final Map<DetectorType, SeriesDetector> detectors;

    public DetectorRegistry(List<SeriesDetector> strategies) {
        Map<DetectorType, SeriesDetector> map = new EnumMap<>(DetectorType.class);
        for (SeriesDetector strategy : strategies) {
            SeriesDetector previous = map.put(strategy.getSupportedType(), strategy);
            if (previous != null) {
                throw new IllegalStateException(String.format("Detector type %s registered twice: %s and %s",
                        strategy.getSupportedType(), previous.getClass().getSimpleName(),
                        strategy.getClass().getSimpleName()));
            }
            log.info("Registered detector strategy: {} -> {}",
                    strategy.getSupportedType(), strategy.getClass().getSimpleName());
        }
        this.detectors = Collections.unmodifiableMap(map);
    }

    public SeriesDetector resolve(DetectorType type) {
        SeriesDetector detector = type == null ? null : detectors.get(type);
        if (detector == null) {
            throw new UnknownDetectorTypeException(String.valueOf(type));
        }
        return detector;
    }

    /**
     * Resolves a raw type string such as {@code "stl_mad"} or {@code "cusum"}.
     */
    public SeriesDetector resolve(String type) {
        return resolve(DetectorType.fromString(type));
    }

    public Set<DetectorType> supportedTypes() {
        return detectors.keySet();
    }
}
