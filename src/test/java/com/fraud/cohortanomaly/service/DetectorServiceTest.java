package com.fraud.cohortanomaly.service;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.engine.DetectorRegistry;
import com.fraud.cohortanomaly.engine.detectors.CumulativeSumDetector;
import com.fraud.cohortanomaly.engine.detectors.SeasonalDecompositionDetector;
import com.fraud.cohortanomaly.exception.UnknownDetectorTypeException;
import com.fraud.cohortanomaly.exception.ValidationException;
import com.fraud.cohortanomaly.model.Detector;
import com.fraud.cohortanomaly.model.DetectorRegistration;
import com.fraud.cohortanomaly.model.DetectorType;
import com.fraud.cohortanomaly.repository.InMemoryDetectorRepository;
import com.fraud.cohortanomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorServiceTest {

    private InMemoryDetectorRepository repository;
    private DetectorService service;

    @BeforeEach
    void setUp() {
        DetectionConfig config = TestDataFactory.createConfig();
        config.getDetectorDefaults().setSensitivity(4.0);
        config.getDetectorDefaults().setPersistence(3);

        repository = new InMemoryDetectorRepository();
        DetectorRegistry registry = new DetectorRegistry(
                List.of(new SeasonalDecompositionDetector(), new CumulativeSumDetector()));
        service = new DetectorService(repository, registry, config,
                Clock.fixed(TestDataFactory.START, ZoneOffset.UTC));
    }

    private DetectorRegistration.DetectorRegistrationBuilder registration(String id, String type) {
        return DetectorRegistration.builder()
                .detectorId(id)
                .name("Merchant volume")
                .type(type)
                .cohortDimensions(List.of("merchant_id"))
                .metrics(List.of("tx_count"));
    }

    @Test
    void registerDetector_missingParams_fallBackToConfiguredDefaults() {
        Detector detector = service.registerDetector(registration("DET-1", "stl_mad").minSupport(20).build());

        assertThat(detector.getType()).isEqualTo(DetectorType.STL_MAD);
        assertThat(detector.getParams().getKThreshold()).isEqualTo(4.0);
        assertThat(detector.getParams().getPersistence()).isEqualTo(3);
        assertThat(detector.getParams().getMinSupport()).isEqualTo(20);
        assertThat(detector.isEnabled()).isTrue();
        assertThat(detector.getCreatedAt()).isEqualTo(TestDataFactory.START.toEpochMilli());
        assertThat(repository.findById("DET-1")).isEqualTo(detector);
    }

    @Test
    void registerDetector_noId_generatesOne() {
        Detector detector = service.registerDetector(registration(null, "CUSUM").build());

        assertThat(detector.getDetectorId()).isNotBlank();
        assertThat(service.getDetector(detector.getDetectorId())).isNotNull();
    }

    @Test
    void registerDetector_unknownType_rejected() {
        assertThatThrownBy(() -> service.registerDetector(registration("DET-1", "isolation_forest").build()))
                .isInstanceOfSatisfying(UnknownDetectorTypeException.class,
                        e -> assertThat(e.getRequestedType()).isEqualTo("isolation_forest"));
        assertThat(repository.findAll()).isEmpty();
    }

    @Test
    void registerDetector_duplicateId_rejected() {
        service.registerDetector(registration("DET-1", "cusum").build());

        assertThatThrownBy(() -> service.registerDetector(registration("DET-1", "cusum").build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void registerDetector_noMetrics_rejected() {
        assertThatThrownBy(() -> service.registerDetector(registration("DET-1", "cusum").metrics(List.of()).build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void registerDetector_invalidSensitivity_rejected() {
        assertThatThrownBy(() -> service.registerDetector(registration("DET-1", "stl_mad").kThreshold(-1.0).build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void setEnabled_persistsFlag() {
        service.registerDetector(registration("DET-1", "cusum").build());

        service.setEnabled("DET-1", false);

        assertThat(service.requireDetector("DET-1").isEnabled()).isFalse();
    }

    @Test
    void setEnabled_unknownDetector_throwsValidationError() {
        assertThatThrownBy(() -> service.setEnabled("missing", true))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void deleteDetector_removesOnce() {
        service.registerDetector(registration("DET-1", "cusum").build());

        assertThat(service.deleteDetector("DET-1")).isTrue();
        assertThat(service.deleteDetector("DET-1")).isFalse();
        assertThat(service.getAllDetectors()).isEmpty();
    }
}
