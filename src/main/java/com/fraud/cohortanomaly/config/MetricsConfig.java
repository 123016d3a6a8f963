package com.fraud.cohortanomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeRuns;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeRuns = registry.gauge("detection.run.active", new AtomicInteger(0));
    }

    public void recordRunStarted() {
        activeRuns.incrementAndGet();
    }

    public void recordRunFinished(String status, Duration elapsed) {
        activeRuns.decrementAndGet();
        Counter.builder("detection.run.count")
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("detection.run.duration")
                .tag("status", status)
                .register(registry)
                .record(elapsed);
    }

    public void recordCohortOutcome(String outcome) {
        Counter.builder("detection.cohort.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String severity) {
        Counter.builder("anomaly.event.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordGuardrailConfirmation(String metric) {
        Counter.builder("guardrail.confirmation.count")
                .tag("metric", metric)
                .register(registry)
                .increment();
    }

    public void recordConcurrentRunRejected(String detectorId) {
        Counter.builder("detection.run.rejected.count")
                .tag("detector_id", detectorId)
                .register(registry)
                .increment();
    }
}
