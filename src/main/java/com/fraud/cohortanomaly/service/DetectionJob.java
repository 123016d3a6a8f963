package com.fraud.cohortanomaly.service;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.config.MetricsConfig;
import com.fraud.cohortanomaly.datasource.CohortDataSource;
import com.fraud.cohortanomaly.engine.DetectorRegistry;
import com.fraud.cohortanomaly.engine.SeriesDetector;
import com.fraud.cohortanomaly.exception.ConcurrentRunException;
import com.fraud.cohortanomaly.exception.DataSourceConnectionException;
import com.fraud.cohortanomaly.exception.DetectionInputException;
import com.fraud.cohortanomaly.exception.EmptyResultException;
import com.fraud.cohortanomaly.exception.ValidationException;
import com.fraud.cohortanomaly.guardrail.GuardrailKey;
import com.fraud.cohortanomaly.guardrail.Guardrails;
import com.fraud.cohortanomaly.model.AnomalyEvent;
import com.fraud.cohortanomaly.model.CohortKey;
import com.fraud.cohortanomaly.model.DetectionResult;
import com.fraud.cohortanomaly.model.DetectionRun;
import com.fraud.cohortanomaly.model.DetectionWindow;
import com.fraud.cohortanomaly.model.Detector;
import com.fraud.cohortanomaly.model.JobPhase;
import com.fraud.cohortanomaly.model.MetricSeries;
import com.fraud.cohortanomaly.model.Severity;
import com.fraud.cohortanomaly.repository.AnomalyEventRepository;
import com.fraud.cohortanomaly.repository.DetectionRunRepository;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one detector over one window, end to end.
 *
 * Flow:
 * 1. Validate the window and detector (no run record on failure)
 * 2. Claim the detector's run slot
 * 3. Create the run (RUNNING) and list cohorts
 * 4. Fan cohorts out to the worker pool: fetch series, detect, debounce, emit events
 * 5. Mark the run COMPLETED, or FAILED on a data-source connection failure
 *
 * Cohort-level failures are logged and isolated. A connection failure aborts
 * the run: queued cohorts are skipped, in-flight cohorts are waited for, no
 * further events are saved, and the run fails keeping the counters of finished work.
 */
@Component
public class DetectionJob {

    private static final Logger log = LoggerFactory.getLogger(DetectionJob.class);

    private final CohortDataSource dataSource;
    private final DetectorRegistry registry;
    private final Guardrails guardrails;
    private final SeverityScorer severityScorer;
    private final DetectionRunRepository runRepository;
    private final AnomalyEventRepository eventRepository;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;
    private final ExecutorService workerPool;
    private final ExecutorService fetchPool;

    public DetectionJob(CohortDataSource dataSource,
                        DetectorRegistry registry,
                        Guardrails guardrails,
                        SeverityScorer severityScorer,
                        DetectionRunRepository runRepository,
                        AnomalyEventRepository eventRepository,
                        DetectionConfig config,
                        MetricsConfig metricsConfig,
                        Tracer tracer,
                        Clock clock,
                        @Qualifier("detectionWorkerPool") ExecutorService workerPool,
                        @Qualifier("dataSourceFetchPool") ExecutorService fetchPool) {
        this.dataSource = dataSource;
        this.registry = registry;
        this.guardrails = guardrails;
        this.severityScorer = severityScorer;
        this.runRepository = runRepository;
        this.eventRepository = eventRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;
        this.workerPool = workerPool;
        this.fetchPool = fetchPool;
    }

    /**
     * @return the final state of the run: COMPLETED, or FAILED with an error message
     *         when the data source failed
     * @throws ValidationException if the detector cannot run; no run record is created
     * @throws ConcurrentRunException if another run of the detector is in flight
     */
    public DetectionRun run(Detector detector, DetectionWindow window) {
        SeriesDetector strategy = validate(detector);

        String detectorId = detector.getDetectorId();
        String runId = UUID.randomUUID().toString();
        try {
            guardrails.acquireRun(detectorId, runId);
        } catch (ConcurrentRunException e) {
            metricsConfig.recordConcurrentRunRejected(detectorId);
            throw e;
        }

        long startedAt = clock.millis();
        metricsConfig.recordRunStarted();
        RunTracker tracker = null;
        try {
            DetectionRun run = DetectionRun.builder()
                    .runId(runId)
                    .detectorId(detectorId)
                    .windowFrom(window.getFrom().toEpochMilli())
                    .windowTo(window.getTo().toEpochMilli())
                    .startedAt(startedAt)
                    .build();
            tracker = new RunTracker(run, runRepository);

            log.info("Run {} started: detector={} type={} window=[{}, {})",
                    runId, detectorId, detector.getType(), window.getFrom(), window.getTo());

            tracker.advance(JobPhase.FETCHING_COHORTS);
            List<CohortKey> cohorts = fetch(() -> dataSource.getCohorts(detector, window),
                    "cohort listing for detector " + detectorId);
            log.info("Run {}: {} cohorts to evaluate", runId, cohorts.size());

            tracker.advance(JobPhase.DETECTING);
            processCohorts(detector, strategy, window, cohorts, tracker);

            tracker.complete(clock.millis());
            DetectionRun finished = tracker.snapshot();
            log.info("Run {} completed: cohorts={} failed={} anomalies={}",
                    runId, finished.getCohortsProcessed(), finished.getCohortsFailed(),
                    finished.getAnomaliesFound());
            return finished;
        } catch (DataSourceConnectionException e) {
            log.warn("Run {} aborted, data source failure: {}", runId, e.getMessage());
            tracker.fail(e.getMessage(), clock.millis());
            return tracker.snapshot();
        } catch (RuntimeException e) {
            log.error("Run {} failed unexpectedly: {}", runId, e.getMessage(), e);
            if (tracker != null) {
                try {
                    tracker.fail(e.getClass().getSimpleName() + ": " + e.getMessage(), clock.millis());
                } catch (RuntimeException saveFailure) {
                    e.addSuppressed(saveFailure);
                }
            }
            throw e;
        } finally {
            guardrails.releaseRun(detectorId);
            String status = tracker == null ? "FAILED" : tracker.snapshot().getStatus().name();
            metricsConfig.recordRunFinished(status, Duration.ofMillis(clock.millis() - startedAt));
        }
    }

    private SeriesDetector validate(Detector detector) {
        if (detector == null) {
            throw new ValidationException("Detector is required");
        }
        detector.validate();
        if (!detector.isEnabled()) {
            throw new ValidationException("Detector " + detector.getDetectorId() + " is disabled");
        }
        return registry.resolve(detector.getType());
    }

    /**
     * Runs every cohort on the worker pool and waits for all of them, also after
     * a failure: the run slot must not be released while a worker of this run
     * can still touch guardrail state or save events.
     */
    private void processCohorts(Detector detector, SeriesDetector strategy, DetectionWindow window,
                                List<CohortKey> cohorts, RunTracker tracker) {
        ExecutorCompletionService<Void> completion = new ExecutorCompletionService<>(workerPool);
        for (CohortKey cohort : cohorts) {
            completion.submit(() -> {
                processCohort(detector, strategy, window, cohort, tracker);
                return null;
            });
        }

        RuntimeException failure = null;
        boolean interrupted = false;
        int remaining = cohorts.size();
        while (remaining > 0) {
            try {
                Future<Void> done = completion.take();
                remaining--;
                done.get();
            } catch (ExecutionException e) {
                tracker.abort();
                if (failure == null) {
                    failure = e.getCause() instanceof DataSourceConnectionException connectionFailure
                            ? connectionFailure
                            : new IllegalStateException("Cohort worker escaped isolation", e.getCause());
                }
            } catch (InterruptedException e) {
                // keep draining; queued cohorts see the abort and return at once
                interrupted = true;
                tracker.abort();
                if (failure == null) {
                    failure = new IllegalStateException("Run " + tracker.runId() + " interrupted", e);
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void processCohort(Detector detector, SeriesDetector strategy, DetectionWindow window,
                               CohortKey cohort, RunTracker tracker) {
        if (tracker.isAborted()) return;

        Span span = tracer.nextSpan()
                .name("detection.cohort")
                .tag("detector.id", detector.getDetectorId())
                .tag("cohort", cohort.asString())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            int emitted = 0;
            for (String metric : detector.getMetrics()) {
                if (tracker.isAborted()) return;
                try {
                    MetricSeries series = fetch(() -> dataSource.getSeries(cohort, metric, window),
                            "series " + metric + " for cohort " + cohort);
                    DetectionResult result = strategy.detect(series, detector.getParams());
                    AnomalyEvent event = confirm(detector, cohort, metric, series, result, tracker.runId());

                    if (event != null && tracker.recordAnomaly(event, eventRepository)) {
                        metricsConfig.recordAnomaly(event.getSeverity().name());
                        emitted++;
                        log.info("Anomaly {} confirmed: cohort={} metric={} score={} severity={} persisted={}",
                                event.getEventId(), cohort, metric,
                                String.format("%.2f", event.getScore()), event.getSeverity(), event.getPersistedN());
                    }
                } catch (DetectionInputException | EmptyResultException e) {
                    metricsConfig.recordCohortOutcome("skipped");
                    log.info("Skipping metric {} for cohort {} in run {}: {}",
                            metric, cohort, tracker.runId(), e.getMessage());
                }
            }
            span.tag("anomalies", String.valueOf(emitted));
            tracker.cohortProcessed();
            metricsConfig.recordCohortOutcome("processed");
        } catch (DataSourceConnectionException e) {
            // stop queued cohorts before the coordinator sees the failure
            tracker.abort();
            span.error(e);
            throw e;
        } catch (RuntimeException e) {
            span.error(e);
            metricsConfig.recordCohortOutcome("failed");
            log.error("Cohort {} failed in run {} (detector {}): {}",
                    cohort, tracker.runId(), detector.getDetectorId(), e.getMessage(), e);
            tracker.cohortFailed();
        } finally {
            span.end();
        }
    }

    /**
     * Feeds every point of the series to the persistence guardrail in order.
     * The first confirmed excursion is followed to its end and becomes the
     * series' single event; later points still update guardrail state.
     *
     * @return the event, or null if no excursion was confirmed
     */
    AnomalyEvent confirm(Detector detector, CohortKey cohort, String metric,
                         MetricSeries series, DetectionResult result, String runId) {
        GuardrailKey key = GuardrailKey.of(detector.getDetectorId(), cohort.asString(), metric);
        int persistence = detector.getParams().getPersistence();
        double threshold = result.getThreshold();
        double[] scores = result.getScores();

        AnomalyEvent event = null;
        int i = 0;
        while (i < scores.length) {
            boolean confirmed = guardrails.checkPersistence(key, scores[i], threshold, persistence);
            if (!confirmed || event != null) {
                i++;
                continue;
            }

            int confirmedAt = i;
            int persistedN = guardrails.consecutiveCount(key);
            double peak = 0.0;
            for (int j = Math.max(0, i - persistence + 1); j <= i; j++) {
                peak = Math.max(peak, scores[j]);
            }

            i++;
            while (i < scores.length) {
                guardrails.checkPersistence(key, scores[i], threshold, persistence);
                if (!(scores[i] > threshold)) break;
                peak = Math.max(peak, scores[i]);
                persistedN++;
                i++;
            }

            metricsConfig.recordGuardrailConfirmation(metric);
            Severity severity = severityScorer.determineSeverity(peak, persistedN, threshold);
            event = AnomalyEvent.builder()
                    .eventId(UUID.randomUUID().toString())
                    .runId(runId)
                    .detectorId(detector.getDetectorId())
                    .cohortKey(cohort.asString())
                    .metric(metric)
                    .timestamp(series.getTimestamps().get(confirmedAt).toEpochMilli())
                    .score(peak)
                    .severity(severity)
                    .persistedN(persistedN)
                    .createdAt(clock.millis())
                    .build();
            i++;
        }
        return event;
    }

    /**
     * Runs a data-source call on the fetch pool. The fetch timeout counts from
     * the moment the call starts; time spent queued behind other runs' fetches
     * is bounded separately by the queue timeout.
     */
    private <T> T fetch(Callable<T> call, String what) {
        Duration timeout = config.getJob().getFetchTimeout();
        Duration queueTimeout = config.getJob().getFetchQueueTimeout();
        CountDownLatch started = new CountDownLatch(1);
        Future<T> future = fetchPool.submit(() -> {
            started.countDown();
            return call.call();
        });
        try {
            // a call that slipped in after the wait cannot be cancelled and is awaited normally
            if (!started.await(queueTimeout.toMillis(), TimeUnit.MILLISECONDS) && future.cancel(false)) {
                throw new DataSourceConnectionException(
                        what + " not started within " + queueTimeout + ", fetch pool saturated");
            }
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DataSourceConnectionException(what + " timed out after " + timeout, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DataSourceConnectionException(what + " failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new DataSourceConnectionException(what + " interrupted", e);
        }
    }
}
