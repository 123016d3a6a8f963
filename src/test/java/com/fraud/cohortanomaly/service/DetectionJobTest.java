package com.fraud.cohortanomaly.service;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.config.MetricsConfig;
import com.fraud.cohortanomaly.datasource.CohortDataSource;
import com.fraud.cohortanomaly.datasource.InMemoryCohortDataSource;
import com.fraud.cohortanomaly.engine.DetectorRegistry;
import com.fraud.cohortanomaly.engine.detectors.CumulativeSumDetector;
import com.fraud.cohortanomaly.engine.detectors.SeasonalDecompositionDetector;
import com.fraud.cohortanomaly.exception.ConcurrentRunException;
import com.fraud.cohortanomaly.exception.DataSourceConnectionException;
import com.fraud.cohortanomaly.exception.EmptyResultException;
import com.fraud.cohortanomaly.exception.ValidationException;
import com.fraud.cohortanomaly.guardrail.Guardrails;
import com.fraud.cohortanomaly.guardrail.InMemoryGuardrailStateStore;
import com.fraud.cohortanomaly.model.*;
import com.fraud.cohortanomaly.repository.InMemoryAnomalyEventRepository;
import com.fraud.cohortanomaly.repository.InMemoryDetectionRunRepository;
import com.fraud.cohortanomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.fraud.cohortanomaly.testutil.TestDataFactory.merchant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DetectionJobTest {

    private static final DetectionWindow WINDOW = TestDataFactory.windowFor(100);

    private DetectionConfig config;
    private Guardrails guardrails;
    private InMemoryDetectionRunRepository runRepository;
    private InMemoryAnomalyEventRepository eventRepository;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService workerPool;
    private ExecutorService fetchPool;
    private Detector detector;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.createConfig();
        guardrails = new Guardrails(new InMemoryGuardrailStateStore(), config, Clock.systemUTC());
        runRepository = new InMemoryDetectionRunRepository();
        eventRepository = new InMemoryAnomalyEventRepository();
        meterRegistry = new SimpleMeterRegistry();
        // single worker keeps cohort order deterministic
        workerPool = Executors.newFixedThreadPool(1);
        fetchPool = Executors.newFixedThreadPool(3);
        detector = TestDataFactory.createStlDetector("DET-1");
    }

    @AfterEach
    void tearDown() {
        workerPool.shutdownNow();
        fetchPool.shutdownNow();
    }

    @Test
    void run_levelShiftInOneCohort_emitsExactlyOneEventAtLeastWarn() {
        InMemoryCohortDataSource dataSource = new InMemoryCohortDataSource();
        dataSource.load(merchant("M-1"), "tx_count", TestDataFactory.shiftedSeries(42L, 100, 100, 5, 10, 130));
        dataSource.load(merchant("M-2"), "tx_count", TestDataFactory.noisySeries(7L, 100, 100, 5));

        DetectionRun run = newJob(dataSource).run(detector, WINDOW);

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getPhase()).isEqualTo(JobPhase.COMPLETED);
        assertThat(run.getCohortsProcessed()).isEqualTo(2);
        assertThat(run.getCohortsFailed()).isZero();
        assertThat(run.getAnomaliesFound()).isEqualTo(1);
        assertThat(run.getCompletedAt()).isGreaterThanOrEqualTo(run.getStartedAt());

        List<AnomalyEvent> events = eventRepository.findByRunId(run.getRunId());
        assertThat(events).hasSize(1);
        AnomalyEvent event = events.get(0);
        assertThat(event.getCohortKey()).isEqualTo("merchant_id=M-1");
        assertThat(event.getMetric()).isEqualTo("tx_count");
        assertThat(event.getDetectorId()).isEqualTo("DET-1");
        assertThat(event.getSeverity().isAtLeast(Severity.WARN)).isTrue();
        assertThat(event.getPersistedN()).isGreaterThanOrEqualTo(2);
        assertThat(event.getScore()).isGreaterThan(3.5);

        Instant shiftStart = TestDataFactory.START.plus(TestDataFactory.STEP.multipliedBy(90));
        assertThat(Instant.ofEpochMilli(event.getTimestamp())).isAfterOrEqualTo(shiftStart);

        assertThat(runRepository.findById(run.getRunId()).getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(guardrails.isRunInFlight("DET-1")).isFalse();
        assertThat(meterRegistry.counter("detection.run.count", "status", "COMPLETED").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("anomaly.event.count", "severity", event.getSeverity().name()).count())
                .isEqualTo(1.0);
    }

    @Test
    void run_connectionFailureListingCohorts_runFailedWithDetail() {
        CohortDataSource dataSource = mock(CohortDataSource.class);
        when(dataSource.getCohorts(any(), any()))
                .thenThrow(new DataSourceConnectionException("aerospike unreachable"));

        DetectionRun run = newJob(dataSource).run(detector, WINDOW);

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getErrorMessage()).contains("aerospike unreachable");
        assertThat(run.getCohortsProcessed()).isZero();
        assertThat(runRepository.findById(run.getRunId()).getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(guardrails.isRunInFlight("DET-1")).isFalse();
    }

    @Test
    void run_connectionFailureMidRun_keepsCountersOfFinishedWork() {
        CohortDataSource dataSource = mock(CohortDataSource.class);
        when(dataSource.getCohorts(any(), any())).thenReturn(List.of(merchant("M-1"), merchant("M-2"), merchant("M-3")));
        when(dataSource.getSeries(eq(merchant("M-1")), eq("tx_count"), any()))
                .thenReturn(TestDataFactory.noisySeries(3L, 100, 100, 5));
        when(dataSource.getSeries(eq(merchant("M-2")), eq("tx_count"), any()))
                .thenThrow(new DataSourceConnectionException("connection reset"));

        DetectionRun run = newJob(dataSource).run(detector, WINDOW);

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getErrorMessage()).contains("connection reset");
        assertThat(run.getCohortsProcessed()).isEqualTo(1);
        assertThat(eventRepository.findByRunId(run.getRunId())).isEmpty();
    }

    @Test
    void run_connectionFailureWhileOtherCohortBusy_holdsSlotUntilWorkerExits() throws Exception {
        workerPool.shutdownNow();
        workerPool = Executors.newFixedThreadPool(2);
        CountDownLatch busyFetching = new CountDownLatch(1);
        CountDownLatch failing = new CountDownLatch(1);
        CountDownLatch releaseBusy = new CountDownLatch(1);
        CohortDataSource dataSource = new CohortDataSource() {
            @Override
            public List<CohortKey> getCohorts(Detector d, DetectionWindow w) {
                return List.of(merchant("M-1"), merchant("M-2"));
            }

            @Override
            public MetricSeries getSeries(CohortKey cohort, String metric, DetectionWindow w) {
                try {
                    if (cohort.equals(merchant("M-1"))) {
                        busyFetching.countDown();
                        releaseBusy.await(5, TimeUnit.SECONDS);
                        return TestDataFactory.shiftedSeries(42L, 100, 100, 5, 10, 130);
                    }
                    busyFetching.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                failing.countDown();
                throw new DataSourceConnectionException("connection reset");
            }
        };
        DetectionJob job = newJob(dataSource);

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<DetectionRun> first = caller.submit(() -> job.run(detector, WINDOW));
            assertThat(failing.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> first.get(300, TimeUnit.MILLISECONDS))
                    .isInstanceOf(TimeoutException.class);
            assertThat(guardrails.isRunInFlight("DET-1")).isTrue();
            assertThatThrownBy(() -> job.run(detector, WINDOW))
                    .isInstanceOf(ConcurrentRunException.class);

            releaseBusy.countDown();
            DetectionRun run = first.get(10, TimeUnit.SECONDS);

            assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(run.getErrorMessage()).contains("connection reset");
            assertThat(run.getAnomaliesFound()).isZero();
            assertThat(eventRepository.findByRunId(run.getRunId())).isEmpty();
            assertThat(guardrails.isRunInFlight("DET-1")).isFalse();
        } finally {
            releaseBusy.countDown();
            caller.shutdownNow();
        }
    }

    @Test
    void run_fetchQueuedBehindOtherWork_timeoutCountsFromStart() throws Exception {
        fetchPool.shutdownNow();
        fetchPool = Executors.newFixedThreadPool(1);
        config.getJob().setFetchTimeout(Duration.ofMillis(500));
        CountDownLatch occupied = new CountDownLatch(1);
        fetchPool.submit(() -> {
            occupied.countDown();
            Thread.sleep(1_000);
            return null;
        });
        assertThat(occupied.await(5, TimeUnit.SECONDS)).isTrue();
        InMemoryCohortDataSource dataSource = new InMemoryCohortDataSource();
        dataSource.load(merchant("M-1"), "tx_count", TestDataFactory.noisySeries(7L, 100, 100, 5));

        DetectionRun run = newJob(dataSource).run(detector, WINDOW);

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getCohortsProcessed()).isEqualTo(1);
    }

    @Test
    void run_fetchPoolSaturated_failsAfterQueueTimeout() throws Exception {
        fetchPool.shutdownNow();
        fetchPool = Executors.newFixedThreadPool(1);
        config.getJob().setFetchQueueTimeout(Duration.ofMillis(100));
        CountDownLatch occupied = new CountDownLatch(1);
        CountDownLatch hold = new CountDownLatch(1);
        fetchPool.submit(() -> {
            occupied.countDown();
            hold.await(5, TimeUnit.SECONDS);
            return null;
        });
        assertThat(occupied.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            DetectionRun run = newJob(new InMemoryCohortDataSource()).run(detector, WINDOW);

            assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(run.getErrorMessage()).contains("not started within");
        } finally {
            hold.countDown();
        }
    }

    @Test
    void run_unexpectedCohortError_isolatedFromOtherCohorts() {
        CohortDataSource dataSource = mock(CohortDataSource.class);
        when(dataSource.getCohorts(any(), any())).thenReturn(List.of(merchant("M-1"), merchant("M-2")));
        when(dataSource.getSeries(eq(merchant("M-1")), eq("tx_count"), any()))
                .thenThrow(new IllegalStateException("corrupt record"));
        when(dataSource.getSeries(eq(merchant("M-2")), eq("tx_count"), any()))
                .thenReturn(TestDataFactory.shiftedSeries(42L, 100, 100, 5, 10, 130));

        DetectionRun run = newJob(dataSource).run(detector, WINDOW);

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getCohortsFailed()).isEqualTo(1);
        assertThat(run.getCohortsProcessed()).isEqualTo(1);
        assertThat(run.getAnomaliesFound()).isEqualTo(1);
    }

    @Test
    void run_unusableSeries_skippedWithoutFailingCohort() {
        CohortDataSource dataSource = mock(CohortDataSource.class);
        when(dataSource.getCohorts(any(), any())).thenReturn(List.of(merchant("M-1"), merchant("M-2")));
        when(dataSource.getSeries(eq(merchant("M-1")), eq("tx_count"), any()))
                .thenReturn(TestDataFactory.noisySeries(5L, 10, 100, 5));
        when(dataSource.getSeries(eq(merchant("M-2")), eq("tx_count"), any()))
                .thenThrow(new EmptyResultException("no rows"));

        DetectionRun run = newJob(dataSource).run(detector, WINDOW);

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getCohortsFailed()).isZero();
        assertThat(run.getAnomaliesFound()).isZero();
        assertThat(meterRegistry.counter("detection.cohort.count", "outcome", "skipped").count()).isEqualTo(2.0);
    }

    @Test
    void run_disabledDetector_rejectedWithoutRunRecord() {
        detector.setEnabled(false);
        DetectionJob job = newJob(new InMemoryCohortDataSource());

        assertThatThrownBy(() -> job.run(detector, WINDOW))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("disabled");
        assertThat(runRepository.findByDetectorId("DET-1", 10)).isEmpty();
    }

    @Test
    void run_secondRunWhileFirstInFlight_rejected() throws Exception {
        CountDownLatch listing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemoryCohortDataSource backing = new InMemoryCohortDataSource();
        backing.load(merchant("M-1"), "tx_count", TestDataFactory.shiftedSeries(42L, 100, 100, 5, 10, 130));
        CohortDataSource blocking = new CohortDataSource() {
            @Override
            public List<CohortKey> getCohorts(Detector d, DetectionWindow w) {
                listing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return backing.getCohorts(d, w);
            }

            @Override
            public MetricSeries getSeries(CohortKey cohort, String metric, DetectionWindow w) {
                return backing.getSeries(cohort, metric, w);
            }
        };
        DetectionJob job = newJob(blocking);

        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<DetectionRun> first = caller.submit(() -> job.run(detector, WINDOW));
            assertThat(listing.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> job.run(detector, WINDOW))
                    .isInstanceOf(ConcurrentRunException.class);

            release.countDown();
            DetectionRun run = first.get(10, TimeUnit.SECONDS);
            assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        } finally {
            release.countDown();
            caller.shutdownNow();
        }

        assertThat(runRepository.findByDetectorId("DET-1", 10)).hasSize(1);
        assertThat(eventRepository.findRecent("DET-1", 0, 10)).hasSize(1);
        assertThat(meterRegistry.counter("detection.run.rejected.count", "detector_id", "DET-1").count())
                .isEqualTo(1.0);
    }

    @Test
    void run_dataSourceTimeout_treatedAsConnectionFailure() {
        config.getJob().setFetchTimeout(Duration.ofMillis(100));
        CountDownLatch never = new CountDownLatch(1);
        CohortDataSource hanging = new CohortDataSource() {
            @Override
            public List<CohortKey> getCohorts(Detector d, DetectionWindow w) {
                try {
                    never.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }

            @Override
            public MetricSeries getSeries(CohortKey cohort, String metric, DetectionWindow w) {
                return MetricSeries.empty();
            }
        };

        DetectionRun run = newJob(hanging).run(detector, WINDOW);

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getErrorMessage()).contains("timed out");
    }

    @Test
    void run_cusumDetector_confirmsSustainedShift() {
        Detector cusum = TestDataFactory.createDetector("DET-CUSUM", DetectorType.CUSUM,
                DetectorParams.builder().kThreshold(4.0).persistence(3).minSupport(50).build());
        InMemoryCohortDataSource dataSource = new InMemoryCohortDataSource();
        dataSource.load(merchant("M-1"), "tx_count", TestDataFactory.shiftedSeries(11L, 100, 100, 5, 20, 120));

        DetectionRun run = newJob(dataSource).run(cusum, WINDOW);

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        List<AnomalyEvent> events = eventRepository.findByRunId(run.getRunId());
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getPersistedN()).isGreaterThanOrEqualTo(3);
    }

    private DetectionJob newJob(CohortDataSource dataSource) {
        DetectorRegistry registry = new DetectorRegistry(
                List.of(new SeasonalDecompositionDetector(), new CumulativeSumDetector()));
        return new DetectionJob(dataSource, registry, guardrails, new SeverityScorer(config),
                runRepository, eventRepository, config, new MetricsConfig(meterRegistry),
                Tracer.NOOP, Clock.systemUTC(), workerPool, fetchPool);
    }
}
