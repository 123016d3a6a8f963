package com.fraud.cohortanomaly.guardrail;

import com.fraud.cohortanomaly.config.DetectionConfig;
import com.fraud.cohortanomaly.exception.ConcurrentRunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Persistence (debounce) and run-concurrency guardrails.
 *
 * Debounce: an anomaly is confirmed only after {@code persistence} consecutive
 * observations above threshold. Updates to one (detector, cohort, metric) key
 * are serialized by a lock stripe chosen from the key's hash; unrelated keys
 * only contend when they share a stripe.
 *
 * Run concurrency: at most one run per detector is in flight. A second request
 * fails fast or waits, depending on {@link ConcurrencyPolicy}.
 */
@Component
public class Guardrails {

    private static final Logger log = LoggerFactory.getLogger(Guardrails.class);

    private final GuardrailStateStore stateStore;
    private final DetectionConfig config;
    private final Clock clock;

    // Fixed stripe count, so lock memory does not grow with the number of keys
    static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];
    private final Map<String, Semaphore> runPermits = new ConcurrentHashMap<>();
    // detectorId -> runId of the in-flight run
    private final Map<String, String> inFlightRuns = new ConcurrentHashMap<>();

    public Guardrails(GuardrailStateStore stateStore, DetectionConfig config, Clock clock) {
        this.stateStore = stateStore;
        this.config = config;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new ReentrantLock();
        }
    }

    ReentrantLock lockFor(GuardrailKey key) {
        return keyLocks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }

    /**
     * Record one observation for {@code key}.
     *
     * An exceeding observation ({@code score > threshold}) increments the
     * consecutive counter; any other observation resets it to 0.
     *
     * @return true exactly when this observation brings the counter to
     *         {@code persistence}; false before that and for every further
     *         exceedance of the same excursion
     */
    public boolean checkPersistence(GuardrailKey key, double score, double threshold, int persistence) {
        if (persistence < 1) {
            throw new IllegalArgumentException("persistence must be >= 1, got " + persistence);
        }
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            PersistenceState state = stateStore.get(key);
            if (state == null) {
                state = new PersistenceState();
            }

            if (!(score > threshold)) {
                if (state.getConsecutiveExceedances() > 0) {
                    log.debug("Guardrail reset for {} after {} exceedances", key, state.getConsecutiveExceedances());
                }
                state.setConsecutiveExceedances(0);
                stateStore.put(key, state);
                return false;
            }

            int count = state.getConsecutiveExceedances() + 1;
            state.setConsecutiveExceedances(count);

            boolean confirmed = count == persistence && !inCooldown(state);
            if (confirmed) {
                state.setLastAlertAt(clock.millis());
                log.debug("Guardrail confirmed {} after {} consecutive exceedances", key, count);
            }
            stateStore.put(key, state);
            return confirmed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unscoped variant keyed only by cohort and metric.
     */
    public boolean checkPersistence(String cohortKey, String metric, double score, double threshold, int persistence) {
        return checkPersistence(GuardrailKey.unscoped(cohortKey, metric), score, threshold, persistence);
    }

    public int consecutiveCount(GuardrailKey key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            PersistenceState state = stateStore.get(key);
            return state == null ? 0 : state.getConsecutiveExceedances();
        } finally {
            lock.unlock();
        }
    }

    public void reset(GuardrailKey key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            stateStore.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public int consecutiveCount(String cohortKey, String metric) {
        return consecutiveCount(GuardrailKey.unscoped(cohortKey, metric));
    }

    public void reset(String cohortKey, String metric) {
        reset(GuardrailKey.unscoped(cohortKey, metric));
    }

    /**
     * Reset every key evaluated by {@code detectorId}.
     *
     * @return number of keys reset
     */
    public int resetDetector(String detectorId) {
        int reset = 0;
        for (GuardrailKey key : stateStore.keys()) {
            if (key.getDetectorId().equals(detectorId)) {
                reset(key);
                reset++;
            }
        }
        log.info("Reset {} guardrail keys for detector {}", reset, detectorId);
        return reset;
    }

    /**
     * @return number of keys reset
     */
    public int resetAll() {
        int reset = 0;
        for (GuardrailKey key : stateStore.keys()) {
            reset(key);
            reset++;
        }
        log.info("Reset all guardrail state ({} keys)", reset);
        return reset;
    }

    private boolean inCooldown(PersistenceState state) {
        Duration cooldown = config.getGuardrails().getAlertCooldown();
        if (cooldown == null || cooldown.isZero() || cooldown.isNegative() || state.getLastAlertAt() <= 0) {
            return false;
        }
        return clock.millis() - state.getLastAlertAt() < cooldown.toMillis();
    }

    // ── Run concurrency ──

    /**
     * Claim the single run slot of {@code detectorId}.
     *
     * @throws ConcurrentRunException if another run holds the slot (FAIL_FAST), or
     *                                still holds it when the queue timeout expires (QUEUE)
     */
    public void acquireRun(String detectorId, String runId) {
        Semaphore permit = runPermits.computeIfAbsent(detectorId, id -> new Semaphore(1));
        DetectionConfig.GuardrailSettings settings = config.getGuardrails();

        boolean acquired;
        if (settings.getConcurrencyPolicy() == ConcurrencyPolicy.QUEUE) {
            try {
                acquired = permit.tryAcquire(settings.getQueueTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConcurrentRunException(detectorId);
            }
        } else {
            acquired = permit.tryAcquire();
        }

        if (!acquired) {
            log.warn("Rejected run {} for detector {}: run {} is in flight",
                    runId, detectorId, inFlightRuns.get(detectorId));
            throw new ConcurrentRunException(detectorId);
        }
        inFlightRuns.put(detectorId, runId);
    }

    public void releaseRun(String detectorId) {
        Semaphore permit = runPermits.get(detectorId);
        if (permit == null || inFlightRuns.remove(detectorId) == null) {
            log.warn("releaseRun called for detector {} without an in-flight run", detectorId);
            return;
        }
        permit.release();
    }

    public boolean isRunInFlight(String detectorId) {
        return inFlightRuns.containsKey(detectorId);
    }
}
