package com.fraud.cohortanomaly.guardrail;

/**
 * What to do when a run is requested while another run of the same detector is in flight.
 */
public enum ConcurrencyPolicy {
    // Reject immediately with ConcurrentRunException
    FAIL_FAST,
    // Wait for the in-flight run up to the configured queue timeout
    QUEUE
}
