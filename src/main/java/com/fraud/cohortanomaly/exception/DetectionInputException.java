package com.fraud.cohortanomaly.exception;

/**
 * A series that cannot be evaluated. Deterministic for a given input, so the
 * caller either skips the cohort or widens the window.
 */
public abstract class DetectionInputException extends RuntimeException {

    protected DetectionInputException(String message) {
        super(message);
    }
}
