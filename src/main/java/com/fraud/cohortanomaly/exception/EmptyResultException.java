package com.fraud.cohortanomaly.exception;

/**
 * The data source holds no rows for a cohort/metric in the requested window.
 */
public class EmptyResultException extends RuntimeException {

    public EmptyResultException(String message) {
        super(message);
    }
}
