package com.fraud.cohortanomaly.exception;

/**
 * Bad detector parameters, an invalid window, or a detector that cannot run.
 * Surfaced to the caller immediately and never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
