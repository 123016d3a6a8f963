package com.fraud.cohortanomaly.exception;

/**
 * The cohort data source is unreachable or did not answer in time.
 * Aborts the whole detection run; retries belong to the caller.
 */
public class DataSourceConnectionException extends RuntimeException {

    public DataSourceConnectionException(String message) {
        super(message);
    }

    public DataSourceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
