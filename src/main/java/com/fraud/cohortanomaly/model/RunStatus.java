package com.fraud.cohortanomaly.model;

public enum RunStatus {
    CREATED,
    RUNNING,
    COMPLETED,
    FAILED
}
