package com.fraud.cohortanomaly.model;

public enum PatternType {
    CONCENTRATION,
    BURST,
    MULTI_SEGMENT
}
