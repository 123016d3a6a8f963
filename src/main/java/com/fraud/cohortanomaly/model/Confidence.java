package com.fraud.cohortanomaly.model;

/**
 * Confidence tier of a root-cause hypothesis. HIGH ranks before MEDIUM.
 */
public enum Confidence {
    HIGH,
    MEDIUM
}
