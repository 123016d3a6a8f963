package com.fraud.cohortanomaly.model;

import com.fraud.cohortanomaly.exception.UnknownDetectorTypeException;

import java.util.Locale;

/**
 * Closed set of detection strategies. Type strings from configuration or
 * callers are resolved here and never fall back to a default.
 */
public enum DetectorType {
    STL_MAD,
    CUSUM;

    public static DetectorType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new UnknownDetectorTypeException(String.valueOf(value));
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (DetectorType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new UnknownDetectorTypeException(value);
    }
}
