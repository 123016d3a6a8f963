package com.fraud.cohortanomaly.exception;

public class ConcurrentRunException extends RuntimeException {

    private final String detectorId;

    public ConcurrentRunException(String detectorId) {
        super("A detection run is already in flight for detector " + detectorId);
        this.detectorId = detectorId;
    }

    public String getDetectorId() {
        return detectorId;
    }
}
