package com.fraud.cohortanomaly.exception;

public class UnknownDetectorTypeException extends ValidationException {

    private final String requestedType;

    public UnknownDetectorTypeException(String requestedType) {
        super("Unknown detector type: " + requestedType);
        this.requestedType = requestedType;
    }

    public String getRequestedType() {
        return requestedType;
    }
}
