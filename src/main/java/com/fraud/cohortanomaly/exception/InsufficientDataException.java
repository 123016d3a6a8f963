package com.fraud.cohortanomaly.exception;

public class InsufficientDataException extends DetectionInputException {

    private final int observed;
    private final int required;

    public InsufficientDataException(int observed, int required) {
        super(String.format("Series has %d observed points, min support is %d", observed, required));
        this.observed = observed;
        this.required = required;
    }

    public int getObserved() {
        return observed;
    }

    public int getRequired() {
        return required;
    }
}
