package com.fraud.cohortanomaly.exception;

public class EmptyInputException extends DetectionInputException {

    public EmptyInputException(String message) {
        super(message);
    }
}
