package com.fraud.cohortanomaly.model;

import com.fraud.cohortanomaly.exception.ValidationException;
import lombok.Value;

import java.time.Instant;

@Value
public class DetectionWindow {

    Instant from;
    Instant to;

    public DetectionWindow(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new ValidationException("Detection window bounds are required");
        }
        if (!to.isAfter(from)) {
            throw new ValidationException(
                    String.format("window_to (%s) must be strictly after window_from (%s)", to, from));
        }
        this.from = from;
        this.to = to;
    }

    public static DetectionWindow of(Instant from, Instant to) {
        return new DetectionWindow(from, to);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && instant.isBefore(to);
    }
}
