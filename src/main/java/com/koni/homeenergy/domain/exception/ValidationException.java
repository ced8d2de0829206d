package com.koni.homeenergy.domain.exception;

import lombok.Getter;

/**
 * Exception thrown when input does not meet business rules.
 * Always surfaced to the caller and never retried internally.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final Violation violation;

    public ValidationException(Violation violation, String message) {
        super(message);
        this.violation = violation;
    }

    /**
     * The rule that was broken.
     */
    public enum Violation {
        MISSING_FIELD,
        VALUE_OUT_OF_RANGE,
        TIMESTAMP_IMPLAUSIBLE,
        INVALID_DEVICE_ID,
        FIELD_TOO_LONG,
        EMPTY_BATCH,
        BATCH_TOO_LARGE,
        INVALID_RETENTION,
        INVALID_STATS_WINDOW,
        INVALID_ENERGY_WINDOW
    }
}
