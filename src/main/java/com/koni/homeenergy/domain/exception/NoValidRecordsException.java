package com.koni.homeenergy.domain.exception;

/**
 * Exception thrown when every record of a batch referenced an unknown device.
 */
public class NoValidRecordsException extends RuntimeException {

    public NoValidRecordsException(String message) {
        super(message);
    }
}
