package com.koni.homeenergy.domain.exception;

/**
 * Exception thrown when the sample store is unreachable or fails transiently.
 * The operation may be retried by the caller; this service never retries on its own.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
