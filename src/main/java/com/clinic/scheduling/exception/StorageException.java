package com.clinic.scheduling.exception;

/**
 * Store failure not covered by a business rule (connectivity, lock timeout, unexpected
 * constraint). Never retried here; retry policy belongs to the caller.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
