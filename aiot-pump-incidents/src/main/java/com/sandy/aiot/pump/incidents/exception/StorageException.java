package com.sandy.aiot.pump.incidents.exception;

import lombok.Getter;

/**
 * Storage or transaction failure while applying a tracker decision.
 * Retrying the same report is safe: an active report re-refreshes, a clear is a no-op.
 */
@Getter
public class StorageException extends RuntimeException {
    private final boolean retryable;

    public StorageException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public StorageException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }
}
