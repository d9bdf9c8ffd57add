package com.company.bookingsync.exception;

/**
 * The local store cannot be reached at all. Aborts the whole batch.
 */
public class LocalStoreUnavailableException extends RuntimeException {
    public LocalStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
