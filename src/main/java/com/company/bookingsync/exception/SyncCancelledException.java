package com.company.bookingsync.exception;

public class SyncCancelledException extends RuntimeException {
    public SyncCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
