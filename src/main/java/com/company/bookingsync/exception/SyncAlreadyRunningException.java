package com.company.bookingsync.exception;

public class SyncAlreadyRunningException extends RuntimeException {
    public SyncAlreadyRunningException() {
        super("A sync batch is already running");
    }
}
