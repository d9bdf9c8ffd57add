package com.company.bookingsync.remote;

/**
 * A provider call failed. Status code 0 means no HTTP response was received.
 */
public class RemoteApiException extends RuntimeException {
    private final int statusCode;

    public RemoteApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
