package com.company.bookingsync.remote;

/**
 * A listing had more pages than the client is allowed to follow. The result would be
 * incomplete, so the caller must not treat the window as reconciled.
 */
public class PageLimitExceededException extends RemoteApiException {

    private final int pagesRead;

    public PageLimitExceededException(int pagesRead, String message) {
        super(0, message);
        this.pagesRead = pagesRead;
    }

    public int getPagesRead() {
        return pagesRead;
    }
}
