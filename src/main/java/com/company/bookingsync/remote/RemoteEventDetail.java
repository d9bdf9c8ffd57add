package com.company.bookingsync.remote;

/**
 * Invitee data fetched separately from the event listing. Either field may be null.
 */
public record RemoteEventDetail(String inviteeName, String inviteeEmail) {

    public static final RemoteEventDetail EMPTY = new RemoteEventDetail(null, null);

    public boolean isEmpty() {
        return inviteeName == null && inviteeEmail == null;
    }
}
