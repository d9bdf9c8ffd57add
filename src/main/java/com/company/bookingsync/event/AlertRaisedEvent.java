package com.company.bookingsync.event;

import com.company.bookingsync.domain.SyncAlert;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AlertRaisedEvent {
    private final SyncAlert alert;
}
