package com.company.bookingsync.event;

import com.company.bookingsync.domain.SyncRun;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SyncRunCompletedEvent {
    private final SyncRun run;
}
