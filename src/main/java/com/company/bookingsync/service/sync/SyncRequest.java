package com.company.bookingsync.service.sync;

import com.company.bookingsync.domain.enums.Provider;
import com.company.bookingsync.domain.enums.SyncMode;
import com.company.bookingsync.domain.enums.SyncTrigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {
    @Builder.Default
    private Provider provider = Provider.CALENDLY;
    @Builder.Default
    private SyncMode mode = SyncMode.DEFAULT;
    // Null syncs every connected tenant
    private String tenantId;
    private Integer daysBack;
    @Builder.Default
    private SyncTrigger trigger = SyncTrigger.MANUAL;
}
