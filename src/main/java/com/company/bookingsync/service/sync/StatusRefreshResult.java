package com.company.bookingsync.service.sync;

import lombok.Data;

@Data
public class StatusRefreshResult {
    private int tenantsChecked;
    private int tenantsFailed;
    private int eventsChecked;
    private int eventsUpdated;
    private int errors;
}
