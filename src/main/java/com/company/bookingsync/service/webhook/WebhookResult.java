package com.company.bookingsync.service.webhook;

import lombok.Data;

@Data
public class WebhookResult {
    private String event;
    private int tenantsMatched;
    private int processed;
    private int failed;
    // Set when the delivery was accepted but nothing was written
    private String ignoredReason;

    public boolean isIgnored() {
        return ignoredReason != null;
    }
}
