package com.company.bookingsync.service.alert;

import com.company.bookingsync.domain.SyncAlert;
import com.company.bookingsync.event.AlertRaisedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class AlertHandler {

    private final AlertDispatcher alertDispatcher;

    @EventListener
    @Async
    public void handleAlertRaised(AlertRaisedEvent event) {
        SyncAlert alert = event.getAlert();
        try {
            alertDispatcher.dispatch(alert);
        } catch (Exception e) {
            log.warn("Alert {} not dispatched yet, batch job will retry: {}", alert.getAlertId(), e.getMessage());
        }
    }
}
