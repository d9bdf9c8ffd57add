package com.company.bookingsync.service.alert;

import com.company.bookingsync.domain.SyncAlert;
import com.company.bookingsync.exception.AlertSendException;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes an alert as an OpenTelemetry span event for the monitoring backend to pick up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AlertSender {

    private final Tracer tracer;

    public void send(SyncAlert alert) {
        Span span = tracer.spanBuilder("sync.health.alert")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("tenant.id", alert.getTenantId());
            span.setAttribute("provider", alert.getProvider().getCode());
            span.setAttribute("metric.type", alert.getMetricType().getCode());
            span.setAttribute("severity", alert.getSeverity().name());

            span.addEvent("Sync Health Threshold Breached",
                    Attributes.of(
                            AttributeKey.doubleKey("metric_value"), alert.getMetricValue(),
                            AttributeKey.doubleKey("threshold_value"), alert.getThresholdValue()
                    ));

            log.info("Alert {} sent for tenant {} ({} = {})",
                    alert.getAlertId(), alert.getTenantId(), alert.getMetricType().getCode(), alert.getMetricValue());

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to send alert");
            throw new AlertSendException("Failed to send alert " + alert.getAlertId(), e);
        } finally {
            span.end();
        }
    }
}
