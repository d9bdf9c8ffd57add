package com.company.bookingsync.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Tracing for alert dispatch. Metrics stay with Micrometer, so only the span exporter is
 * configurable here; {@code OTEL_*} environment variables still take precedence.
 */
@Configuration
public class OpenTelemetryConfig {

    @Value("${spring.application.name:booking-sync-service}")
    private String serviceName;

    @Value("${booking-sync.tracing.exporter:none}")
    private String tracesExporter;

    @Bean
    public OpenTelemetry openTelemetry() {
        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(() -> {
                    Map<String, String> defaults = new HashMap<>();
                    defaults.put("otel.service.name", serviceName);
                    defaults.put("otel.traces.exporter", tracesExporter);
                    defaults.put("otel.metrics.exporter", "none");
                    defaults.put("otel.logs.exporter", "none");
                    return defaults;
                })
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(serviceName);
    }
}
