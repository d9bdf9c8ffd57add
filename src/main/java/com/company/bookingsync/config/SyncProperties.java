package com.company.bookingsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the {@code booking-sync.*} settings in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "booking-sync")
public class SyncProperties {

    private Planner planner = new Planner();
    private RateLimit rateLimit = new RateLimit();
    private Calendly calendly = new Calendly();
    private Enrichment enrichment = new Enrichment();
    private Scheduler scheduler = new Scheduler();
    private Health health = new Health();
    private StatusRefresh statusRefresh = new StatusRefresh();
    private Alerts alerts = new Alerts();

    @Data
    public static class Planner {
        private Duration deepLookback = Duration.ofDays(90);
        private Duration incrementalOverlap = Duration.ofHours(1);
        private int defaultDaysBack = 7;
    }

    @Data
    public static class RateLimit {
        // Spacing between tenants, applied regardless of usage signals
        private Duration minSpacing = Duration.ofSeconds(2);
        // Spacing between sub-requests inside one tenant (enrichment, status refresh)
        private Duration subRequestSpacing = Duration.ofMillis(200);
        private Duration cooldown = Duration.ofSeconds(60);
        private double highUsagePercent = 80.0;
    }

    @Data
    public static class Calendly {
        private String baseUrl = "https://api.calendly.com";
        private int pageSize = 100;
        private int maxPages = 50;
        // How far past the window end to look for events created inside the window
        private Duration createdLookahead = Duration.ofDays(90);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
        // Webhook deliveries are rejected while no signing key is configured
        private String webhookSigningKey;
        private Duration webhookTolerance = Duration.ofMinutes(3);
    }

    @Data
    public static class Enrichment {
        private Duration cacheTtl = Duration.ofDays(7);
    }

    @Data
    public static class Scheduler {
        private Duration recentRunWindow = Duration.ofHours(48);
        private int recentDaysBack = 2;
        private int staleDaysBack = 7;
    }

    @Data
    public static class Health {
        private Duration lookback = Duration.ofHours(24);
        private Duration staleness = Duration.ofHours(24);
        private int unhealthyBelow = 50;
        private int noRecentRunsPenalty = 40;
        private int lowSuccessPenalty = 20;
        private int veryLowSuccessPenalty = 30;
        private double lowSuccessRatio = 0.90;
        private double veryLowSuccessRatio = 0.70;
        private int staleEventsPenalty = 20;
        private int lowTrafficNoRunsPenalty = 20;
    }

    @Data
    public static class StatusRefresh {
        private Duration lookback = Duration.ofDays(3);
        private int batchSize = 10;
    }

    @Data
    public static class Alerts {
        private int defaultCooldownMinutes = 60;
        private List<DefaultThreshold> defaults = new ArrayList<>(List.of(
                new DefaultThreshold("health_score", 60, "HIGH"),
                new DefaultThreshold("data_quality", 70, "MEDIUM")
        ));
    }

    @Data
    public static class DefaultThreshold {
        private String metricType;
        private double minValue;
        private String severity;

        public DefaultThreshold() {
        }

        public DefaultThreshold(String metricType, double minValue, String severity) {
            this.metricType = metricType;
            this.minValue = minValue;
            this.severity = severity;
        }
    }
}
