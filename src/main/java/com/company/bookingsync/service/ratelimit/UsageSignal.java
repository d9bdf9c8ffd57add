package com.company.bookingsync.service.ratelimit;

import java.util.Locale;

/**
 * What a provider response told us about our remaining request budget.
 *
 * @param statusCode     HTTP status of the response, 0 when no response was received
 * @param usagePercent   share of the quota already consumed, null when the provider sent no usage headers
 * @param rateLimitBody  the body carried a rate-limit marker (some providers answer 400/403 instead of 429)
 */
public record UsageSignal(int statusCode, Double usagePercent, boolean rateLimitBody) {

    private static final String[] RATE_LIMIT_MARKERS = {
            "rate limit", "rate_limit", "ratelimit", "too many requests", "request limit"
    };

    public boolean isHardLimit() {
        return statusCode == 429 || rateLimitBody;
    }

    public boolean isHighUsage(double thresholdPercent) {
        return usagePercent != null && usagePercent >= thresholdPercent;
    }

    public static UsageSignal ok(Double usagePercent) {
        return new UsageSignal(200, usagePercent, false);
    }

    public static UsageSignal hardLimit() {
        return new UsageSignal(429, 100.0, false);
    }

    /**
     * Usage percent from limit/remaining headers, null when either is missing or unparseable.
     */
    public static Double usagePercent(String limitHeader, String remainingHeader) {
        if (limitHeader == null || remainingHeader == null) {
            return null;
        }
        try {
            double limit = Double.parseDouble(limitHeader.trim());
            double remaining = Double.parseDouble(remainingHeader.trim());
            if (limit <= 0) {
                return null;
            }
            return Math.max(0.0, Math.min(100.0, (limit - remaining) / limit * 100.0));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static boolean bodyMentionsRateLimit(String body) {
        if (body == null || body.isEmpty()) {
            return false;
        }
        String lower = body.toLowerCase(Locale.ROOT);
        for (String marker : RATE_LIMIT_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
