package com.company.bookingsync.domain.enums;

public enum MetricType {
    SYNC_RUN("sync_run"),
    HEALTH_SCORE("health_score"),
    DATA_QUALITY("data_quality"),
    HEALTH_CHECK_DURATION("health_check_duration");

    private final String code;

    MetricType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static MetricType fromCode(String code) {
        for (MetricType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown metric type: " + code);
    }
}
