package com.company.bookingsync.domain.enums;

public enum RunOutcome {
    SUCCESS,
    FAILED;

    public static RunOutcome fromString(String outcome) {
        if (outcome == null) {
            return FAILED;
        }
        try {
            return RunOutcome.valueOf(outcome.toUpperCase());
        } catch (IllegalArgumentException e) {
            return FAILED;
        }
    }
}
