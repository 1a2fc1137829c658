package com.example.clinic.service;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bands for how long a balance has been outstanding, counted from the invoice date.
 * Intervals are closed-open: [0,31), [31,61), [61,91), [91,inf).
 */
public enum AgingBucket {
    CURRENT("current"),
    DAYS_31_60("31-60"),
    DAYS_61_90("61-90"),
    DAYS_90_PLUS("90+"),
    NOT_APPLICABLE("n/a");

    private final String label;

    AgingBucket(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Bucket for an outstanding invoice. Negative day counts are treated as current.
     */
    public static AgingBucket forDaysOutstanding(long days) {
        if (days < 31) {
            return CURRENT;
        } else if (days < 61) {
            return DAYS_31_60;
        } else if (days < 91) {
            return DAYS_61_90;
        }
        return DAYS_90_PLUS;
    }

    @Override
    public String toString() {
        return label;
    }
}
