package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 危急值等级。比较一律按 rank，不按名称字典序。
 */
public enum FindingSeverity {
    CRITICAL("critical", 3),
    URGENT("urgent", 2),
    HIGH("high", 1);

    private final String value;
    private final int rank;

    FindingSeverity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    public boolean requiresNotification() {
        return this == CRITICAL || this == URGENT;
    }
}
