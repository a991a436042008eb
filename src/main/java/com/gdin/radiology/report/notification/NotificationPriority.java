package com.gdin.radiology.report.notification;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gdin.radiology.report.models.FindingSeverity;

public enum NotificationPriority {
    CRITICAL,
    URGENT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    public static NotificationPriority of(FindingSeverity highestSeverity) {
        return highestSeverity == FindingSeverity.CRITICAL ? CRITICAL : URGENT;
    }
}
