package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationSeverity {
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    /**
     * 宽松解析模型返回的严重程度，无法识别时为 UNKNOWN
     */
    public static ValidationSeverity parse(String raw) {
        if (raw == null || raw.isBlank()) return MEDIUM;
        for (ValidationSeverity severity : values()) {
            if (severity.name().equalsIgnoreCase(raw.strip())) return severity;
        }
        return UNKNOWN;
    }
}
