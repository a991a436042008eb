package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FindingCategory {
    VASCULAR,
    NEUROLOGICAL,
    RESPIRATORY,
    ABDOMINAL,
    CARDIAC,
    INFECTIOUS,
    ONCOLOGIC,
    MUSCULOSKELETAL,
    OTHER;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
