package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class CriticalFinding {

    /**
     * 命中的关键词
     */
    @JsonProperty("text")
    String text;

    @JsonProperty("severity")
    FindingSeverity severity;

    @JsonProperty("category")
    FindingCategory category;

    @JsonProperty("confidence")
    double confidence;

    /**
     * 命中位置前后各 50 个字符
     */
    @JsonProperty("context")
    String context;
}
