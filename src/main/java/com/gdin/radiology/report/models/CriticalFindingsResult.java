package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Jacksonized
@Builder
public class CriticalFindingsResult {

    @JsonProperty("has_critical")
    boolean hasCritical;

    /**
     * 按等级降序排列，同级保持去重后的先后顺序
     */
    @JsonProperty("findings")
    List<CriticalFinding> findings;

    @JsonProperty("highest_severity")
    FindingSeverity highestSeverity;

    @JsonProperty("requires_notification")
    boolean requiresNotification;
}
