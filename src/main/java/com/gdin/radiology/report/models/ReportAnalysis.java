package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReportAnalysis(
        @JsonProperty("critical_findings") CriticalFindingsResult criticalFindings,
        @JsonProperty("validation") ValidationResult validation
) {}
