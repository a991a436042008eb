package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Jacksonized
@Builder
public class SummaryResult {

    @JsonProperty("summary")
    String summary;

    @JsonProperty("conclusion")
    String conclusion;

    @JsonProperty("key_findings")
    List<String> keyFindings;

    @JsonProperty("language")
    String language;
}
