package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationResult {

    @JsonProperty("report")
    String report;

    @JsonProperty("template_id")
    String templateId;

    @JsonProperty("template_title")
    String templateTitle;

    @JsonProperty("highlights")
    List<String> highlights;

    @JsonProperty("similar_cases")
    List<SimilarCase> similarCases;

    /**
     * 持久化失败时为 null，不影响生成结果
     */
    @JsonProperty("report_id")
    Long reportId;

    /**
     * 未检出任何危急值时为 null
     */
    @JsonProperty("critical_findings")
    CriticalFindingsResult criticalFindings;
}
