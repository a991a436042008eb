package com.gdin.radiology.report.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.radiology.report.models.CriticalFindingsResult;
import com.gdin.radiology.report.models.SimilarCase;
import com.gdin.radiology.report.models.SummaryResult;
import com.gdin.radiology.report.models.ValidationResult;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 已生成报告的存档
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportRecord {

    @JsonProperty("id")
    Long id;

    @JsonProperty("template_id")
    String templateId;

    @JsonProperty("template_title")
    String templateTitle;

    @JsonProperty("patient_name")
    String patientName;

    @JsonProperty("accession")
    String accession;

    @JsonProperty("doctor_name")
    String doctorName;

    @JsonProperty("hospital_name")
    String hospitalName;

    @JsonProperty("referrer")
    String referrer;

    @JsonProperty("indication")
    String indication;

    @JsonProperty("generated_report")
    String generatedReport;

    @JsonProperty("study_datetime")
    String studyDatetime;

    @JsonProperty("modality")
    String modality;

    @JsonProperty("similar_cases_used")
    List<SimilarCase> similarCasesUsed;

    @JsonProperty("highlights")
    List<String> highlights;

    @JsonProperty("critical_findings")
    CriticalFindingsResult criticalFindings;

    @JsonProperty("validation")
    ValidationResult validation;

    @JsonProperty("summary")
    SummaryResult summary;

    @JsonProperty("created_at")
    LocalDateTime createdAt;
}
