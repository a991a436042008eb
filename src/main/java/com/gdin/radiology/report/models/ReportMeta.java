package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "报告元数据，用于填充模板占位符")
public class ReportMeta {

    @JsonProperty("doctor_name")
    @Schema(description = "报告医生", example = "Dr. Jane Smith")
    private String doctorName;

    @JsonProperty("hospital_name")
    @Schema(description = "医院名称", example = "General Hospital")
    private String hospitalName;

    @JsonProperty("referrer")
    @Schema(description = "转诊医生（姓名或邮箱）", example = "dr.house@hospital.com")
    private String referrer;

    @JsonProperty("patient_name")
    @Schema(description = "患者姓名")
    private String patientName;

    @JsonProperty("study_datetime")
    @Schema(description = "检查时间", example = "2024-05-01 14:30")
    private String studyDatetime;

    @JsonProperty("accession")
    @Schema(description = "检查号")
    private String accession;

    @JsonProperty("indication")
    @Schema(description = "临床指征")
    private String indication;

    /**
     * 骨架占位符名 -> 取值，值为 null 表示未提供
     */
    public Map<String, String> toPlaceholderValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("doctor_name", doctorName);
        values.put("hospital_name", hospitalName);
        values.put("referrer", referrer);
        values.put("patient_name", patientName);
        values.put("study_datetime", studyDatetime);
        values.put("accession", accession);
        values.put("indication", indication == null ? null : indication.strip());
        return values;
    }
}
