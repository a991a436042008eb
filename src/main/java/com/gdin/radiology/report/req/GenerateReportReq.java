package com.gdin.radiology.report.req;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.radiology.report.models.ReportMeta;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "报告生成请求")
public class GenerateReportReq {
    @JsonProperty("input")
    @Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "临床指征原文", example = "65yo with acute dyspnea, rule out PE")
    private String input;

    @JsonProperty("templateId")
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "模板 id，auto 表示自动选择", example = "auto")
    @Builder.Default
    private String templateId = "auto";

    @JsonProperty("meta")
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "报告元数据")
    private ReportMeta meta;

    @JsonProperty("use_rag")
    @Schema(requiredMode = Schema.RequiredMode.NOT_REQUIRED, description = "是否检索相似病例（仅 auto 模式生效）", example = "true")
    @Builder.Default
    private Boolean useRag = true;
}
