package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 报告模板：骨架文本 + 触发关键词 + 语言 + 分类。
 * 生成请求期间只读。
 */
@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Template {

    @JsonProperty("template_id")
    String id;

    @JsonProperty("title")
    String title;

    @JsonProperty("keywords")
    List<String> keywords;

    /**
     * 含 {doctor_name} 等命名占位符的报告骨架
     */
    @JsonProperty("skeleton")
    String skeleton;

    /**
     * 模板分类（通常为检查方式，如 CT / IRM / RX），用于相似病例过滤
     */
    @JsonProperty("category")
    String category;

    @JsonProperty("language")
    @Builder.Default
    String language = "en";

    @JsonProperty("is_active")
    @Builder.Default
    boolean active = true;
}
