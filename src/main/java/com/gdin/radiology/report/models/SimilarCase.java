package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SimilarCase {

    @JsonProperty("case_id")
    String caseId;

    @JsonProperty("text")
    String text;

    @JsonProperty("category")
    String category;

    /**
     * 余弦相似度，取值 [0,1]
     */
    @JsonProperty("score")
    double score;

    @JsonProperty("metadata")
    Map<String, Object> metadata;
}
