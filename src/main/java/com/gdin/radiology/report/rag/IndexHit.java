package com.gdin.radiology.report.rag;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class IndexHit {
    String id;
    double score;
    Map<String, Object> payload;
}
