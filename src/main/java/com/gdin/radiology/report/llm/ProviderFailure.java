package com.gdin.radiology.report.llm;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class ProviderFailure {
    @JsonProperty("provider")
    String provider;

    @JsonProperty("error_type")
    ProviderErrorType errorType;

    @JsonProperty("message")
    String message;
}
