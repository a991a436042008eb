package com.gdin.radiology.report.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Jacksonized
@Builder
public class ValidationResult {

    @JsonProperty("errors")
    List<String> errors;

    @JsonProperty("warnings")
    List<String> warnings;

    @JsonProperty("details")
    List<String> details;

    @JsonProperty("severity")
    ValidationSeverity severity;

    @JsonProperty("is_consistent")
    boolean consistent;
}
