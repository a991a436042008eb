package com.gdin.radiology.report.exception;

import com.gdin.radiology.report.llm.ProviderFailure;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class AllProvidersFailedException extends RadiologyReportException {
    /**
     * 按尝试顺序排列
     */
    private final List<ProviderFailure> failures;

    public AllProvidersFailedException(List<ProviderFailure> failures) {
        super(buildMessage(failures));
        this.failures = List.copyOf(failures);
    }

    private static String buildMessage(List<ProviderFailure> failures) {
        if (failures.isEmpty()) return "All AI providers failed: no provider is configured";
        return "All AI providers failed. " + failures.stream()
                .map(f -> f.getProvider() + " (" + f.getErrorType() + "): " + f.getMessage())
                .collect(Collectors.joining("; "));
    }
}
