package com.gdin.radiology.report.exception;

import lombok.Getter;

@Getter
public class PlaceholderResolutionException extends RadiologyReportException {
    private final String placeholder;

    public PlaceholderResolutionException(String placeholder, String reason) {
        super("Cannot resolve template placeholder {" + placeholder + "}: " + reason);
        this.placeholder = placeholder;
    }
}
