package com.gdin.radiology.report.exception;

import lombok.Getter;

@Getter
public class TemplateNotFoundException extends RadiologyReportException {
    private final String templateId;

    public TemplateNotFoundException(String templateId) {
        super("Template not found or inactive: " + templateId);
        this.templateId = templateId;
    }
}
