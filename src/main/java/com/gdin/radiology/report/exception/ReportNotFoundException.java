package com.gdin.radiology.report.exception;

import lombok.Getter;

@Getter
public class ReportNotFoundException extends RadiologyReportException {
    private final Long reportId;

    public ReportNotFoundException(Long reportId) {
        super("Report not found: " + reportId);
        this.reportId = reportId;
    }
}
