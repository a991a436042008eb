package com.gdin.radiology.report.exception;

public class EmptyGenerationException extends RadiologyReportException {
    public EmptyGenerationException() {
        super("The language model returned an empty report");
    }
}
