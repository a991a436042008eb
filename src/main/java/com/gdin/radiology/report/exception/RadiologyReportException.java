package com.gdin.radiology.report.exception;

/**
 * 报告流水线中所有业务异常的基类，getMessage() 即面向用户的错误描述
 */
public class RadiologyReportException extends RuntimeException {
    public RadiologyReportException(String message) {
        super(message);
    }

    public RadiologyReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
