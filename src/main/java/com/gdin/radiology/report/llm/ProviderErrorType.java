package com.gdin.radiology.report.llm;

public enum ProviderErrorType {
    /**
     * 配额耗尽或被限流
     */
    QUOTA_EXCEEDED,
    AUTH,
    TRANSIENT,
    TIMEOUT,
    INVALID_REQUEST,
    UNKNOWN
}
