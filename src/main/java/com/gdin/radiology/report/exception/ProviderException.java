package com.gdin.radiology.report.exception;

import com.gdin.radiology.report.llm.ProviderErrorType;
import lombok.Getter;

/**
 * 单个供应商调用失败，由适配器完成错误分类
 */
@Getter
public class ProviderException extends RadiologyReportException {
    private final String provider;
    private final ProviderErrorType errorType;

    public ProviderException(String provider, ProviderErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.errorType = errorType;
    }
}
