package com.gdin.radiology.report.llm;

import cn.hutool.core.util.StrUtil;
import dev.langchain4j.exception.HttpException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * 供应商异常分类：先看 HTTP 状态码，拿不到状态码时再按错误信息里的关键词判断
 */
public final class ProviderErrorClassifier {

    private static final List<String> QUOTA_KEYWORDS = List.of("quota", "rate limit", "ratelimit", "exceeded", "429", "resource_exhausted", "too many requests");
    private static final List<String> AUTH_KEYWORDS = List.of("api key", "apikey", "unauthorized", "unauthenticated", "permission denied", "forbidden", "401", "403");
    private static final List<String> TIMEOUT_KEYWORDS = List.of("timeout", "timed out", "deadline exceeded");
    private static final List<String> TRANSIENT_KEYWORDS = List.of("unavailable", "overloaded", "connection reset", "connection refused", "internal server error", "502", "503");
    private static final List<String> INVALID_KEYWORDS = List.of("invalid", "bad request", "not found", "400", "404");

    private ProviderErrorClassifier() {
    }

    public static ProviderErrorType classify(Throwable error) {
        if (error == null) return ProviderErrorType.UNKNOWN;
        // 1. 沿着 cause 链找状态码或明确的超时异常
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpException httpException) {
                ProviderErrorType byStatus = classifyStatus(httpException.statusCode());
                if (byStatus != ProviderErrorType.UNKNOWN) return byStatus;
            }
            if (t instanceof TimeoutException || t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return ProviderErrorType.TIMEOUT;
            }
            if (t.getCause() == t) break;
        }
        // 2. 关键词兜底，deadline exceeded 要先于配额的 exceeded 判断
        String message = collectMessages(error).toLowerCase();
        if (containsAny(message, TIMEOUT_KEYWORDS)) return ProviderErrorType.TIMEOUT;
        if (containsAny(message, QUOTA_KEYWORDS)) return ProviderErrorType.QUOTA_EXCEEDED;
        if (containsAny(message, AUTH_KEYWORDS)) return ProviderErrorType.AUTH;
        if (containsAny(message, TRANSIENT_KEYWORDS)) return ProviderErrorType.TRANSIENT;
        if (containsAny(message, INVALID_KEYWORDS)) return ProviderErrorType.INVALID_REQUEST;
        return ProviderErrorType.UNKNOWN;
    }

    public static ProviderErrorType classifyStatus(int statusCode) {
        if (statusCode == 429) return ProviderErrorType.QUOTA_EXCEEDED;
        if (statusCode == 401 || statusCode == 403) return ProviderErrorType.AUTH;
        if (statusCode == 408 || statusCode == 504) return ProviderErrorType.TIMEOUT;
        if (statusCode >= 500 && statusCode < 600) return ProviderErrorType.TRANSIENT;
        if (statusCode >= 400 && statusCode < 500) return ProviderErrorType.INVALID_REQUEST;
        return ProviderErrorType.UNKNOWN;
    }

    private static String collectMessages(Throwable error) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (StrUtil.isNotBlank(t.getMessage())) sb.append(t.getMessage()).append(' ');
            if (t.getCause() == t) break;
        }
        return sb.toString();
    }

    private static boolean containsAny(String message, List<String> keywords) {
        for (String keyword : keywords) {
            if (message.contains(keyword)) return true;
        }
        return false;
    }
}
