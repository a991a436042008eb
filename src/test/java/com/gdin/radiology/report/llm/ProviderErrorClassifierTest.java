package com.gdin.radiology.report.llm;

import dev.langchain4j.exception.HttpException;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ProviderErrorClassifierTest {

    @Test
    public void testStatusCodeWins() {
        assertEquals(ProviderErrorType.QUOTA_EXCEEDED, ProviderErrorClassifier.classify(new HttpException(429, "slow down")));
        assertEquals(ProviderErrorType.AUTH, ProviderErrorClassifier.classify(new HttpException(401, "quota")));
        assertEquals(ProviderErrorType.TRANSIENT, ProviderErrorClassifier.classify(new HttpException(503, "oops")));
        assertEquals(ProviderErrorType.INVALID_REQUEST, ProviderErrorClassifier.classify(new HttpException(400, "oops")));
        assertEquals(ProviderErrorType.TIMEOUT, ProviderErrorClassifier.classify(new HttpException(504, "oops")));
    }

    @Test
    public void testCauseChainIsInspected() {
        RuntimeException wrapped = new RuntimeException("call failed", new HttpException(429, "rate"));
        assertEquals(ProviderErrorType.QUOTA_EXCEEDED, ProviderErrorClassifier.classify(wrapped));

        RuntimeException timeout = new RuntimeException("io", new SocketTimeoutException("read"));
        assertEquals(ProviderErrorType.TIMEOUT, ProviderErrorClassifier.classify(timeout));
    }

    @Test
    public void testKeywordFallback() {
        assertEquals(ProviderErrorType.QUOTA_EXCEEDED, ProviderErrorClassifier.classify(new RuntimeException("Resource_Exhausted: quota")));
        assertEquals(ProviderErrorType.AUTH, ProviderErrorClassifier.classify(new RuntimeException("Invalid API key provided")));
        assertEquals(ProviderErrorType.TIMEOUT, ProviderErrorClassifier.classify(new RuntimeException("Deadline exceeded")));
        assertEquals(ProviderErrorType.TRANSIENT, ProviderErrorClassifier.classify(new RuntimeException("model is overloaded")));
        assertEquals(ProviderErrorType.UNKNOWN, ProviderErrorClassifier.classify(new RuntimeException("something odd")));
        assertEquals(ProviderErrorType.UNKNOWN, ProviderErrorClassifier.classify(null));
    }
}
