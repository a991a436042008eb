package com.gdin.radiology.report.llm;

import com.gdin.radiology.report.exception.AllProvidersFailedException;
import com.gdin.radiology.report.exception.ProviderException;
import com.gdin.radiology.report.exception.RadiologyReportException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 按优先级依次尝试各供应商，第一个成功的结果直接返回；同一供应商不重试。
 * 每次只有一个供应商在调用，单次调用受 attemptTimeout 约束。
 * 超时从任务真正开始执行时计算，在线程池中排队的时间不计入。
 */
@Slf4j
public class LlmFallbackChain {
    private final List<LlmProvider> providers;
    private final Duration attemptTimeout;
    private final ExecutorService executor;

    public LlmFallbackChain(List<LlmProvider> providers, Duration attemptTimeout, ExecutorService executor) {
        this.providers = List.copyOf(providers);
        this.attemptTimeout = attemptTimeout;
        this.executor = executor;
        if (this.providers.isEmpty()) log.warn("No LLM provider configured, every generation request will fail");
        else log.info("LLM fallback order: {}", String.join(" -> ", getProviderNames()));
    }

    public List<String> getProviderNames() {
        return providers.stream().map(LlmProvider::getName).toList();
    }

    /**
     * @throws AllProvidersFailedException 所有已配置的供应商均失败（或一个都没有配置）
     */
    public String generateContent(String systemInstruction, String userPrompt) {
        List<ProviderFailure> failures = new ArrayList<>();
        for (LlmProvider provider : providers) {
            String name = provider.getName();
            log.info("Attempting generation with {}", name);
            try {
                String text = attempt(provider, systemInstruction, userPrompt);
                log.info("Successfully generated with {}", name);
                return text;
            } catch (ProviderException e) {
                failures.add(ProviderFailure.builder()
                        .provider(name)
                        .errorType(e.getErrorType())
                        .message(e.getMessage())
                        .build());
                logFailover(name, e);
            }
        }
        throw new AllProvidersFailedException(failures);
    }

    private String attempt(LlmProvider provider, String systemInstruction, String userPrompt) {
        CountDownLatch started = new CountDownLatch(1);
        Future<String> future = executor.submit(() -> {
            started.countDown();
            return provider.complete(systemInstruction, userPrompt);
        });
        try {
            started.await();
            return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException(provider.getName(), ProviderErrorType.TIMEOUT,
                    "no response within " + attemptTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ProviderException providerException) throw providerException;
            throw new ProviderException(provider.getName(), ProviderErrorClassifier.classify(cause),
                    String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RadiologyReportException("Interrupted while waiting for " + provider.getName(), e);
        }
    }

    private void logFailover(String name, ProviderException e) {
        switch (e.getErrorType()) {
            case QUOTA_EXCEEDED -> log.warn("{} failed: quota exceeded, trying next provider. {}", name, e.getMessage());
            case AUTH -> log.warn("{} failed: authentication rejected, check its API key. Trying next provider", name);
            case TIMEOUT -> log.warn("{} failed: timed out, trying next provider. {}", name, e.getMessage());
            default -> log.warn("{} failed ({}), trying next provider. {}", name, e.getErrorType(), e.getMessage());
        }
    }
}
