package com.gdin.radiology.report.config;

import com.gdin.radiology.report.config.properties.LlmProperties;
import com.gdin.radiology.report.config.properties.RagProperties;
import com.gdin.radiology.report.llm.LlmFallbackChain;
import com.gdin.radiology.report.llm.LlmProviderFactory;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import jakarta.annotation.Resource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AIConfig {
    @Resource
    private LlmProperties llmProperties;
    @Resource
    private RagProperties ragProperties;

    /**
     * 供应商调用线程池，用于给每次调用加超时
     */
    @Bean(name = "llmExecutor", destroyMethod = "shutdownNow")
    public ExecutorService llmExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, llmProperties.getPoolSize()));
    }

    @Bean
    public LlmFallbackChain llmFallbackChain(LlmProviderFactory llmProviderFactory,
                                             @Qualifier("llmExecutor") ExecutorService llmExecutor) {
        return new LlmFallbackChain(llmProviderFactory.createProviders(), llmProperties.getAttemptTimeout(), llmExecutor);
    }

    @Bean
    public EmbeddingModel embeddingModel() {
        RagProperties.Embedding embedding = ragProperties.getEmbedding();
        return OllamaEmbeddingModel.builder()
                .baseUrl(embedding.getBaseUrl())
                .modelName(embedding.getModelName())
                .timeout(embedding.getTimeout())
                .build();
    }
}
