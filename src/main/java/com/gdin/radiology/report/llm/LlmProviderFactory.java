package com.gdin.radiology.report.llm;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.config.properties.LlmProperties;
import dev.langchain4j.community.model.dashscope.QwenChatModel;
import dev.langchain4j.community.model.dashscope.QwenChatRequestParameters;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 根据配置的降级顺序构建供应商列表，未配置 apiKey 的直接跳过
 */
@Component
@Slf4j
public class LlmProviderFactory {
    public static final String GEMINI = "gemini";
    public static final String OPENAI = "openai";
    public static final String ANTHROPIC = "anthropic";
    public static final String QWEN = "qwen";

    @Resource
    private LlmProperties llmProperties;

    public List<LlmProvider> createProviders() {
        // 去重且保持顺序
        Set<String> order = new LinkedHashSet<>();
        for (String name : llmProperties.getFallbackOrder()) {
            if (StrUtil.isNotBlank(name)) order.add(name.strip().toLowerCase(Locale.ROOT));
        }
        List<LlmProvider> providers = new ArrayList<>();
        for (String name : order) {
            LlmProperties.Provider config = providerConfig(name);
            if (config == null) {
                log.warn("Unknown LLM provider '{}' in fallback order, ignored", name);
                continue;
            }
            if (StrUtil.isBlank(config.getApiKey())) {
                log.info("LLM provider {} has no API key, skipped", name);
                continue;
            }
            providers.add(new ChatModelLlmProvider(name, buildChatModel(name, config)));
            log.info("LLM provider {} initialized ({})", name, config.getModelName());
        }
        return providers;
    }

    private LlmProperties.Provider providerConfig(String name) {
        return switch (name) {
            case GEMINI -> llmProperties.getGemini();
            case OPENAI -> llmProperties.getOpenai();
            case ANTHROPIC -> llmProperties.getAnthropic();
            case QWEN -> llmProperties.getQwen();
            default -> null;
        };
    }

    private ChatModel buildChatModel(String name, LlmProperties.Provider config) {
        return switch (name) {
            case GEMINI -> GoogleAiGeminiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModelName())
                    .temperature(config.getTemperature())
                    .maxOutputTokens(config.getMaxTokens())
                    .maxRetries(config.getMaxRetries())
                    .timeout(llmProperties.getAttemptTimeout())
                    .build();
            case OPENAI -> OpenAiChatModel.builder()
                    .apiKey(config.getApiKey())
                    .baseUrl(config.getBaseUrl())
                    .modelName(config.getModelName())
                    .temperature(config.getTemperature())
                    .maxTokens(config.getMaxTokens())
                    .maxRetries(config.getMaxRetries())
                    .timeout(llmProperties.getAttemptTimeout())
                    .build();
            case ANTHROPIC -> AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .baseUrl(config.getBaseUrl())
                    .modelName(config.getModelName())
                    .temperature(config.getTemperature())
                    .maxTokens(config.getMaxTokens())
                    .maxRetries(config.getMaxRetries())
                    .timeout(llmProperties.getAttemptTimeout())
                    .build();
            case QWEN -> {
                // qwen3 非流式调用必须关闭 thinking
                QwenChatRequestParameters qwenChatRequestParameters = QwenChatRequestParameters.builder()
                        .enableThinking(false)
                        .build();
                yield QwenChatModel.builder()
                        .baseUrl(config.getBaseUrl())
                        .defaultRequestParameters(qwenChatRequestParameters)
                        .modelName(config.getModelName())
                        .apiKey(config.getApiKey())
                        .temperature(config.getTemperature() == null ? null : config.getTemperature().floatValue())
                        .maxTokens(config.getMaxTokens())
                        .build();
            }
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + name);
        };
    }
}
