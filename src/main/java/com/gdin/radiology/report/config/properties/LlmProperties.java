package com.gdin.radiology.report.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "gdin.radiology.llm")
@Component
public class LlmProperties implements Serializable {
    /**
     * 降级顺序，未配置 apiKey 的供应商会在启动时被过滤掉
     */
    private List<String> fallbackOrder = new ArrayList<>(List.of("gemini", "openai", "anthropic"));

    /**
     * 单个供应商单次调用的超时上限
     */
    private Duration attemptTimeout = Duration.ofSeconds(30);

    /**
     * 执行供应商调用的线程数（每个请求同一时刻只有一个供应商在调用）
     */
    private Integer poolSize = 8;

    private Provider gemini = new Provider("gemini-1.5-pro", null);
    private Provider openai = new Provider("gpt-4-turbo-preview", null);
    private Provider anthropic = new Provider("claude-3-5-sonnet-20241022", null);
    private Provider qwen = new Provider("qwen3-32b", "https://dashscope.aliyuncs.com/api/v1");

    @Data
    public static class Provider implements Serializable {
        private String apiKey;
        private String modelName;
        private String baseUrl;
        private Double temperature = 0.7;
        private Integer maxTokens = 4000;
        private Integer maxRetries = 1;

        public Provider() {
        }

        public Provider(String modelName, String baseUrl) {
            this.modelName = modelName;
            this.baseUrl = baseUrl;
        }
    }
}
