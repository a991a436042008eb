package com.gdin.radiology.report.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "gdin.radiology.rag")
@Component
public class RagProperties implements Serializable {
    private Embedding embedding = new Embedding();

    // 生成报告时检索的相似病例数
    private Integer defaultLimit = 3;
    // 每个相似病例写入提示词的最大字符数
    private Integer previewLength = 200;

    private Boolean seedOnStartup = false;
    private String seedResource = "classpath:rag/seed-cases.json";

    @Data
    public static class Embedding implements Serializable {
        private String baseUrl = "http://localhost:11434";
        private String modelName = "all-minilm";
        private Duration timeout = Duration.ofSeconds(10);
    }
}
