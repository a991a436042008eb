package com.gdin.radiology.report.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.radiology.milvus")
@Component
public class MilvusProperties implements Serializable {
    // 关闭后相似病例检索直接返回空列表
    private Boolean enabled = true;
    private String uri = "http://localhost:19530";
    private String token;
    private String collectionName = "radiology_reports";
    // 需与嵌入模型输出维度一致（all-minilm 为 384）
    private Integer dimension = 384;
    private Long connectTimeoutMs = 10_000L;
    private Integer textMaxLength = 8192;
}
