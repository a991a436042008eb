package com.gdin.radiology.report.rag;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.radiology.report.config.properties.RagProperties;
import com.gdin.radiology.report.util.IOUtil;
import jakarta.annotation.Resource;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 启动时写入示例病例（默认关闭）
 */
@Component
@Slf4j
public class CaseSeeder implements ApplicationRunner {
    @Resource
    private RagProperties ragProperties;
    @Resource
    private SimilarCaseRetriever similarCaseRetriever;
    @Resource
    private ResourceLoader resourceLoader;

    @Override
    public void run(ApplicationArguments args) {
        if (!Boolean.TRUE.equals(ragProperties.getSeedOnStartup())) return;
        if (!similarCaseRetriever.isAvailable()) {
            log.warn("Vector index unavailable, case seeding skipped");
            return;
        }
        try {
            int added = seed(loadCases());
            log.info("Seeded {} sample cases into the vector index", added);
        } catch (IOException e) {
            log.warn("Failed to read seed cases from {}", ragProperties.getSeedResource(), e);
        }
    }

    public List<SeedCase> loadCases() throws IOException {
        org.springframework.core.io.Resource resource = resourceLoader.getResource(ragProperties.getSeedResource());
        try (InputStream is = resource.getInputStream()) {
            return IOUtil.jsonDeserializeList(is, SeedCase.class);
        }
    }

    public int seed(List<SeedCase> cases) {
        int added = 0;
        for (SeedCase seedCase : cases) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (seedCase.getMetadata() != null) metadata.putAll(seedCase.getMetadata());
            metadata.put("category", seedCase.getCategory());
            if (similarCaseRetriever.addCase(seedCase.getCaseId(), seedCase.getText(), metadata)) added++;
            else log.warn("Seed case {} was not added", seedCase.getCaseId());
        }
        return added;
    }

    @Data
    public static class SeedCase {
        @JsonProperty("case_id")
        private String caseId;
        @JsonProperty("text")
        private String text;
        @JsonProperty("category")
        private String category;
        @JsonProperty("metadata")
        private Map<String, Object> metadata;
    }
}
