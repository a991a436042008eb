package com.gdin.radiology.report.rag;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.models.SimilarCase;
import dev.langchain4j.model.embedding.EmbeddingModel;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 相似病例检索。嵌入模型或向量库不可用时返回空列表，不抛异常。
 */
@Service
@Slf4j
public class SimilarCaseRetriever {
    @Resource
    private EmbeddingModel embeddingModel;
    @Resource
    private CaseVectorIndex caseVectorIndex;

    public boolean isAvailable() {
        return caseVectorIndex.isAvailable();
    }

    /**
     * @param limit    最多返回条数
     * @param category 模板分类，为空时不过滤
     * @return 按相似度降序，同分保持索引返回顺序
     */
    public List<SimilarCase> search(String query, int limit, String category) {
        if (StrUtil.isBlank(query) || limit <= 0) return List.of();
        if (!caseVectorIndex.isAvailable()) {
            log.debug("Vector index unavailable, skip similar case search");
            return List.of();
        }
        List<IndexHit> hits;
        try {
            float[] vector = embeddingModel.embed(query).content().vector();
            hits = caseVectorIndex.search(vector, limit, StrUtil.emptyToNull(StrUtil.trim(category)));
        } catch (RuntimeException e) {
            log.warn("Similar case search failed, continue without RAG context: {}", e.getMessage());
            return List.of();
        }

        List<SimilarCase> cases = new ArrayList<>();
        for (IndexHit hit : hits) {
            if (cases.size() >= limit) break;
            Map<String, Object> metadata = new LinkedHashMap<>(hit.getPayload() == null ? Map.of() : hit.getPayload());
            Object text = metadata.remove("text");
            Object hitCategory = metadata.remove("category");
            Object caseId = metadata.remove("case_id");
            cases.add(SimilarCase.builder()
                    .caseId(caseId == null ? hit.getId() : caseId.toString())
                    .text(text == null ? "" : text.toString())
                    .category(hitCategory == null ? null : hitCategory.toString())
                    .score(clamp(hit.getScore()))
                    .metadata(metadata)
                    .build());
        }
        // 稳定排序，同分保持原有顺序
        cases.sort((a, b) -> Double.compare(b.getScore(), a.getScore()));
        return cases;
    }

    /**
     * 写入一个病例，失败返回 false
     */
    public boolean addCase(String caseId, String text, Map<String, Object> metadata) {
        if (StrUtil.isBlank(caseId) || StrUtil.isBlank(text)) return false;
        if (!caseVectorIndex.isAvailable()) return false;
        try {
            float[] vector = embeddingModel.embed(text).content().vector();
            Map<String, Object> payload = new LinkedHashMap<>();
            if (metadata != null) payload.putAll(metadata);
            payload.put("case_id", caseId);
            payload.put("text", text);
            caseVectorIndex.upsert(caseId, vector, payload);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to add case {} to vector index: {}", caseId, e.getMessage());
            return false;
        }
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
