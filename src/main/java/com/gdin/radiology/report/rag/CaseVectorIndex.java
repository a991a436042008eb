package com.gdin.radiology.report.rag;

import java.util.List;
import java.util.Map;

/**
 * 历史病例向量索引
 */
public interface CaseVectorIndex {

    boolean isAvailable();

    /**
     * 同 id 覆盖写入
     */
    void upsert(String id, float[] embedding, Map<String, Object> payload);

    /**
     * 余弦相似度检索，按分数降序
     *
     * @param category 为空时不过滤，否则按存储的 category 精确匹配
     */
    List<IndexHit> search(float[] embedding, int limit, String category);
}
