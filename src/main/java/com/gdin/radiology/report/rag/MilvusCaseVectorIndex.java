package com.gdin.radiology.report.rag;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.config.properties.MilvusProperties;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.UpsertReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.SearchResp;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * 基于 Milvus 的病例索引。
 * 连接或建表失败时只记录日志并标记为不可用，不影响应用启动。
 */
@Component
@Slf4j
public class MilvusCaseVectorIndex implements CaseVectorIndex {
    static final String FIELD_ID = "id";
    static final String FIELD_TEXT = "text";
    static final String FIELD_CATEGORY = "category";
    static final String FIELD_METADATA = "metadata";
    static final String FIELD_EMBEDDING = "embedding";

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private final Gson gson = new Gson();

    @Resource
    private MilvusProperties milvusProperties;

    private volatile MilvusClientV2 milvusClientV2;

    @PostConstruct
    private void init() {
        if (!Boolean.TRUE.equals(milvusProperties.getEnabled())) {
            log.info("Milvus is disabled, similar case retrieval will return no results");
            return;
        }
        try {
            ConnectConfig connectConfig = ConnectConfig.builder()
                    .uri(milvusProperties.getUri())
                    .token(milvusProperties.getToken())
                    .connectTimeoutMs(milvusProperties.getConnectTimeoutMs())
                    .build();
            MilvusClientV2 client = new MilvusClientV2(connectConfig);
            ensureCollection(client);
            milvusClientV2 = client;
            log.info("Milvus connected: {}, collection {}", milvusProperties.getUri(), milvusProperties.getCollectionName());
        } catch (Exception e) {
            log.warn("Milvus initialization failed, similar case retrieval disabled: {}", e.getMessage());
        }
    }

    @PreDestroy
    private void close() {
        MilvusClientV2 client = milvusClientV2;
        if (client != null) client.close();
    }

    private void ensureCollection(MilvusClientV2 client) {
        String collectionName = milvusProperties.getCollectionName();
        if (Boolean.TRUE.equals(client.hasCollection(HasCollectionReq.builder()
                .collectionName(collectionName)
                .build()))) return;

        CreateCollectionReq.CollectionSchema schema = MilvusClientV2.CreateSchema();
        // 主键直接使用病例 id，重复写入即覆盖
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_ID)
                .dataType(DataType.VarChar)
                .maxLength(128)
                .isPrimaryKey(true)
                .autoID(false)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_TEXT)
                .dataType(DataType.VarChar)
                .maxLength(milvusProperties.getTextMaxLength())
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_CATEGORY)
                .dataType(DataType.VarChar)
                .maxLength(128)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_METADATA)
                .dataType(DataType.JSON)
                .build());
        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_EMBEDDING)
                .dataType(DataType.FloatVector)
                .dimension(milvusProperties.getDimension())
                .build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(FIELD_EMBEDDING)
                .indexType(IndexParam.IndexType.AUTOINDEX)
                .metricType(IndexParam.MetricType.COSINE)
                .build();
        client.createCollection(CreateCollectionReq.builder()
                .collectionName(collectionName)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex))
                .build());
        log.info("Milvus collection {} created", collectionName);
    }

    @Override
    public boolean isAvailable() {
        return milvusClientV2 != null;
    }

    @Override
    public void upsert(String id, float[] embedding, Map<String, Object> payload) {
        MilvusClientV2 client = requireClient();
        Map<String, Object> metadata = new LinkedHashMap<>(payload == null ? Map.of() : payload);
        String text = StrUtil.nullToEmpty((String) metadata.remove(FIELD_TEXT));
        Object category = metadata.remove(FIELD_CATEGORY);

        JsonObject row = new JsonObject();
        row.addProperty(FIELD_ID, id);
        row.addProperty(FIELD_TEXT, truncateUtf8(text, milvusProperties.getTextMaxLength()));
        row.addProperty(FIELD_CATEGORY, category == null ? "" : category.toString());
        row.add(FIELD_METADATA, gson.toJsonTree(metadata));
        List<Float> vector = new ArrayList<>(embedding.length);
        for (float v : embedding) vector.add(v);
        row.add(FIELD_EMBEDDING, gson.toJsonTree(vector));

        client.upsert(UpsertReq.builder()
                .collectionName(milvusProperties.getCollectionName())
                .data(Collections.singletonList(row))
                .build());
    }

    /**
     * VarChar 的 max_length 按 UTF-8 字节计算，超长时截断并以 "..." 结尾，不拆开多字节字符
     */
    static String truncateUtf8(String text, int maxBytes) {
        if (text == null) return null;
        if (text.getBytes(StandardCharsets.UTF_8).length <= maxBytes) return text;
        int budget = maxBytes - 3;
        int bytes = 0;
        int end = 0;
        while (end < text.length()) {
            int codePoint = text.codePointAt(end);
            int size = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + size > budget) break;
            bytes += size;
            end += Character.charCount(codePoint);
        }
        return text.substring(0, end) + "...";
    }

    @Override
    public List<IndexHit> search(float[] embedding, int limit, String category) {
        MilvusClientV2 client = requireClient();
        SearchReq.SearchReqBuilder searchReqBuilder = SearchReq.builder()
                .collectionName(milvusProperties.getCollectionName())
                .annsField(FIELD_EMBEDDING)
                .data(Collections.singletonList(new FloatVec(embedding)))
                .limit(limit)
                .outputFields(List.of(FIELD_TEXT, FIELD_CATEGORY, FIELD_METADATA));
        if (StrUtil.isNotBlank(category)) searchReqBuilder.filter(categoryFilter(category));

        SearchResp searchResp = client.search(searchReqBuilder.build());
        if (searchResp == null || searchResp.getSearchResults() == null || searchResp.getSearchResults().isEmpty()) {
            return List.of();
        }
        // 单 query 的结果放在 searchResults.get(0)
        List<IndexHit> hits = new ArrayList<>();
        for (SearchResp.SearchResult result : searchResp.getSearchResults().get(0)) {
            Map<String, Object> entity = result.getEntity() == null ? Map.of() : result.getEntity();
            Map<String, Object> payload = new LinkedHashMap<>(toMap(entity.get(FIELD_METADATA)));
            payload.put(FIELD_TEXT, entity.get(FIELD_TEXT));
            payload.put(FIELD_CATEGORY, entity.get(FIELD_CATEGORY));
            hits.add(IndexHit.builder()
                    .id(String.valueOf(result.getId()))
                    .score(result.getScore() == null ? 0.0 : result.getScore().doubleValue())
                    .payload(payload)
                    .build());
        }
        return hits;
    }

    static String categoryFilter(String category) {
        String escaped = category.replace("\\", "\\\\").replace("\"", "\\\"");
        return FIELD_CATEGORY + " == \"" + escaped + "\"";
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(Object metadata) {
        if (metadata == null) return Map.of();
        if (metadata instanceof Map<?, ?> map) return (Map<String, Object>) map;
        if (metadata instanceof JsonElement element && element.isJsonObject()) return gson.fromJson(element, MAP_TYPE);
        if (metadata instanceof String json && StrUtil.isNotBlank(json)) return gson.fromJson(json, MAP_TYPE);
        return Map.of();
    }

    private MilvusClientV2 requireClient() {
        MilvusClientV2 client = milvusClientV2;
        if (client == null) throw new IllegalStateException("Milvus is not available");
        return client;
    }
}
