package com.gdin.radiology.report.service;

import cn.hutool.cache.CacheUtil;
import cn.hutool.cache.impl.TimedCache;
import cn.hutool.crypto.SecureUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.radiology.report.config.properties.ReportProperties;
import com.gdin.radiology.report.models.GenerationResult;
import com.gdin.radiology.report.models.ReportMeta;
import com.gdin.radiology.report.util.IOUtil;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 报告生成结果缓存，key 为 {input, templateId, meta} 的 md5，过期时间可配置
 */
@Component
@Slf4j
public class GenerationCache {
    private static final String PREFIX = "generate:";

    @Resource
    private ReportProperties reportProperties;

    private TimedCache<String, GenerationResult> cache;

    @PostConstruct
    private void init() {
        cache = CacheUtil.newTimedCache(reportProperties.getCacheTtl().toMillis());
        cache.schedulePrune(Math.max(1000L, reportProperties.getCacheTtl().toMillis() / 2));
    }

    @PreDestroy
    private void destroy() {
        cache.cancelPruneSchedule();
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(reportProperties.getCacheEnabled());
    }

    public Optional<GenerationResult> get(String input, String templateId, ReportMeta meta) {
        if (!isEnabled()) return Optional.empty();
        String key = key(input, templateId, meta);
        if (key == null) return Optional.empty();
        // isUpdateLastAccess=false，过期时间从写入时算起
        return Optional.ofNullable(cache.get(key, false));
    }

    public void put(String input, String templateId, ReportMeta meta, GenerationResult result) {
        if (!isEnabled() || result == null) return;
        String key = key(input, templateId, meta);
        if (key != null) cache.put(key, result);
    }

    public void clear() {
        cache.clear();
    }

    String key(String input, String templateId, ReportMeta meta) {
        Map<String, Object> data = new TreeMap<>();
        data.put("input", input);
        data.put("templateId", templateId);
        data.put("meta", meta == null ? null : new TreeMap<>(meta.toPlaceholderValues()));
        try {
            return PREFIX + SecureUtil.md5(IOUtil.jsonSerialize(data));
        } catch (JsonProcessingException e) {
            log.warn("Cannot build generation cache key, cache bypassed: {}", e.getMessage());
            return null;
        }
    }
}
