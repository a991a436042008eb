package com.gdin.radiology.report.catalog;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.config.properties.ReportProperties;
import com.gdin.radiology.report.models.Template;
import com.gdin.radiology.report.util.IOUtil;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 启动时从 classpath JSON 加载模板，保持文件中的顺序（即目录顺序）
 */
@Component
@Slf4j
public class InMemoryTemplateCatalog implements TemplateCatalog {
    private final Map<String, Template> templates = new LinkedHashMap<>();

    @Resource
    private ReportProperties reportProperties;
    @Resource
    private ResourceLoader resourceLoader;

    @PostConstruct
    private void init() {
        String location = reportProperties.getTemplateResource();
        if (StrUtil.isBlank(location)) return;
        org.springframework.core.io.Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Template resource {} not found, catalog is empty", location);
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            List<Template> loaded = IOUtil.jsonDeserializeList(is, Template.class);
            loaded.forEach(this::register);
            log.info("Loaded {} report templates from {}", loaded.size(), location);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load report templates from " + location, e);
        }
    }

    /**
     * 同 id 覆盖，覆盖时保留原位置
     */
    public synchronized void register(Template template) {
        if (template == null || StrUtil.isBlank(template.getId())) {
            throw new IllegalArgumentException("template id is required");
        }
        templates.put(template.getId(), template);
    }

    public synchronized void registerAll(Collection<Template> list) {
        list.forEach(this::register);
    }

    @Override
    public synchronized List<Template> listActiveTemplates() {
        return templates.values().stream().filter(Template::isActive).toList();
    }

    @Override
    public synchronized Optional<Template> getTemplate(String templateId) {
        if (templateId == null) return Optional.empty();
        return Optional.ofNullable(templates.get(templateId));
    }
}
