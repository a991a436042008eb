package com.gdin.radiology.report.catalog;

import com.gdin.radiology.report.models.Template;

import java.util.List;
import java.util.Optional;

/**
 * 模板目录，流水线只读
 */
public interface TemplateCatalog {

    /**
     * 按目录顺序返回所有启用的模板
     */
    List<Template> listActiveTemplates();

    Optional<Template> getTemplate(String templateId);
}
