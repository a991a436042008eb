package com.gdin.radiology.report.catalog;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.exception.TemplateNotFoundException;
import com.gdin.radiology.report.models.Template;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 模板选择器
 * <p>
 * 关键词分三档计分：解剖部位 10 分，具体病变 3 分，其余 1 分，每个关键词只按命中的第一档计一次；
 * 标题出现在指征中或与指征有共同词时再加 5 分。最高分胜出，同分取目录中靠前的。
 * 全部为 0 分时退回到按命中关键词个数选择，仍为 0 则返回第一个模板。
 */
@Component
@Slf4j
public class TemplateSelector {
    public static final String AUTO = "auto";

    static final int ANATOMICAL_WEIGHT = 10;
    static final int SPECIFIC_WEIGHT = 3;
    static final int GENERIC_WEIGHT = 1;
    static final int TITLE_BONUS = 5;

    private static final List<String> ANATOMICAL_TERMS = List.of(
            "brain", "head", "skull", "cerebral", "neck", "spine", "spinal", "cervical", "thoracic", "lumbar",
            "chest", "thorax", "lung", "pulmonary", "heart", "cardiac", "coronary", "aorta", "aortic", "carotid",
            "abdomen", "abdominal", "pelvis", "pelvic", "liver", "hepatic", "kidney", "renal", "pancrea",
            "spleen", "gallbladder", "biliary", "bladder", "prostate", "uterus", "ovar", "breast", "thyroid",
            "sinus", "orbit", "knee", "shoulder", "hip", "ankle", "wrist", "elbow", "hand", "foot",
            "cerveau", "crâne", "crane", "rachis", "poumon", "pulmonaire", "cœur", "coeur", "foie", "rein",
            "bassin", "genou", "épaule", "epaule", "hanche", "sein", "thyroïde");

    private static final List<String> SPECIFIC_TERMS = List.of(
            "lesion", "lésion", "fracture", "stenosis", "sténose", "tumor", "tumour", "tumeur", "mass", "masse",
            "nodule", "embolism", "embolie", "hemorrhage", "haemorrhage", "hémorragie", "aneurysm", "anévrisme",
            "dissection", "infarct", "stroke", "avc", "abscess", "abcès", "cyst", "kyste", "obstruction",
            "occlusion", "effusion", "épanchement", "pneumothorax", "metasta", "métasta", "thrombosis", "thrombose");

    private static final Set<String> TITLE_STOPWORDS = Set.of(
            "the", "and", "of", "for", "with", "in", "on", "to", "or", "at", "by",
            "de", "du", "des", "la", "le", "les", "et", "en", "un", "une", "au", "aux");

    @Resource
    private TemplateCatalog templateCatalog;

    /**
     * 显式 id 直接查找（需为启用状态），auto 或空值走自动选择
     *
     * @throws TemplateNotFoundException 指定模板不存在、未启用，或自动选择时目录为空
     */
    public Template resolve(String templateId, String indication) {
        if (StrUtil.isBlank(templateId) || AUTO.equalsIgnoreCase(templateId.strip())) {
            return select(indication, templateCatalog.listActiveTemplates())
                    .orElseThrow(() -> new TemplateNotFoundException(AUTO));
        }
        return templateCatalog.getTemplate(templateId)
                .filter(Template::isActive)
                .orElseThrow(() -> new TemplateNotFoundException(templateId));
    }

    /**
     * 只有模板列表为空时返回 empty
     */
    public Optional<Template> select(String indication, List<Template> templates) {
        if (CollectionUtil.isEmpty(templates)) return Optional.empty();
        String low = StrUtil.nullToEmpty(indication).toLowerCase(Locale.ROOT);

        Template best = null;
        int bestScore = 0;
        for (Template template : templates) {
            int score = score(low, template);
            if (score > bestScore) {
                best = template;
                bestScore = score;
            }
        }
        if (best != null) {
            log.debug("Template {} selected with score {}", best.getId(), bestScore);
            return Optional.of(best);
        }

        // 所有模板得分都为 0
        Template fallback = templates.get(0);
        int bestHits = 0;
        for (Template template : templates) {
            int hits = keywordHits(low, template);
            if (hits > bestHits) {
                fallback = template;
                bestHits = hits;
            }
        }
        log.debug("No template scored, fell back to {} ({} keyword hits)", fallback.getId(), bestHits);
        return Optional.of(fallback);
    }

    int score(String lowIndication, Template template) {
        int score = 0;
        for (String keyword : keywordsOf(template)) {
            if (lowIndication.contains(keyword)) score += keywordWeight(keyword);
        }
        if (titleRelevant(lowIndication, template.getTitle())) score += TITLE_BONUS;
        return score;
    }

    static int keywordWeight(String lowKeyword) {
        if (ANATOMICAL_TERMS.stream().anyMatch(lowKeyword::contains)) return ANATOMICAL_WEIGHT;
        if (SPECIFIC_TERMS.stream().anyMatch(lowKeyword::contains)) return SPECIFIC_WEIGHT;
        return GENERIC_WEIGHT;
    }

    private int keywordHits(String lowIndication, Template template) {
        int hits = 0;
        for (String keyword : keywordsOf(template)) {
            if (lowIndication.contains(keyword)) hits++;
        }
        return hits;
    }

    /**
     * 小写、去空白、去重后的关键词
     */
    private Set<String> keywordsOf(Template template) {
        if (CollectionUtil.isEmpty(template.getKeywords())) return Set.of();
        return template.getKeywords().stream()
                .filter(StrUtil::isNotBlank)
                .map(k -> k.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private boolean titleRelevant(String lowIndication, String title) {
        if (StrUtil.isBlank(title) || lowIndication.isEmpty()) return false;
        String lowTitle = title.strip().toLowerCase(Locale.ROOT);
        if (lowIndication.contains(lowTitle)) return true;
        Set<String> indicationWords = words(lowIndication);
        for (String word : words(lowTitle)) {
            if (indicationWords.contains(word)) return true;
        }
        return false;
    }

    private static Set<String> words(String text) {
        return Arrays.stream(text.split("[^\\p{L}\\p{N}]+"))
                .filter(w -> w.length() >= 2)
                .filter(w -> !TITLE_STOPWORDS.contains(w))
                .collect(Collectors.toCollection(HashSet::new));
    }
}
