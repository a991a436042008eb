package com.gdin.radiology.report.generation;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.config.properties.RagProperties;
import com.gdin.radiology.report.exception.EmptyGenerationException;
import com.gdin.radiology.report.llm.LlmFallbackChain;
import com.gdin.radiology.report.models.ReportMeta;
import com.gdin.radiology.report.models.SimilarCase;
import com.gdin.radiology.report.models.Template;
import com.gdin.radiology.report.prompts.ReportGenerationPrompts;
import com.gdin.radiology.report.util.PromptUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 组装系统指令与用户提示词（骨架、元数据、相似病例、目标语言），交给降级链生成报告
 */
@Service
@Slf4j
public class ReportGenerator {
    private static final String MISSING = "N/A";

    @Resource
    private LlmFallbackChain llmFallbackChain;
    @Resource
    private RagProperties ragProperties;

    /**
     * @throws com.gdin.radiology.report.exception.PlaceholderResolutionException 骨架占位符无法解析
     * @throws com.gdin.radiology.report.exception.AllProvidersFailedException    所有供应商均失败
     * @throws EmptyGenerationException                                            模型返回空内容
     */
    public String generate(String indication, Template template, ReportMeta meta, List<SimilarCase> similarCases) {
        String userPrompt = buildUserPrompt(indication, template, meta, similarCases);
        String report = llmFallbackChain.generateContent(ReportGenerationPrompts.SYSTEM_INSTRUCTION, userPrompt);
        if (StrUtil.isBlank(report)) throw new EmptyGenerationException();
        log.info("Report generated with template {} ({} chars)", template.getId(), report.length());
        return report.strip();
    }

    String buildUserPrompt(String indication, Template template, ReportMeta meta, List<SimilarCase> similarCases) {
        String cleanIndication = StrUtil.nullToEmpty(indication).strip();
        ReportMeta safeMeta = meta == null ? new ReportMeta() : meta;

        Map<String, String> placeholderValues = safeMeta.toPlaceholderValues();
        placeholderValues.put("indication", cleanIndication);
        String skeleton = SkeletonFormatter.format(template.getSkeleton(), placeholderValues);

        Map<String, String> args = new HashMap<>();
        args.put("indication", cleanIndication);
        args.put("hospital_name", StrUtil.blankToDefault(safeMeta.getHospitalName(), MISSING));
        args.put("doctor_name", StrUtil.blankToDefault(safeMeta.getDoctorName(), MISSING));
        args.put("referrer", StrUtil.blankToDefault(safeMeta.getReferrer(), MISSING));
        args.put("patient_name", StrUtil.blankToDefault(safeMeta.getPatientName(), MISSING));
        args.put("study_datetime", StrUtil.blankToDefault(safeMeta.getStudyDatetime(), MISSING));
        args.put("accession", StrUtil.blankToDefault(safeMeta.getAccession(), MISSING));
        args.put("similar_cases", similarCasesBlock(similarCases));
        args.put("language_name", PromptUtil.languageName(template.getLanguage()));
        args.put("skeleton", skeleton);
        return PromptUtil.fill(ReportGenerationPrompts.USER_PROMPT, args);
    }

    private String similarCasesBlock(List<SimilarCase> similarCases) {
        if (CollectionUtil.isEmpty(similarCases)) return "";
        int limit = Math.max(0, ragProperties.getDefaultLimit());
        int previewLength = Math.max(1, ragProperties.getPreviewLength());
        StringBuilder sb = new StringBuilder(ReportGenerationPrompts.SIMILAR_CASES_HEADER);
        for (int i = 0; i < similarCases.size() && i < limit; i++) {
            SimilarCase similarCase = similarCases.get(i);
            Map<String, String> line = new HashMap<>();
            line.put("index", String.valueOf(i + 1));
            line.put("preview", StrUtil.sub(StrUtil.nullToEmpty(similarCase.getText()), 0, previewLength));
            line.put("score", String.format(Locale.ROOT, "%.2f", similarCase.getScore()));
            sb.append(PromptUtil.fill(ReportGenerationPrompts.SIMILAR_CASE_LINE, line));
        }
        return sb.append('\n').toString();
    }
}
