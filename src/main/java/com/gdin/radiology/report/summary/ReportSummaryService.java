package com.gdin.radiology.report.summary;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.llm.LlmFallbackChain;
import com.gdin.radiology.report.models.SummaryResult;
import com.gdin.radiology.report.prompts.SummaryPrompts;
import com.gdin.radiology.report.util.PromptUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 生成报告摘要与结论。调用失败时返回占位摘要，不抛异常。
 */
@Service
@Slf4j
public class ReportSummaryService {
    public static final int DEFAULT_MAX_LENGTH = 200;
    static final int MAX_KEY_FINDINGS = 5;
    static final String FAILED_SUMMARY = "Error generating summary. Please try again.";

    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[•*-]|\\d+[.)])\\s*(.+?)\\s*$", Pattern.MULTILINE);

    private static final Map<String, String[]> LABELS = Map.of(
            // 摘要标题, 结论标题, 示例
            "fr", new String[]{"SYNTHÈSE", "CONCLUSION", "Ex: \"Absence d'anomalie significative\" ou \"Pneumonie du lobe inférieur droit\""},
            "en", new String[]{"SUMMARY", "CONCLUSION", "Ex: \"No significant abnormality\" or \"Right lower lobe pneumonia\""},
            "ar", new String[]{"الملخص", "الخلاصة", "مثال: \"لا توجد تشوهات كبيرة\" أو \"التهاب رئوي\""});

    @Resource
    private LlmFallbackChain llmFallbackChain;
    @Resource
    private LanguageDetector languageDetector;

    public SummaryResult generateSummary(String reportText, String indication) {
        return generateSummary(reportText, indication, DEFAULT_MAX_LENGTH, null);
    }

    /**
     * @param maxLength 摘要最大词数
     * @param language  为空时根据报告内容自动判断
     */
    public SummaryResult generateSummary(String reportText, String indication, int maxLength, String language) {
        String targetLanguage = StrUtil.isBlank(language)
                ? languageDetector.detect(reportText)
                : language.strip().toLowerCase(Locale.ROOT);
        String[] labels = LABELS.getOrDefault(targetLanguage, LABELS.get("en"));

        Map<String, String> args = new HashMap<>();
        args.put("language_name", PromptUtil.languageName(targetLanguage));
        args.put("indication", StrUtil.nullToEmpty(indication));
        args.put("report", StrUtil.nullToEmpty(reportText));
        args.put("summary_label", labels[0]);
        args.put("conclusion_label", labels[1]);
        args.put("example", labels[2]);
        args.put("max_length", String.valueOf(maxLength > 0 ? maxLength : DEFAULT_MAX_LENGTH));

        try {
            String response = llmFallbackChain.generateContent(
                    PromptUtil.fill(SummaryPrompts.SYSTEM_INSTRUCTION, args),
                    PromptUtil.fill(SummaryPrompts.USER_PROMPT, args));
            List<String> paragraphs = new ArrayList<>();
            for (String paragraph : StrUtil.nullToEmpty(response).split("\\r?\\n\\s*\\r?\\n")) {
                if (StrUtil.isNotBlank(paragraph)) paragraphs.add(paragraph.strip());
            }
            return SummaryResult.builder()
                    .summary(paragraphs.isEmpty() ? StrUtil.nullToEmpty(response).strip() : paragraphs.get(0))
                    .conclusion(paragraphs.size() > 1 ? paragraphs.get(1) : "")
                    .keyFindings(extractKeyFindings(reportText))
                    .language(targetLanguage)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Summary generation failed: {}", e.getMessage());
            return SummaryResult.builder()
                    .summary(FAILED_SUMMARY)
                    .conclusion("")
                    .keyFindings(List.of())
                    .language(targetLanguage)
                    .build();
        }
    }

    /**
     * 报告中的项目符号/编号行，取前 5 条长度超过 10 的
     */
    List<String> extractKeyFindings(String reportText) {
        List<String> findings = new ArrayList<>();
        Matcher matcher = BULLET.matcher(StrUtil.nullToEmpty(reportText));
        while (matcher.find() && findings.size() < MAX_KEY_FINDINGS) {
            String line = matcher.group(1).strip();
            if (line.length() > 10) findings.add(line);
        }
        return findings;
    }
}
