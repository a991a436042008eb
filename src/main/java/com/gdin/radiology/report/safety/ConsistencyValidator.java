package com.gdin.radiology.report.safety;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.llm.LlmFallbackChain;
import com.gdin.radiology.report.models.ValidationResult;
import com.gdin.radiology.report.models.ValidationSeverity;
import com.gdin.radiology.report.prompts.ValidationPrompts;
import com.gdin.radiology.report.util.PromptUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 报告一致性校验：模型检查 + 规则检查
 * <p>
 * Findings 与 Impression 都缺失时直接返回高严重度结果，不调用模型也不做规则检查。
 * 模型检查失败只记为一条错误，规则检查照常执行。
 */
@Service
@Slf4j
public class ConsistencyValidator {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> NORMAL_CUES = List.of(
            Pattern.compile("\\bnormal\\b", FLAGS),
            Pattern.compile("\\bunremarkable\\b", FLAGS),
            Pattern.compile("\\bno abnormality\\b", FLAGS),
            Pattern.compile("\\bpas d'anomalie\\b", FLAGS),
            Pattern.compile("\\bsans particularit", FLAGS));

    private static final List<Pattern> ABNORMAL_CUES = List.of(
            Pattern.compile("\\babnormal\\b", FLAGS),
            Pattern.compile("\\blesions?\\b", FLAGS),
            Pattern.compile("\\bmass(?:es)?\\b", FLAGS),
            Pattern.compile("\\bfractures?\\b", FLAGS),
            Pattern.compile("(?<!pas d')\\banomalies?\\b", FLAGS),
            Pattern.compile("\\blésions?\\b", FLAGS));

    private static final List<Pattern> PLACEHOLDERS = List.of(
            Pattern.compile("<[^>\\n]+>"),
            Pattern.compile("\\{[^}\\n]+}"),
            Pattern.compile("\\bTODO\\b"),
            Pattern.compile("\\bFILL\\b"),
            Pattern.compile("\\bXXX\\b"));

    static final int BRIEF_IMPRESSION_WORDS = 3;

    @Resource
    private LlmFallbackChain llmFallbackChain;
    @Resource
    private ReportSectionExtractor reportSectionExtractor;

    public ValidationResult validate(String reportText, String language) {
        String lang = ValidationMessages.normalizeLanguage(language);
        String findings = reportSectionExtractor.findings(reportText);
        String impression = reportSectionExtractor.impression(reportText);

        if (findings.isEmpty() && impression.isEmpty()) {
            return ValidationResult.builder()
                    .errors(List.of(ValidationMessages.get(lang, ValidationMessages.MISSING_SECTIONS)))
                    .warnings(List.of())
                    .details(List.of(ValidationMessages.get(lang, ValidationMessages.CANNOT_CHECK)))
                    .severity(ValidationSeverity.HIGH)
                    .consistent(false)
                    .build();
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> details = new ArrayList<>();

        // 1. 模型检查
        ValidationSeverity aiSeverity = null;
        try {
            ValidationResponseParser.ParsedValidation parsed = ValidationResponseParser.parse(askModel(reportText, lang));
            errors.addAll(parsed.getErrors());
            warnings.addAll(parsed.getWarnings());
            details.addAll(parsed.getInconsistencies());
            aiSeverity = parsed.getSeverity();
        } catch (RuntimeException e) {
            log.warn("AI consistency check failed, continue with rule checks only: {}", e.getMessage());
            errors.add(ValidationMessages.get(lang, ValidationMessages.AI_CHECK_FAILED) + ": " + e.getMessage());
        }

        // 2. 规则检查
        ruleChecks(findings, impression, lang, errors, warnings, details);

        ValidationSeverity severity;
        if (!errors.isEmpty()) severity = aiSeverity == null ? ValidationSeverity.MEDIUM : aiSeverity;
        else if (!warnings.isEmpty()) severity = ValidationSeverity.MEDIUM;
        else severity = ValidationSeverity.LOW;

        return ValidationResult.builder()
                .errors(errors)
                .warnings(warnings)
                .details(details)
                .severity(severity)
                .consistent(errors.isEmpty())
                .build();
    }

    private String askModel(String reportText, String lang) {
        Map<String, String> args = Map.of(
                "language_name", PromptUtil.languageName(lang),
                "report", StrUtil.nullToEmpty(reportText));
        return llmFallbackChain.generateContent(
                PromptUtil.fill(ValidationPrompts.SYSTEM_INSTRUCTION, args),
                PromptUtil.fill(ValidationPrompts.USER_PROMPT, args));
    }

    void ruleChecks(String findings, String impression, String lang,
                    List<String> errors, List<String> warnings, List<String> details) {
        if (findings.isEmpty()) warnings.add(ValidationMessages.get(lang, ValidationMessages.MISSING_FINDINGS));
        if (impression.isEmpty()) warnings.add(ValidationMessages.get(lang, ValidationMessages.MISSING_IMPRESSION));

        if (!findings.isEmpty() && !impression.isEmpty()) {
            boolean findingsNormal = hasCue(findings, NORMAL_CUES);
            boolean findingsAbnormal = hasCue(findings, ABNORMAL_CUES);
            boolean impressionNormal = hasCue(impression, NORMAL_CUES);
            boolean impressionAbnormal = hasCue(impression, ABNORMAL_CUES);
            if (findingsNormal && impressionAbnormal) {
                errors.add(ValidationMessages.get(lang, ValidationMessages.CONTRADICTION_NORMAL_ABNORMAL));
                details.add(ValidationMessages.get(lang, ValidationMessages.CONTRADICTION_DETAILS_1));
            }
            if (findingsAbnormal && impressionNormal) {
                errors.add(ValidationMessages.get(lang, ValidationMessages.CONTRADICTION_ABNORMAL_NORMAL));
                details.add(ValidationMessages.get(lang, ValidationMessages.CONTRADICTION_DETAILS_2));
            }
        }

        String combined = findings + "\n" + impression;
        for (Pattern placeholder : PLACEHOLDERS) {
            Matcher matcher = placeholder.matcher(combined);
            if (matcher.find()) {
                errors.add(ValidationMessages.get(lang, ValidationMessages.UNFILLED_PLACEHOLDER) + ": " + matcher.group());
            }
        }

        if (!impression.isEmpty() && impression.split("\\s+").length < BRIEF_IMPRESSION_WORDS) {
            warnings.add(ValidationMessages.get(lang, ValidationMessages.BRIEF_IMPRESSION));
        }
    }

    // 只看提示词是否出现，不区分否定语境
    private static boolean hasCue(String section, List<Pattern> cues) {
        for (Pattern cue : cues) {
            if (cue.matcher(section).find()) return true;
        }
        return false;
    }
}
