package com.gdin.radiology.report.safety;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.models.CriticalFinding;
import com.gdin.radiology.report.models.CriticalFindingsResult;
import com.gdin.radiology.report.models.FindingSeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 危急值检测
 * <p>
 * 在 指征 + 报告 文本中按等级逐个关键词做整词匹配（忽略大小写），取命中位置前后 50 个字符作为上下文：
 * 基础置信度 0.7，关键词出现多次 +0.1，上下文有否定词 -0.3，有确定性用语 +0.1，结果截断到 [0,1]。
 * 按 (关键词, 等级) 去重后按等级稳定降序排列。
 * <p>
 * 无状态，可并发调用。
 */
@Component
public class CriticalFindingsDetector {
    static final int CONTEXT_WINDOW = 50;
    static final double BASE_CONFIDENCE = 0.7;
    static final double REPEAT_BONUS = 0.1;
    static final double NEGATION_PENALTY = 0.3;
    static final double DEFINITIVE_BONUS = 0.1;
    static final double NOTIFY_MIN_CONFIDENCE = 0.5;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    // exclude / definite 允许词尾变化（excluded, definitely）
    private static final List<Pattern> NEGATION_TERMS = List.of(
            Pattern.compile("\\bno\\b", FLAGS),
            Pattern.compile("\\bnot\\b", FLAGS),
            Pattern.compile("\\bwithout\\b", FLAGS),
            Pattern.compile("\\bnegative\\s+for\\b", FLAGS),
            Pattern.compile("\\bruled\\s+out\\b", FLAGS),
            Pattern.compile("\\bexclude\\w*", FLAGS));

    private static final List<Pattern> DEFINITIVE_TERMS = List.of(
            Pattern.compile("\\bacute\\b", FLAGS),
            Pattern.compile("\\bactive\\b", FLAGS),
            Pattern.compile("\\bconfirmed\\b", FLAGS),
            Pattern.compile("\\bdefinite\\w*", FLAGS),
            Pattern.compile("\\bidentified\\b", FLAGS));

    private final Map<FindingSeverity, List<KeywordPattern>> patterns = new LinkedHashMap<>();

    public CriticalFindingsDetector() {
        CriticalKeywordLexicon.keywordsBySeverity().forEach((severity, keywords) -> {
            List<KeywordPattern> list = new ArrayList<>();
            for (String keyword : keywords) {
                list.add(new KeywordPattern(keyword, Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", FLAGS)));
            }
            patterns.put(severity, list);
        });
    }

    public CriticalFindingsResult detect(String reportText, String indication) {
        String buffer = StrUtil.nullToEmpty(indication) + "\n" + StrUtil.nullToEmpty(reportText);

        List<CriticalFinding> findings = new ArrayList<>();
        for (Map.Entry<FindingSeverity, List<KeywordPattern>> entry : patterns.entrySet()) {
            FindingSeverity severity = entry.getKey();
            for (KeywordPattern keywordPattern : entry.getValue()) {
                Matcher matcher = keywordPattern.pattern().matcher(buffer);
                int occurrences = -1;
                while (matcher.find()) {
                    if (occurrences < 0) occurrences = countMatches(keywordPattern.pattern(), buffer);
                    int start = Math.max(0, matcher.start() - CONTEXT_WINDOW);
                    int end = Math.min(buffer.length(), matcher.end() + CONTEXT_WINDOW);
                    String context = buffer.substring(start, end).strip();
                    findings.add(CriticalFinding.builder()
                            .text(keywordPattern.keyword())
                            .severity(severity)
                            .category(CriticalKeywordLexicon.categorize(keywordPattern.keyword()))
                            .confidence(confidence(context, occurrences))
                            .context(context)
                            .build());
                }
            }
        }

        List<CriticalFinding> unique = deduplicate(findings);
        // List.sort 为稳定排序，同级保持原有顺序
        unique.sort(Comparator.comparingInt((CriticalFinding f) -> f.getSeverity().getRank()).reversed());

        FindingSeverity highest = unique.isEmpty() ? null : unique.get(0).getSeverity();
        return CriticalFindingsResult.builder()
                .hasCritical(!unique.isEmpty())
                .findings(unique)
                .highestSeverity(highest)
                .requiresNotification(requiresNotification(unique, highest))
                .build();
    }

    double confidence(String context, int occurrences) {
        double confidence = BASE_CONFIDENCE;
        if (occurrences > 1) confidence += REPEAT_BONUS;
        if (containsAny(context, NEGATION_TERMS)) confidence -= NEGATION_PENALTY;
        if (containsAny(context, DEFINITIVE_TERMS)) confidence += DEFINITIVE_BONUS;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        return Math.round(confidence * 100) / 100.0;
    }

    private static boolean requiresNotification(List<CriticalFinding> findings, FindingSeverity highest) {
        if (highest == null || !highest.requiresNotification()) return false;
        for (CriticalFinding finding : findings) {
            if (finding.getSeverity() == highest && finding.getConfidence() >= NOTIFY_MIN_CONFIDENCE) return true;
        }
        return false;
    }

    private static List<CriticalFinding> deduplicate(List<CriticalFinding> findings) {
        Map<String, CriticalFinding> unique = new LinkedHashMap<>();
        for (CriticalFinding finding : findings) {
            String key = finding.getText().toLowerCase(Locale.ROOT) + "|" + finding.getSeverity().name();
            unique.putIfAbsent(key, finding);
        }
        return new ArrayList<>(unique.values());
    }

    private static boolean containsAny(String text, List<Pattern> terms) {
        for (Pattern term : terms) {
            if (term.matcher(text).find()) return true;
        }
        return false;
    }

    private static int countMatches(Pattern pattern, String text) {
        int count = 0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) count++;
        return count;
    }

    private record KeywordPattern(String keyword, Pattern pattern) {}
}
