package com.gdin.radiology.report.generation;

import cn.hutool.core.util.StrUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 报告高亮：结论段前三句 + 常见阳性/阴性表述（英文、法文）
 */
@Component
public class ReportHighlighter {
    private static final int MAX_CONCLUSION_SENTENCES = 3;

    private static final List<Pattern> CONCLUSION_PATTERNS = List.of(
            Pattern.compile("(?:IMPRESSION|CONCLUSION|SYNTHÈSE|DIAGNOSTIC)[\\s:]*\\n(.+?)(?=\\n\\n|\\z)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL),
            Pattern.compile("(?:IMPRESSION|CONCLUSION|SYNTHÈSE|DIAGNOSTIC)\\s*:[ \\t]*(\\S.+?)(?=\\n\\n|\\z)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL));

    private static final List<Pattern> KEY_PHRASES = compile(
            // 阴性表述（英文）
            "No evidence of [^.!\\n]+",
            "No [^.!\\n]+ identified",
            "Unremarkable [^.!\\n]+",
            "Normal [^.!\\n]+",
            "No significant [^.!\\n]+",
            // 阳性表述（英文）
            "[^.!\\n]+ consistent with [^.!\\n]+",
            "[^.!\\n]+ suggestive of [^.!\\n]+",
            "Evidence of [^.!\\n]+",
            "Suspicious for [^.!\\n]+",
            // 阴性表述（法文）
            "Pas d[e']? ?[^.!\\n]+",
            "Absence d[e']? ?[^.!\\n]+",
            "Aucune? [^.!\\n]+",
            "Sans [^.!\\n]+",
            // 阳性表述（法文）
            "Compatible avec [^.!\\n]+",
            "En faveur d[e']? ?[^.!\\n]+",
            "Présence d[e']? ?[^.!\\n]+",
            "Signes de [^.!\\n]+");

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        return patterns;
    }

    /**
     * 去重且保持出现顺序
     */
    public List<String> extract(String reportText) {
        if (StrUtil.isBlank(reportText)) return List.of();
        Set<String> highlights = new LinkedHashSet<>();

        for (Pattern pattern : CONCLUSION_PATTERNS) {
            Matcher matcher = pattern.matcher(reportText);
            if (!matcher.find()) continue;
            String conclusion = matcher.group(1).strip();
            int taken = 0;
            for (String sentence : conclusion.split("[.!]\\s+")) {
                if (sentence.isBlank()) continue;
                if (taken >= MAX_CONCLUSION_SENTENCES) break;
                taken++;
                String s = StrUtil.removeSuffix(sentence.strip(), ".");
                if (s.length() > 10) highlights.add(s);
            }
            break;
        }

        for (Pattern pattern : KEY_PHRASES) {
            Matcher matcher = pattern.matcher(reportText);
            while (matcher.find()) {
                String phrase = matcher.group().strip();
                if (phrase.length() > 5 && phrase.length() < 150) highlights.add(phrase);
            }
        }
        return new ArrayList<>(highlights);
    }
}
