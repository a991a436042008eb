package com.gdin.radiology.report.safety;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.models.ValidationSeverity;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 宽松解析模型返回的校验结果：
 * ERRORS: [..] / WARNINGS: [..] / INCONSISTENCIES: [..] / SEVERITY: x
 * 缺失的列表视为空，缺失的严重程度为 null（由调用方决定默认值）
 */
public final class ValidationResponseParser {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern ERRORS = Pattern.compile("ERRORS?\\s*:\\s*\\[(.*?)]", FLAGS);
    private static final Pattern WARNINGS = Pattern.compile("WARNINGS?\\s*:\\s*\\[(.*?)]", FLAGS);
    private static final Pattern INCONSISTENCIES = Pattern.compile("INCONSISTENC(?:Y|IES)\\s*:\\s*\\[(.*?)]", FLAGS);
    private static final Pattern SEVERITY = Pattern.compile("SEVERITY\\s*:\\s*\\[?\\s*([\\p{L}]+)", FLAGS);
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"");

    // 模型常用来表示“无”的占位内容
    private static final Set<String> EMPTY_MARKERS = Set.of("none", "n/a", "na", "nil", "aucun", "aucune", "néant", "rien", "-");

    private ValidationResponseParser() {
    }

    public static ParsedValidation parse(String response) {
        String text = StrUtil.nullToEmpty(response);
        Matcher severityMatcher = SEVERITY.matcher(text);
        ValidationSeverity severity = severityMatcher.find() ? ValidationSeverity.parse(severityMatcher.group(1)) : null;
        return ParsedValidation.builder()
                .errors(parseList(ERRORS, text))
                .warnings(parseList(WARNINGS, text))
                .inconsistencies(parseList(INCONSISTENCIES, text))
                .severity(severity)
                .build();
    }

    private static List<String> parseList(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) return List.of();
        String body = matcher.group(1);
        List<String> raw = new ArrayList<>();
        Matcher quoted = QUOTED.matcher(body);
        while (quoted.find()) raw.add(quoted.group(1));
        if (raw.isEmpty()) {
            // 未加引号：多行时按行切分，否则按逗号切分
            String[] parts = body.contains("\n") ? body.split("\\r?\\n") : body.split(",");
            raw.addAll(List.of(parts));
        }
        List<String> items = new ArrayList<>();
        for (String item : raw) {
            String cleaned = item.strip().replaceFirst("^[-•*]\\s*", "").replaceFirst(",$", "");
            cleaned = cleaned.replaceAll("^[\"'\\s]+|[\"'\\s]+$", "");
            if (cleaned.isEmpty() || EMPTY_MARKERS.contains(cleaned.toLowerCase(Locale.ROOT))) continue;
            items.add(cleaned);
        }
        return items;
    }

    @Value
    @Builder
    public static class ParsedValidation {
        List<String> errors;
        List<String> warnings;
        List<String> inconsistencies;
        /**
         * 模型未给出时为 null
         */
        ValidationSeverity severity;
    }
}
