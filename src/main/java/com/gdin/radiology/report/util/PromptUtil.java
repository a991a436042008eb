package com.gdin.radiology.report.util;

import cn.hutool.core.util.StrUtil;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PromptUtil {
    private static final Pattern VARIABLE = Pattern.compile("\\{(\\w+)}");

    private PromptUtil() {
    }

    /**
     * 一次性替换提示词中的 {name} 变量，替换进来的内容不会被再次解析；未提供的变量原样保留
     */
    public static String fill(String template, Map<String, String> args) {
        Matcher matcher = VARIABLE.matcher(template);
        StringBuilder sb = new StringBuilder(template.length() + 256);
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = args.containsKey(name) ? StrUtil.nullToEmpty(args.get(name)) : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * 语言代码转为提示词里使用的语言名，未知代码默认英文
     */
    public static String languageName(String language) {
        if (StrUtil.isBlank(language)) return "English";
        return switch (language.strip().toLowerCase(Locale.ROOT)) {
            case "fr" -> "French";
            case "ar" -> "Arabic";
            default -> "English";
        };
    }
}
