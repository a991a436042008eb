package com.gdin.radiology.report.safety;

import cn.hutool.core.util.StrUtil;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按标题行切分报告段落。
 * 标题行 = 别名 + 可选冒号（冒号后可直接跟正文）；段落持续到下一个首字母大写的 "Word:" 标题行或文本结束。
 */
@Component
public class ReportSectionExtractor {
    public static final List<String> FINDINGS_ALIASES = List.of("findings", "résultats", "observations");
    public static final List<String> IMPRESSION_ALIASES = List.of("impression", "conclusion", "synthèse");

    private static final Pattern NEXT_HEADER = Pattern.compile("^[ \\t]*\\p{Lu}\\p{L}+[ \\t]*:.*$");

    public String findings(String reportText) {
        return extract(reportText, FINDINGS_ALIASES);
    }

    public String impression(String reportText) {
        return extract(reportText, IMPRESSION_ALIASES);
    }

    /**
     * 依次尝试各别名，返回第一个找到的段落内容（去首尾空白），找不到返回空串
     */
    public String extract(String reportText, List<String> aliases) {
        if (StrUtil.isBlank(reportText)) return "";
        String[] lines = reportText.split("\\r?\\n", -1);
        for (String alias : aliases) {
            Pattern header = headerPattern(alias);
            for (int i = 0; i < lines.length; i++) {
                Matcher matcher = header.matcher(lines[i]);
                if (!matcher.matches()) continue;
                StringBuilder section = new StringBuilder(StrUtil.nullToEmpty(matcher.group(1)));
                for (int j = i + 1; j < lines.length; j++) {
                    if (NEXT_HEADER.matcher(lines[j]).matches()) break;
                    section.append('\n').append(lines[j]);
                }
                return section.toString().strip();
            }
        }
        return "";
    }

    private static Pattern headerPattern(String alias) {
        // 无冒号时整行只能是标题本身，避免把 "Findings show ..." 之类的正文当成标题
        String quoted = Pattern.quote(alias.toLowerCase(Locale.ROOT));
        return Pattern.compile("^[ \\t]*" + quoted + "[ \\t]*(?::[ \\t]*(.*?))?[ \\t]*$",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
