package com.gdin.radiology.report.summary;

import cn.hutool.core.util.StrUtil;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 粗略判断报告语言：含阿拉伯字母为 ar，否则比较法语/英语特征词命中数，法语多则 fr，其余 en
 */
@Component
public class LanguageDetector {
    private static final Pattern ARABIC = Pattern.compile("[\\u0600-\\u06FF]");

    private static final List<String> FRENCH_INDICATORS = List.of(
            "patient", "radiographie", "échographie", "scanner", "irm", "résultats", "conclusion",
            "pas de", "aucune", "sans", "examen", "réalisé", "étude", "la", "le", "les", "des");

    private static final List<String> ENGLISH_INDICATORS = List.of(
            "patient", "radiograph", "ultrasound", "ct", "mri", "findings", "impression", "conclusion",
            "no", "none", "examination", "study", "the", "a", "an", "of");

    public String detect(String text) {
        if (StrUtil.isBlank(text)) return "en";
        if (ARABIC.matcher(text).find()) return "ar";
        String low = text.toLowerCase(Locale.ROOT);
        long french = FRENCH_INDICATORS.stream().filter(w -> containsWord(low, w)).count();
        long english = ENGLISH_INDICATORS.stream().filter(w -> containsWord(low, w)).count();
        return french > english ? "fr" : "en";
    }

    private static boolean containsWord(String text, String word) {
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(word) + "(?![\\p{L}\\p{N}])").matcher(text).find();
    }
}
