package com.gdin.radiology.report.safety;

import cn.hutool.core.util.StrUtil;

import java.util.Locale;
import java.util.Map;

/**
 * 一致性校验提示语，支持 en / fr，其他语言回退到 en
 */
public final class ValidationMessages {
    public static final String MISSING_SECTIONS = "missing_sections";
    public static final String CANNOT_CHECK = "cannot_check";
    public static final String MISSING_FINDINGS = "missing_findings";
    public static final String MISSING_IMPRESSION = "missing_impression";
    public static final String CONTRADICTION_NORMAL_ABNORMAL = "contradiction_normal_abnormal";
    public static final String CONTRADICTION_ABNORMAL_NORMAL = "contradiction_abnormal_normal";
    public static final String CONTRADICTION_DETAILS_1 = "contradiction_details_1";
    public static final String CONTRADICTION_DETAILS_2 = "contradiction_details_2";
    public static final String UNFILLED_PLACEHOLDER = "unfilled_placeholder";
    public static final String BRIEF_IMPRESSION = "brief_impression";
    public static final String AI_CHECK_FAILED = "ai_check_failed";

    private static final Map<String, Map<String, String>> MESSAGES = Map.of(
            "en", Map.ofEntries(
                    Map.entry(MISSING_SECTIONS, "Report is missing both Findings and Impression sections"),
                    Map.entry(CANNOT_CHECK, "Cannot perform consistency check without key sections"),
                    Map.entry(MISSING_FINDINGS, "Findings section is empty or missing"),
                    Map.entry(MISSING_IMPRESSION, "Impression/Conclusion section is empty or missing"),
                    Map.entry(CONTRADICTION_NORMAL_ABNORMAL, "Contradiction: Findings suggest normal exam but impression indicates abnormality"),
                    Map.entry(CONTRADICTION_ABNORMAL_NORMAL, "Contradiction: Findings describe abnormalities but impression suggests normal exam"),
                    Map.entry(CONTRADICTION_DETAILS_1, "Findings contain 'normal/unremarkable' while impression suggests abnormality"),
                    Map.entry(CONTRADICTION_DETAILS_2, "Findings describe abnormalities while impression suggests normal exam"),
                    Map.entry(UNFILLED_PLACEHOLDER, "Unfilled placeholder detected"),
                    Map.entry(BRIEF_IMPRESSION, "Impression section is very brief and may be incomplete"),
                    Map.entry(AI_CHECK_FAILED, "AI consistency check failed")),
            "fr", Map.ofEntries(
                    Map.entry(MISSING_SECTIONS, "Le rapport manque des sections Résultats et Impression"),
                    Map.entry(CANNOT_CHECK, "Impossible d'effectuer une vérification de cohérence sans sections clés"),
                    Map.entry(MISSING_FINDINGS, "La section Résultats est vide ou manquante"),
                    Map.entry(MISSING_IMPRESSION, "La section Impression/Conclusion est vide ou manquante"),
                    Map.entry(CONTRADICTION_NORMAL_ABNORMAL, "Contradiction: Les résultats suggèrent un examen normal mais l'impression indique une anomalie"),
                    Map.entry(CONTRADICTION_ABNORMAL_NORMAL, "Contradiction: Les résultats décrivent des anomalies mais l'impression suggère un examen normal"),
                    Map.entry(CONTRADICTION_DETAILS_1, "Les résultats contiennent 'normal/sans particularité' tandis que l'impression suggère une anomalie"),
                    Map.entry(CONTRADICTION_DETAILS_2, "Les résultats décrivent des anomalies tandis que l'impression suggère un examen normal"),
                    Map.entry(UNFILLED_PLACEHOLDER, "Espace réservé non rempli détecté"),
                    Map.entry(BRIEF_IMPRESSION, "La section Impression est très brève et peut être incomplète"),
                    Map.entry(AI_CHECK_FAILED, "La vérification de cohérence par IA a échoué")));

    private ValidationMessages() {
    }

    public static String normalizeLanguage(String language) {
        if (StrUtil.isBlank(language)) return "en";
        String code = language.strip().toLowerCase(Locale.ROOT);
        return MESSAGES.containsKey(code) ? code : "en";
    }

    public static String get(String language, String key) {
        return MESSAGES.get(normalizeLanguage(language)).get(key);
    }
}
