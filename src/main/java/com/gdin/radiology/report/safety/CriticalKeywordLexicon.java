package com.gdin.radiology.report.safety;

import com.gdin.radiology.report.models.FindingCategory;
import com.gdin.radiology.report.models.FindingSeverity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 危急值词表：按等级分档的关键词，以及关键词到系统分类的映射
 */
public final class CriticalKeywordLexicon {

    private CriticalKeywordLexicon() {}

    private static final Map<FindingSeverity, List<String>> KEYWORDS_BY_SEVERITY = new LinkedHashMap<>();

    /**
     * 顺序即判定优先级，第一个命中的分类生效
     */
    private static final Map<FindingCategory, List<String>> CATEGORY_TERMS = new LinkedHashMap<>();

    static {
        KEYWORDS_BY_SEVERITY.put(FindingSeverity.CRITICAL, List.of(
                // 血管
                "aortic dissection", "aortic rupture", "ruptured aneurysm", "active hemorrhage",
                "active bleeding", "massive hemorrhage", "acute arterial occlusion",
                // 神经
                "acute stroke", "acute ischemic stroke", "hemorrhagic stroke", "subarachnoid hemorrhage",
                "subdural hematoma", "epidural hematoma", "acute hydrocephalus", "brainstem herniation",
                "uncal herniation", "tonsillar herniation", "midline shift",
                // 心脏
                "cardiac tamponade", "acute myocardial infarction", "free air in pericardium",
                // 呼吸
                "tension pneumothorax", "massive pulmonary embolism", "large pulmonary embolism",
                // 腹部
                "free air", "pneumoperitoneum", "ruptured spleen", "acute mesenteric ischemia",
                "bowel perforation", "perforated viscus", "acute appendicitis with perforation",
                // 感染
                "necrotizing fasciitis", "gas gangrene", "septic emboli",
                // 肿瘤
                "spinal cord compression", "superior vena cava syndrome"));

        KEYWORDS_BY_SEVERITY.put(FindingSeverity.URGENT, List.of(
                "pulmonary embolism", "deep vein thrombosis", "expanding aneurysm",
                "aortic aneurysm", "carotid dissection",
                "acute infarct", "acute cerebral infarction", "acute intracranial hemorrhage",
                "mass effect", "acute hydrocephalus",
                "large pneumothorax", "pneumothorax", "lung abscess", "empyema",
                "bowel obstruction", "small bowel obstruction", "large bowel obstruction",
                "acute cholecystitis", "acute pancreatitis", "splenic laceration",
                "hepatic laceration", "renal laceration",
                "abscess", "fluid collection", "acute osteomyelitis",
                "pathologic fracture", "suspicious mass", "likely malignancy"));

        KEYWORDS_BY_SEVERITY.put(FindingSeverity.HIGH, List.of(
                "pneumonia", "pyelonephritis", "cellulitis",
                "fracture", "displaced fracture", "comminuted fracture",
                "open fracture", "hip fracture",
                "suspicious nodule", "suspicious lesion", "concerning finding",
                "recommend biopsy", "cannot exclude malignancy"));

        CATEGORY_TERMS.put(FindingCategory.VASCULAR, List.of("aortic", "aneurysm", "hemorrhage", "bleeding", "embolism", "thrombosis"));
        CATEGORY_TERMS.put(FindingCategory.NEUROLOGICAL, List.of("stroke", "hematoma", "hemorrhage", "herniation", "hydrocephalus", "infarct"));
        CATEGORY_TERMS.put(FindingCategory.RESPIRATORY, List.of("pneumothorax", "lung", "pulmonary", "respiratory"));
        CATEGORY_TERMS.put(FindingCategory.ABDOMINAL, List.of("bowel", "spleen", "hepatic", "abdominal", "mesenteric", "appendicitis"));
        CATEGORY_TERMS.put(FindingCategory.CARDIAC, List.of("cardiac", "myocardial", "pericardium"));
        CATEGORY_TERMS.put(FindingCategory.INFECTIOUS, List.of("abscess", "necrotizing", "septic", "gangrene"));
        CATEGORY_TERMS.put(FindingCategory.ONCOLOGIC, List.of("mass", "malignancy", "suspicious", "nodule"));
        CATEGORY_TERMS.put(FindingCategory.MUSCULOSKELETAL, List.of("fracture", "bone"));
    }

    /**
     * 按 critical / urgent / high 顺序返回
     */
    public static Map<FindingSeverity, List<String>> keywordsBySeverity() {
        return Collections.unmodifiableMap(KEYWORDS_BY_SEVERITY);
    }

    public static FindingCategory categorize(String keyword) {
        String low = keyword.toLowerCase(Locale.ROOT);
        for (Map.Entry<FindingCategory, List<String>> entry : CATEGORY_TERMS.entrySet()) {
            for (String term : entry.getValue()) {
                if (low.contains(term)) return entry.getKey();
            }
        }
        return FindingCategory.OTHER;
    }
}
