package com.gdin.radiology.report.summary;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LanguageDetectorTest {
    private final LanguageDetector detector = new LanguageDetector();

    @Test
    public void testDetect() {
        assertEquals("en", detector.detect("Findings: the lungs are clear. Impression: no acute abnormality."));
        assertEquals("fr", detector.detect("Résultats : pas de lésion. Conclusion : examen sans particularité."));
        assertEquals("ar", detector.detect("الخلاصة: لا توجد تشوهات"));
        assertEquals("en", detector.detect(""));
    }
}
