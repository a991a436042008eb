package com.gdin.radiology.report.safety;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ReportSectionExtractorTest {
    private final ReportSectionExtractor extractor = new ReportSectionExtractor();

    @Test
    public void testHeaderOnItsOwnLine() {
        String report = """
                Indication:
                Chest pain

                FINDINGS:
                • Pulmonary arteries: patent
                • Lungs: clear

                IMPRESSION:
                No acute abnormality.

                Signed electronically by Dr. House""";

        assertEquals("• Pulmonary arteries: patent\n• Lungs: clear", extractor.findings(report));
        assertEquals("No acute abnormality.\n\nSigned electronically by Dr. House", extractor.impression(report));
    }

    @Test
    public void testInlineHeaderStopsAtNextHeader() {
        String report = "Findings: Clear lungs.\nNo effusion.\nImpression: Normal chest radiograph.";

        assertEquals("Clear lungs.\nNo effusion.", extractor.findings(report));
        assertEquals("Normal chest radiograph.", extractor.impression(report));
    }

    @Test
    public void testFrenchAliases() {
        String report = "Résultats :\nPas d'épanchement.\n\nConclusion :\nExamen normal.";

        assertEquals("Pas d'épanchement.", extractor.findings(report));
        assertEquals("Examen normal.", extractor.impression(report));
    }

    @Test
    public void testProseIsNotAHeader() {
        assertEquals("", extractor.findings("Findings show a small nodule."));
        assertEquals("", extractor.impression(null));
    }
}
