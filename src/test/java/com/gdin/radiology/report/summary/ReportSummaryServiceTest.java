package com.gdin.radiology.report.summary;

import com.gdin.radiology.report.exception.AllProvidersFailedException;
import com.gdin.radiology.report.llm.LlmFallbackChain;
import com.gdin.radiology.report.models.SummaryResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ReportSummaryServiceTest {
    private static final String REPORT = """
            Findings:
            • Pulmonary arteries: filling defects in the right lower lobe
            • Lungs: ok
            2) Right ventricle is not dilated

            Impression:
            Acute pulmonary embolism.""";

    @Mock
    private LlmFallbackChain llmFallbackChain;
    @Spy
    private LanguageDetector languageDetector = new LanguageDetector();

    @InjectMocks
    private ReportSummaryService reportSummaryService;

    @Test
    public void testSummaryAndConclusionAreSplitByParagraph() {
        when(llmFallbackChain.generateContent(anyString(), anyString()))
                .thenReturn("1. Segmental pulmonary embolism, right lower lobe.\n\nFindings answer the clinical question: start anticoagulation.");

        SummaryResult result = reportSummaryService.generateSummary(REPORT, "rule out PE");

        assertEquals("1. Segmental pulmonary embolism, right lower lobe.", result.getSummary());
        assertEquals("Findings answer the clinical question: start anticoagulation.", result.getConclusion());
        assertEquals("en", result.getLanguage());
        assertEquals(List.of("Pulmonary arteries: filling defects in the right lower lobe",
                "Right ventricle is not dilated"), result.getKeyFindings());
    }

    @Test
    public void testFrenchReportUsesFrenchLabels() {
        when(llmFallbackChain.generateContent(anyString(), anyString())).thenReturn("Examen normal.");
        String report = "Résultats :\nPas de lésion.\n\nConclusion :\nExamen normal, sans particularité.";

        SummaryResult result = reportSummaryService.generateSummary(report, "douleur", 50, null);

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(llmFallbackChain).generateContent(anyString(), userPrompt.capture());
        assertEquals("fr", result.getLanguage());
        assertEquals("", result.getConclusion());
        assertTrue(userPrompt.getValue().contains("SYNTHÈSE"));
        assertTrue(userPrompt.getValue().contains("50 words max"));
        assertTrue(userPrompt.getValue().contains("in French"));
    }

    @Test
    public void testFailureReturnsPlaceholderSummary() {
        when(llmFallbackChain.generateContent(anyString(), anyString()))
                .thenThrow(new AllProvidersFailedException(List.of()));

        SummaryResult result = reportSummaryService.generateSummary(REPORT, "rule out PE", 200, "en");

        assertEquals(ReportSummaryService.FAILED_SUMMARY, result.getSummary());
        assertTrue(result.getKeyFindings().isEmpty());
    }
}
