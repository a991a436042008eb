package com.gdin.radiology.report.generation;

import com.gdin.radiology.report.config.properties.RagProperties;
import com.gdin.radiology.report.exception.EmptyGenerationException;
import com.gdin.radiology.report.exception.PlaceholderResolutionException;
import com.gdin.radiology.report.llm.LlmFallbackChain;
import com.gdin.radiology.report.models.ReportMeta;
import com.gdin.radiology.report.models.SimilarCase;
import com.gdin.radiology.report.models.Template;
import com.gdin.radiology.report.prompts.ReportGenerationPrompts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ReportGeneratorTest {
    @Mock
    private LlmFallbackChain llmFallbackChain;
    @Spy
    private RagProperties ragProperties = new RagProperties();

    @InjectMocks
    private ReportGenerator reportGenerator;

    private final Template template = Template.builder()
            .id("ctpa_pe")
            .title("CT Pulmonary Angiography")
            .keywords(List.of("ctpa"))
            .skeleton("Referring Physician: {referrer}\nIndication:\n{indication}\nImpression:\n<fill>")
            .category("CT")
            .language("fr")
            .build();

    private final ReportMeta meta = ReportMeta.builder().referrer("dr.house@hospital.com").build();

    @Test
    public void testGeneratedTextIsTrimmed() {
        when(llmFallbackChain.generateContent(anyString(), anyString())).thenReturn("  REPORT TEXT \n");
        assertEquals("REPORT TEXT", reportGenerator.generate("chest pain", template, meta, List.of()));
    }

    @Test
    public void testBlankGenerationFails() {
        when(llmFallbackChain.generateContent(anyString(), anyString())).thenReturn("   ");
        assertThrows(EmptyGenerationException.class,
                () -> reportGenerator.generate("chest pain", template, meta, List.of()));
    }

    @Test
    public void testPromptCarriesSkeletonMetaLanguageAndCases() {
        when(llmFallbackChain.generateContent(anyString(), anyString())).thenReturn("OK");
        SimilarCase first = SimilarCase.builder().caseId("CT001").text("a".repeat(300)).score(0.8734).build();
        SimilarCase second = SimilarCase.builder().caseId("CT004").text("Stable nodule").score(0.5).build();

        reportGenerator.generate("  65yo with acute dyspnea, rule out PE ", template, meta, List.of(first, second));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmFallbackChain).generateContent(eq(ReportGenerationPrompts.SYSTEM_INSTRUCTION), prompt.capture());
        String userPrompt = prompt.getValue();
        assertTrue(userPrompt.contains("Referring Physician: dr.house@hospital.com\nIndication:\n65yo with acute dyspnea, rule out PE"));
        assertTrue(userPrompt.contains("Patient: N/A"));
        assertTrue(userPrompt.contains("Write the whole report in French"));
        assertTrue(userPrompt.contains("1. " + "a".repeat(200) + "... (similarity: 0.87)"));
        assertFalse(userPrompt.contains("a".repeat(201)));
        assertTrue(userPrompt.contains("2. Stable nodule... (similarity: 0.50)"));
    }

    @Test
    public void testSimilarCasesAreCappedByLimit() {
        ragProperties.setDefaultLimit(1);
        SimilarCase first = SimilarCase.builder().caseId("A").text("first case").score(0.9).build();
        SimilarCase second = SimilarCase.builder().caseId("B").text("second case").score(0.8).build();

        String userPrompt = reportGenerator.buildUserPrompt("x", template, meta, List.of(first, second));

        assertTrue(userPrompt.contains("1. first case"));
        assertFalse(userPrompt.contains("second case"));
    }

    @Test
    public void testUnresolvablePlaceholderStopsBeforeCallingModels() {
        Template broken = Template.builder().id("broken").title("Broken").skeleton("Ward: {ward}").build();
        assertThrows(PlaceholderResolutionException.class,
                () -> reportGenerator.generate("chest pain", broken, meta, List.of()));
        verifyNoInteractions(llmFallbackChain);
    }
}
