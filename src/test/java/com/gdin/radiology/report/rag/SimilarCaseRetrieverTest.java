package com.gdin.radiology.report.rag;

import com.gdin.radiology.report.models.SimilarCase;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class SimilarCaseRetrieverTest {
    @Mock
    private EmbeddingModel embeddingModel;
    @Mock
    private CaseVectorIndex caseVectorIndex;

    @InjectMocks
    private SimilarCaseRetriever similarCaseRetriever;

    private static Response<Embedding> embedding() {
        return Response.from(Embedding.from(new float[]{0.1f, 0.2f, 0.3f}));
    }

    @Test
    public void testUnavailableIndexReturnsEmpty() {
        when(caseVectorIndex.isAvailable()).thenReturn(false);
        assertTrue(similarCaseRetriever.search("chest pain", 3, "CT").isEmpty());
        verifyNoInteractions(embeddingModel);
    }

    @Test
    public void testEmbeddingFailureReturnsEmpty() {
        when(caseVectorIndex.isAvailable()).thenReturn(true);
        when(embeddingModel.embed("chest pain")).thenThrow(new RuntimeException("connection refused"));
        assertTrue(similarCaseRetriever.search("chest pain", 3, "CT").isEmpty());
    }

    @Test
    public void testHitsAreMappedClampedAndSorted() {
        when(caseVectorIndex.isAvailable()).thenReturn(true);
        when(embeddingModel.embed("dyspnea")).thenReturn(embedding());
        when(caseVectorIndex.search(any(float[].class), eq(3), eq("CT"))).thenReturn(List.of(
                IndexHit.builder().id("CT004").score(0.4)
                        .payload(Map.of("case_id", "CT004", "text", "Stable nodule", "category", "CT", "diagnosis", "Nodule")).build(),
                IndexHit.builder().id("CT001").score(1.3)
                        .payload(Map.of("text", "Pulmonary embolism", "category", "CT")).build(),
                IndexHit.builder().id("CT009").score(-0.2).payload(null).build()));

        List<SimilarCase> cases = similarCaseRetriever.search("dyspnea", 3, " CT ");

        assertEquals(List.of("CT001", "CT004", "CT009"), cases.stream().map(SimilarCase::getCaseId).toList());
        assertEquals(1.0, cases.get(0).getScore());
        assertEquals(0.0, cases.get(2).getScore());
        assertEquals("Stable nodule", cases.get(1).getText());
        assertEquals(Map.of("diagnosis", "Nodule"), cases.get(1).getMetadata());
        assertEquals("", cases.get(2).getText());
        assertNull(cases.get(2).getCategory());
    }

    @Test
    public void testBlankCategoryIsNotFiltered() {
        when(caseVectorIndex.isAvailable()).thenReturn(true);
        when(embeddingModel.embed("dyspnea")).thenReturn(embedding());
        when(caseVectorIndex.search(any(float[].class), anyInt(), any())).thenReturn(List.of());

        similarCaseRetriever.search("dyspnea", 2, "  ");

        verify(caseVectorIndex).search(any(float[].class), eq(2), isNull());
    }

    @SuppressWarnings("unchecked")
    @Test
    public void testAddCaseWritesTextAndIdIntoPayload() {
        when(caseVectorIndex.isAvailable()).thenReturn(true);
        when(embeddingModel.embed("Acute appendicitis")).thenReturn(embedding());

        assertTrue(similarCaseRetriever.addCase("CT003", "Acute appendicitis", Map.of("category", "CT")));

        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(caseVectorIndex).upsert(eq("CT003"), any(float[].class), payload.capture());
        assertEquals("CT003", payload.getValue().get("case_id"));
        assertEquals("Acute appendicitis", payload.getValue().get("text"));
        assertEquals("CT", payload.getValue().get("category"));
    }

    @Test
    public void testAddCaseFailsWhenIndexUnavailable() {
        when(caseVectorIndex.isAvailable()).thenReturn(false);
        assertFalse(similarCaseRetriever.addCase("CT003", "text", Map.of()));
        verify(caseVectorIndex).isAvailable();
        verifyNoInteractions(embeddingModel);
        assertFalse(similarCaseRetriever.addCase(" ", "text", Map.of()));
    }
}
